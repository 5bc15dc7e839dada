package works.graphstate.postgres;

import java.time.LocalDateTime;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.JSON;
import org.jooq.Record;
import org.jooq.Table;
import org.jooq.impl.SQLDataType;

import static org.jooq.impl.DSL.constraint;
import static org.jooq.impl.DSL.field;
import static org.jooq.impl.DSL.name;
import static org.jooq.impl.DSL.primaryKey;
import static org.jooq.impl.DSL.table;
import static org.jooq.impl.SQLDataType.BIGINT;
import static org.jooq.impl.SQLDataType.LOCALDATETIME;
import static org.jooq.impl.SQLDataType.VARCHAR;

/**
 * jOOQ references for one checkpoint table.
 * The table name is configurable, so these are built at runtime rather than generated.
 */
final class CheckpointTable {
	final String tableName;
	final Table<Record> TABLE;
	final Field<Long> ID = field(name("id"), BIGINT.nullable(false).identity(true));
	final Field<String> THREAD_ID = field(name("thread_id"), VARCHAR(255).nullable(false));
	final Field<String> CHECKPOINT_ID = field(name("checkpoint_id"), VARCHAR(255).nullable(false));
	final Field<JSON> STATE = field(name("state"), SQLDataType.JSON.nullable(false));
	final Field<JSON> METADATA = field(name("metadata"), SQLDataType.JSON.nullable(true));
	final Field<LocalDateTime> CREATED_AT = field(name("created_at"), LOCALDATETIME(6).nullable(false));
	final Field<LocalDateTime> UPDATED_AT = field(name("updated_at"), LOCALDATETIME(6).nullable(false));

	CheckpointTable(String tableName) {
		this.tableName = tableName;
		this.TABLE = table(name(tableName));
	}

	/**
	 * Creates the table and its indexes if they're not already there.
	 * Safe to run repeatedly.
	 */
	void ensureExists(DSLContext dsl) {
		dsl.createTableIfNotExists(TABLE)
			.columns(ID, THREAD_ID, CHECKPOINT_ID, STATE, METADATA, CREATED_AT, UPDATED_AT)
			.constraints(
				primaryKey(ID),
				constraint(name("uq_" + tableName + "_thread_checkpoint")).unique(THREAD_ID, CHECKPOINT_ID))
			.execute();
		dsl.createIndexIfNotExists(name("idx_" + tableName + "_thread_id"))
			.on(TABLE, THREAD_ID)
			.execute();
		dsl.createIndexIfNotExists(name("idx_" + tableName + "_created_at"))
			.on(TABLE, CREATED_AT.desc())
			.execute();
	}

	void drop(DSLContext dsl) {
		dsl.dropTableIfExists(TABLE).execute();
	}

	@Override
	public String toString() {
		return tableName;
	}
}
