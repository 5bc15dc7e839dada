package works.graphstate.sqlserver;

import org.jooq.DSLContext;

/**
 * DDL and DML for one checkpoint table, as SQL Server plain SQL.
 * <p>
 * The table name is validated as a plain identifier before it gets here,
 * so it can be bracket-quoted and interpolated directly.
 * Columns hold UTC wall-clock times.
 */
final class CheckpointTable {
	final String tableName;
	final String quoted;

	final String selectByKey;
	final String selectLatest;
	final String selectNewest;
	final String merge;
	final String deleteThread;
	final String deleteCheckpoint;

	CheckpointTable(String tableName) {
		this.tableName = tableName;
		this.quoted = "[" + tableName + "]";
		String columns = "thread_id, checkpoint_id, state, metadata, created_at, updated_at";
		String selected = "c.thread_id, c.checkpoint_id, c.state, c.metadata, "
			+ utcText("c.created_at") + " AS created_at, " + utcText("c.updated_at") + " AS updated_at";
		String timestamp = "CONVERT(DATETIME2(6), ?, 126)";

		selectByKey = "SELECT " + selected + " FROM " + quoted + " AS c"
			+ " WHERE c.thread_id = ? AND c.checkpoint_id = ?";
		selectLatest = "SELECT TOP (1) " + selected + " FROM " + quoted + " AS c"
			+ " WHERE c.thread_id = ? ORDER BY c.created_at DESC, c.id DESC";
		selectNewest = "SELECT TOP (?) " + selected + " FROM " + quoted + " AS c"
			+ " WHERE c.thread_id = ? ORDER BY c.created_at DESC, c.id DESC";
		merge = "MERGE " + quoted + " WITH (HOLDLOCK) AS target"
			+ " USING (SELECT ? AS thread_id, ? AS checkpoint_id) AS source"
			+ " ON target.thread_id = source.thread_id AND target.checkpoint_id = source.checkpoint_id"
			+ " WHEN MATCHED THEN UPDATE SET state = ?, metadata = ?, updated_at = " + timestamp
			+ " WHEN NOT MATCHED THEN INSERT (" + columns + ") VALUES (?, ?, ?, ?, " + timestamp + ", " + timestamp + ");";
		deleteThread = "DELETE FROM " + quoted + " WHERE thread_id = ?";
		deleteCheckpoint = "DELETE FROM " + quoted + " WHERE thread_id = ? AND checkpoint_id = ?";
	}

	/**
	 * Creates the table and its indexes if they're not already there.
	 * Safe to run repeatedly.
	 */
	void ensureExists(DSLContext dsl) {
		dsl.execute("IF OBJECT_ID(N'" + quoted + "', N'U') IS NULL"
			+ " CREATE TABLE " + quoted + " ("
			+ " id BIGINT IDENTITY(1,1) NOT NULL CONSTRAINT [pk_" + tableName + "] PRIMARY KEY,"
			+ " thread_id NVARCHAR(255) NOT NULL,"
			+ " checkpoint_id NVARCHAR(255) NOT NULL,"
			+ " state NVARCHAR(MAX) NOT NULL,"
			+ " metadata NVARCHAR(MAX) NULL,"
			+ " created_at DATETIME2(6) NOT NULL,"
			+ " updated_at DATETIME2(6) NOT NULL,"
			+ " CONSTRAINT [uq_" + tableName + "_thread_checkpoint] UNIQUE (thread_id, checkpoint_id)"
			+ " )");
		ensureIndex(dsl, "idx_" + tableName + "_thread_id", "thread_id");
		ensureIndex(dsl, "idx_" + tableName + "_created_at", "created_at DESC");
	}

	private void ensureIndex(DSLContext dsl, String indexName, String columns) {
		dsl.execute("IF NOT EXISTS (SELECT 1 FROM sys.indexes WHERE name = N'" + indexName + "'"
			+ " AND object_id = OBJECT_ID(N'" + quoted + "'))"
			+ " CREATE INDEX [" + indexName + "] ON " + quoted + " (" + columns + ")");
	}

	/**
	 * Timestamps cross the wire as ISO-8601 text (style 126) so that no JDBC
	 * conversion through the JVM's default time zone gets a chance to shift them.
	 */
	private static String utcText(String column) {
		return "CONVERT(VARCHAR(27), " + column + ", 126)";
	}

	void drop(DSLContext dsl) {
		dsl.execute("DROP TABLE IF EXISTS " + quoted);
	}

	@Override
	public String toString() {
		return tableName;
	}
}
