package works.graphstate.postgres;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.pool.HikariPool.PoolInitializationException;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.jetbrains.annotations.Nullable;
import org.jooq.Condition;
import org.jooq.DSLContext;
import org.jooq.JSON;
import org.jooq.Record;
import org.jooq.SQLDialect;
import org.jooq.conf.Settings;
import org.jooq.exception.DataAccessException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.databind.node.ObjectNode;
import works.graphstate.PersistenceSettings;
import works.graphstate.StateDocument;
import works.graphstate.exceptions.BackendConnectionException;
import works.graphstate.exceptions.PersistenceTimeoutException;
import works.graphstate.exceptions.StatePersistenceException;
import works.graphstate.exceptions.StateSerializationException;
import works.graphstate.json.StateJson;
import works.graphstate.util.Arguments;
import works.graphstate.util.Lifecycle;
import works.graphstate.util.Lifecycle.Phase;

import static java.util.Objects.requireNonNull;
import static org.jooq.impl.DSL.using;
import static works.graphstate.logging.MappedDiagnosticContext.MDCScope;
import static works.graphstate.logging.MappedDiagnosticContext.setupMDC;
import static works.graphstate.util.Timestamps.fromUtcDateTime;
import static works.graphstate.util.Timestamps.now;
import static works.graphstate.util.Timestamps.toUtcDateTime;

class PostgresStatePersistenceImpl implements PostgresStatePersistence {
	private final PersistenceSettings settings;
	private final PostgresConnectionInfo connectionInfo;
	private final String instanceID = UUID.randomUUID().toString();
	private final StateJson json = new StateJson();
	private final Lifecycle lifecycle;
	private final Settings jooqSettings;

	// jOOQ references
	private final CheckpointTable table;
	private final org.jooq.Table<Record> TABLE;
	private final org.jooq.Field<Long> ID;
	private final org.jooq.Field<String> THREAD_ID;
	private final org.jooq.Field<String> CHECKPOINT_ID;
	private final org.jooq.Field<JSON> STATE;
	private final org.jooq.Field<JSON> METADATA;
	private final org.jooq.Field<LocalDateTime> CREATED_AT;
	private final org.jooq.Field<LocalDateTime> UPDATED_AT;

	private volatile HikariDataSource dataSource;

	PostgresStatePersistenceImpl(PersistenceSettings settings, PostgresConnectionInfo connectionInfo) {
		this.settings = requireNonNull(settings);
		this.connectionInfo = requireNonNull(connectionInfo);
		this.lifecycle = new Lifecycle("PostgresStatePersistence " + instanceID);
		this.jooqSettings = new Settings()
			.withQueryTimeout(queryTimeoutSeconds(settings.operationTimeoutMS()));

		table = new CheckpointTable(settings.tableName());
		TABLE = table.TABLE;
		ID = table.ID;
		THREAD_ID = table.THREAD_ID;
		CHECKPOINT_ID = table.CHECKPOINT_ID;
		STATE = table.STATE;
		METADATA = table.METADATA;
		CREATED_AT = table.CREATED_AT;
		UPDATED_AT = table.UPDATED_AT;
	}

	@Override
	public String backend() {
		return BACKEND;
	}

	@Override
	public String instanceID() {
		return instanceID;
	}

	@Override
	public synchronized void initialize() {
		lifecycle.checkNotClosed();
		try (MDCScope __ = setupMDC(BACKEND, instanceID)) {
			if (dataSource == null) {
				LOGGER.debug("Opening connection pool for {}", connectionInfo);
				dataSource = createDataSource();
			}
			try (var connection = dataSource.getConnection()) {
				table.ensureExists(dsl(connection));
				// When we say "ensure the table exists", we mean it
				connection.commit();
			} catch (SQLException | DataAccessException e) {
				throw new BackendConnectionException("Unable to create table \"" + table + "\"", e);
			}
			lifecycle.markInitialized();
			LOGGER.info("Initialized PostgreSQL table \"{}\"", table);
		}
	}

	private HikariDataSource createDataSource() {
		HikariConfig config = new HikariConfig();
		config.setPoolName("graphstate-" + BACKEND + "-" + instanceID);
		config.setJdbcUrl(connectionInfo.jdbcUrl());
		config.setUsername(connectionInfo.user());
		config.setPassword(connectionInfo.password());
		config.setMaximumPoolSize(settings.maxPoolSize());
		config.setMinimumIdle(Math.min(2, settings.maxPoolSize()));
		config.setConnectionTimeout(settings.connectionTimeoutMS());
		config.setInitializationFailTimeout(settings.connectionTimeoutMS());
		// autoCommit is an idiotic default
		config.setAutoCommit(false);
		try {
			return new HikariDataSource(config);
		} catch (PoolInitializationException | IllegalArgumentException e) {
			throw new BackendConnectionException("Unable to connect to PostgreSQL at " + connectionInfo.jdbcUrl(), e);
		}
	}

	@Override
	public boolean saveState(String threadId, String checkpointId, ObjectNode state, @Nullable ObjectNode metadata) {
		Arguments.threadId(threadId);
		Arguments.checkpointId(checkpointId);
		Arguments.state(state);
		try (
			var __ = lifecycle.begin("saveState");
			MDCScope ___ = setupMDC(BACKEND, instanceID, threadId)
		) {
			LOGGER.debug("saveState({}, {})", threadId, checkpointId);
			JSON stateJson, metadataJson;
			try {
				stateJson = JSON.valueOf(json.write(state));
				String metadataText = json.writeNullable(metadata);
				metadataJson = (metadataText == null) ? null : JSON.valueOf(metadataText);
			} catch (StateSerializationException e) {
				LOGGER.warn("Checkpoint {} not saved: unable to serialize", checkpointId, e);
				return false;
			}
			LOGGER.trace("state: {}", stateJson);
			LocalDateTime timestamp = toUtcDateTime(now(settings.clock()));
			try (var connection = connection()) {
				int rows = dsl(connection)
					.insertInto(TABLE)
					.columns(THREAD_ID, CHECKPOINT_ID, STATE, METADATA, CREATED_AT, UPDATED_AT)
					.values(threadId, checkpointId, stateJson, metadataJson, timestamp, timestamp)
					.onConflict(THREAD_ID, CHECKPOINT_ID)
					.doUpdate()
					.set(STATE, stateJson)
					.set(METADATA, metadataJson)
					.set(UPDATED_AT, timestamp)
					.execute();
				connection.commit();
				LOGGER.debug("Upserted {} row(s)", rows);
				return true;
			} catch (SQLException | DataAccessException e) {
				LOGGER.warn("Checkpoint {} not saved", checkpointId, translate("saveState", e));
				return false;
			}
		}
	}

	@Override
	public Optional<StateDocument> loadState(String threadId, @Nullable String checkpointId) {
		Arguments.threadId(threadId);
		Arguments.optionalCheckpointId(checkpointId);
		try (
			var __ = lifecycle.begin("loadState");
			MDCScope ___ = setupMDC(BACKEND, instanceID, threadId)
		) {
			LOGGER.debug("loadState({}, {})", threadId, checkpointId);
			try (var connection = connection()) {
				Optional<StateDocument> result;
				if (checkpointId == null) {
					result = dsl(connection)
						.select(THREAD_ID, CHECKPOINT_ID, STATE, METADATA, CREATED_AT, UPDATED_AT)
						.from(TABLE)
						.where(THREAD_ID.eq(threadId))
						.orderBy(CREATED_AT.desc(), ID.desc())
						.limit(1)
						.fetchOptional()
						.map(this::toDocument);
				} else {
					result = dsl(connection)
						.select(THREAD_ID, CHECKPOINT_ID, STATE, METADATA, CREATED_AT, UPDATED_AT)
						.from(TABLE)
						.where(THREAD_ID.eq(threadId).and(CHECKPOINT_ID.eq(checkpointId)))
						.fetchOptional()
						.map(this::toDocument);
				}
				connection.commit();
				return result;
			} catch (SQLException | DataAccessException e) {
				throw translate("loadState", e);
			}
		}
	}

	@Override
	public List<StateDocument> listCheckpoints(String threadId, int limit) {
		Arguments.threadId(threadId);
		Arguments.limit(limit);
		try (
			var __ = lifecycle.begin("listCheckpoints");
			MDCScope ___ = setupMDC(BACKEND, instanceID, threadId)
		) {
			LOGGER.debug("listCheckpoints({}, {})", threadId, limit);
			if (limit == 0) {
				return List.of();
			}
			try (var connection = connection()) {
				var records = dsl(connection)
					.select(THREAD_ID, CHECKPOINT_ID, STATE, METADATA, CREATED_AT, UPDATED_AT)
					.from(TABLE)
					.where(THREAD_ID.eq(threadId))
					.orderBy(CREATED_AT.desc(), ID.desc())
					.limit(limit)
					.fetch();
				connection.commit();
				return records.stream()
					.map(this::toDocument)
					.toList();
			} catch (SQLException | DataAccessException e) {
				throw translate("listCheckpoints", e);
			}
		}
	}

	@Override
	public boolean deleteState(String threadId, @Nullable String checkpointId) {
		Arguments.threadId(threadId);
		Arguments.optionalCheckpointId(checkpointId);
		try (
			var __ = lifecycle.begin("deleteState");
			MDCScope ___ = setupMDC(BACKEND, instanceID, threadId)
		) {
			LOGGER.debug("deleteState({}, {})", threadId, checkpointId);
			Condition condition = THREAD_ID.eq(threadId);
			if (checkpointId != null) {
				condition = condition.and(CHECKPOINT_ID.eq(checkpointId));
			}
			try (var connection = connection()) {
				int rows = dsl(connection)
					.deleteFrom(TABLE)
					.where(condition)
					.execute();
				connection.commit();
				LOGGER.debug("Deleted {} row(s)", rows);
				return true;
			} catch (SQLException | DataAccessException e) {
				LOGGER.warn("Checkpoints not deleted", translate("deleteState", e));
				return false;
			}
		}
	}

	@Override
	public synchronized void close() {
		Phase previous = lifecycle.beginClose();
		if (previous == Phase.CLOSED) {
			return;
		}
		try (MDCScope __ = setupMDC(BACKEND, instanceID)) {
			LOGGER.debug("Closing");
			try {
				if (!lifecycle.awaitQuiescence(settings.closeTimeoutMS())) {
					LOGGER.warn("Closing connection pool with {} operation(s) still in flight", lifecycle.inFlight());
				}
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				LOGGER.debug("Interrupted while waiting for operations to finish", e);
			}
			HikariDataSource ds = dataSource;
			if (ds != null) {
				dataSource = null;
				ds.close();
			}
		}
	}

	/**
	 * For tests.
	 */
	void dropTable() {
		try (var connection = connection()) {
			table.drop(dsl(connection));
			connection.commit();
		} catch (SQLException e) {
			throw new BackendConnectionException("Unable to drop table \"" + table + "\"", e);
		}
	}

	private Connection connection() throws SQLException {
		HikariDataSource ds = dataSource;
		if (ds == null) {
			throw new SQLException("Connection pool has been disposed");
		}
		return ds.getConnection();
	}

	private DSLContext dsl(Connection connection) {
		return using(connection, SQLDialect.POSTGRES, jooqSettings);
	}

	private StateDocument toDocument(Record r) {
		JSON metadata = r.get(METADATA);
		return new StateDocument(
			r.get(THREAD_ID),
			r.get(CHECKPOINT_ID),
			json.read(r.get(STATE).data(), "state"),
			(metadata == null) ? null : json.read(metadata.data(), "metadata"),
			fromUtcDateTime(r.get(CREATED_AT)),
			fromUtcDateTime(r.get(UPDATED_AT)));
	}

	private StatePersistenceException translate(String operation, Exception e) {
		SQLException sqlException = (e instanceof SQLException s) ? s
			: (e instanceof DataAccessException d) ? d.getCause(SQLException.class)
			: null;
		if (sqlException instanceof SQLTimeoutException
			|| (sqlException != null && TIMEOUT_SQL_STATES.contains(sqlException.getSQLState()))) {
			return new PersistenceTimeoutException(operation + " exceeded " + settings.operationTimeoutMS() + " ms", e);
		}
		return new BackendConnectionException(operation + " failed on table \"" + table + "\"", e);
	}

	static int queryTimeoutSeconds(long operationTimeoutMS) {
		return (int) Math.max(1, Math.min(Integer.MAX_VALUE, (operationTimeoutMS + 999) / 1000));
	}

	/**
	 * 57014 is query_canceled, which is what a statement timeout produces.
	 */
	private static final Set<String> TIMEOUT_SQL_STATES = Set.of("57014", "HY008");

	private static final Logger LOGGER = LoggerFactory.getLogger(PostgresStatePersistenceImpl.class);
}
