package works.graphstate.sqlserver;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.pool.HikariPool.PoolInitializationException;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.jetbrains.annotations.Nullable;
import org.jooq.DSLContext;
import org.jooq.Param;
import org.jooq.Record;
import org.jooq.SQLDialect;
import org.jooq.conf.Settings;
import org.jooq.exception.DataAccessException;
import org.jooq.impl.SQLDataType;
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
import static org.jooq.impl.DSL.val;
import static works.graphstate.logging.MappedDiagnosticContext.MDCScope;
import static works.graphstate.logging.MappedDiagnosticContext.setupMDC;
import static works.graphstate.util.Timestamps.fromUtcDateTime;
import static works.graphstate.util.Timestamps.now;
import static works.graphstate.util.Timestamps.toUtcDateTime;

/**
 * The open-source jOOQ distribution has no SQL Server dialect,
 * so everything here is plain SQL run through {@link SQLDialect#DEFAULT}.
 */
class SqlServerStatePersistenceImpl implements SqlServerStatePersistence {
	private final PersistenceSettings settings;
	private final SqlServerConnectionInfo connectionInfo;
	private final String instanceID = UUID.randomUUID().toString();
	private final StateJson json = new StateJson();
	private final Lifecycle lifecycle;
	private final Settings jooqSettings;
	private final CheckpointTable table;

	private volatile HikariDataSource dataSource;

	SqlServerStatePersistenceImpl(PersistenceSettings settings, SqlServerConnectionInfo connectionInfo) {
		this.settings = requireNonNull(settings);
		this.connectionInfo = requireNonNull(connectionInfo);
		this.lifecycle = new Lifecycle("SqlServerStatePersistence " + instanceID);
		this.jooqSettings = new Settings()
			.withQueryTimeout(queryTimeoutSeconds(settings.operationTimeoutMS()));
		this.table = new CheckpointTable(settings.tableName());
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
				connection.commit();
			} catch (SQLException | DataAccessException e) {
				throw new BackendConnectionException("Unable to create table \"" + table + "\"", e);
			}
			lifecycle.markInitialized();
			LOGGER.info("Initialized SQL Server table \"{}\"", table);
		}
	}

	private HikariDataSource createDataSource() {
		HikariConfig config = new HikariConfig();
		config.setPoolName("graphstate-" + BACKEND + "-" + instanceID);
		config.setJdbcUrl(connectionInfo.jdbcUrl());
		if (connectionInfo.user() != null) {
			config.setUsername(connectionInfo.user());
			config.setPassword(connectionInfo.password());
		}
		config.setMaximumPoolSize(settings.maxPoolSize());
		config.setMinimumIdle(Math.min(2, settings.maxPoolSize()));
		config.setConnectionTimeout(settings.connectionTimeoutMS());
		config.setInitializationFailTimeout(settings.connectionTimeoutMS());
		config.setAutoCommit(false);
		try {
			return new HikariDataSource(config);
		} catch (PoolInitializationException | IllegalArgumentException e) {
			throw new BackendConnectionException("Unable to connect to SQL Server at " + connectionInfo.redactedJdbcUrl(), e);
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
			Param<String> stateJson, metadataJson;
			try {
				stateJson = text(json.write(state));
				metadataJson = text(json.writeNullable(metadata));
			} catch (StateSerializationException e) {
				LOGGER.warn("Checkpoint {} not saved: unable to serialize", checkpointId, e);
				return false;
			}
			LOGGER.trace("state: {}", stateJson);
			Param<String> timestamp = val(SQL_TIMESTAMP.format(toUtcDateTime(now(settings.clock()))), SQLDataType.VARCHAR);
			Param<String> thread = text(threadId);
			Param<String> checkpoint = text(checkpointId);
			try (var connection = connection()) {
				int rows = dsl(connection).execute(table.merge,
					thread, checkpoint,
					stateJson, metadataJson, timestamp,
					thread, checkpoint, stateJson, metadataJson, timestamp, timestamp);
				connection.commit();
				LOGGER.debug("Merged {} row(s)", rows);
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
						.resultQuery(table.selectLatest, text(threadId))
						.fetchOptional()
						.map(this::toDocument);
				} else {
					result = dsl(connection)
						.resultQuery(table.selectByKey, text(threadId), text(checkpointId))
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
					.resultQuery(table.selectNewest, val(limit, SQLDataType.INTEGER), text(threadId))
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
			try (var connection = connection()) {
				int rows;
				if (checkpointId == null) {
					rows = dsl(connection).execute(table.deleteThread, text(threadId));
				} else {
					rows = dsl(connection).execute(table.deleteCheckpoint, text(threadId), text(checkpointId));
				}
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
		return using(connection, SQLDialect.DEFAULT, jooqSettings);
	}

	private static Param<String> text(@Nullable String value) {
		return val(value, SQLDataType.NVARCHAR);
	}

	private StateDocument toDocument(Record r) {
		return new StateDocument(
			r.get("thread_id", String.class),
			r.get("checkpoint_id", String.class),
			json.read(r.get("state", String.class), "state"),
			json.readNullable(r.get("metadata", String.class), "metadata"),
			timestamp(r, "created_at"),
			timestamp(r, "updated_at"));
	}

	private static Instant timestamp(Record r, String column) {
		String text = r.get(column, String.class);
		if (text == null) {
			throw new StateSerializationException("Stored " + column + " is missing");
		}
		try {
			return fromUtcDateTime(LocalDateTime.parse(text));
		} catch (DateTimeParseException e) {
			throw new StateSerializationException("Stored " + column + " is not a timestamp: " + text, e);
		}
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

	private static final Set<String> TIMEOUT_SQL_STATES = Set.of("HY008");
	private static final DateTimeFormatter SQL_TIMESTAMP = DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSSSSS");

	private static final Logger LOGGER = LoggerFactory.getLogger(SqlServerStatePersistenceImpl.class);
}
