package works.graphstate.selector;

import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.graphstate.PersistenceFactory;
import works.graphstate.PersistenceSettings;
import works.graphstate.StatePersistence;
import works.graphstate.cosmos.CosmosSettings;
import works.graphstate.cosmos.CosmosStatePersistence;
import works.graphstate.exceptions.ConfigurationException;
import works.graphstate.postgres.PostgresStatePersistence;
import works.graphstate.sqlserver.SqlServerStatePersistence;

/**
 * Builds the right {@link StatePersistence} for a connection string.
 * <p>
 * Each call returns a fresh, uninitialized instance, owned by the caller.
 * No connection is opened until {@link StatePersistence#initialize()}.
 */
public final class BackendSelector {
	private BackendSelector() { }

	/**
	 * Like {@link #create(String, String, PersistenceConfig)} with
	 * fallbacks read from {@link PersistenceConfig#fromEnvironment() the environment}.
	 */
	public static StatePersistence create(@Nullable String connectionString, @Nullable String tableName) {
		return create(connectionString, tableName, PersistenceConfig.fromEnvironment());
	}

	/**
	 * @param connectionString if null, {@link PersistenceConfig#connectionString() defaults.connectionString} is used
	 * @param tableName if null, {@link PersistenceConfig#tableName() defaults.tableName} is used,
	 *                  and failing that, the table name in {@link PersistenceConfig#settings() defaults.settings}
	 * @throws ConfigurationException if there's no connection string, or the table name is invalid
	 * @throws works.graphstate.exceptions.UnsupportedBackendException if the connection string isn't recognized
	 */
	public static StatePersistence create(@Nullable String connectionString, @Nullable String tableName, PersistenceConfig defaults) {
		String effectiveConnectionString = (connectionString != null) ? connectionString : defaults.connectionString();
		if (effectiveConnectionString == null || effectiveConnectionString.isEmpty()) {
			throw new ConfigurationException("No connection string provided. Either pass one explicitly or set the "
				+ PersistenceConfig.CONNECTION_STRING_VARIABLE + " environment variable.");
		}
		String effectiveTableName = (tableName != null) ? tableName
			: (defaults.tableName() != null) ? defaults.tableName()
			: defaults.settings().tableName();
		PersistenceSettings settings = defaults.settings().toBuilder()
			.tableName(effectiveTableName)
			.build();
		BackendType type = BackendType.detect(effectiveConnectionString);
		LOGGER.debug("Selected {} for table \"{}\"", type, effectiveTableName);
		return factory(type, settings, defaults.cosmos()).build(effectiveConnectionString);
	}

	/**
	 * @throws ConfigurationException if the settings are invalid
	 */
	public static PersistenceFactory factory(BackendType type, PersistenceSettings settings, CosmosSettings cosmosSettings) {
		switch (type) {
			case COSMOS_DB:
				return CosmosStatePersistence.factory(settings, cosmosSettings);
			case POSTGRESQL:
				return PostgresStatePersistence.factory(settings);
			case SQL_SERVER:
				return SqlServerStatePersistence.factory(settings);
			default:
				throw new AssertionError("Unexpected backend type: " + type);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(BackendSelector.class);
}
