package works.graphstate.spring.boot;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Anything left null falls back to the corresponding default in
 * {@link works.graphstate.PersistenceSettings}, except that
 * {@code connectionString} and {@code tableName} first fall back to the
 * {@code DATABASE_CONNECTION_STRING} and {@code DATABASE_TABLE_NAME} environment variables.
 */
@ConfigurationProperties(prefix = "graphstate")
public record GraphStateProperties(
	String connectionString,
	String tableName,
	Duration operationTimeout,
	Integer maxPoolSize,
	Duration connectionTimeout,
	Duration closeTimeout,
	Boolean initializeOnStartup,
	Cosmos cosmos
) {
	public record Cosmos(
		String database,
		Integer throughput,
		Integer maxConflictRetries,
		Boolean gatewayMode
	) { }
}
