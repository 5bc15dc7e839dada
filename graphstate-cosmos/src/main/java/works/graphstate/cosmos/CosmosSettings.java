package works.graphstate.cosmos;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;
import works.graphstate.exceptions.ConfigurationException;

/**
 * Settings that only make sense for Cosmos DB.
 * The container name comes from {@link works.graphstate.PersistenceSettings#tableName()}.
 */
@Value
@Builder(toBuilder = true)
public class CosmosSettings {
	@Default String database = "langgraph_db";

	/**
	 * Manual throughput, in request units per second, provisioned on the container when it's created.
	 * Has no effect on an existing container.
	 */
	@Default int throughput = 400;

	/**
	 * How many more times a save goes back to creating the document
	 * when a concurrent delete removes it before it can be patched.
	 */
	@Default int maxConflictRetries = 3;

	/**
	 * Use HTTPS gateway connections instead of direct TCP.
	 * The local emulator and some firewalled networks need this.
	 * Only in gateway mode does {@link works.graphstate.PersistenceSettings#maxPoolSize()} bound the connection pool.
	 */
	@Default boolean gatewayMode = false;

	public static CosmosSettings defaults() {
		return builder().build();
	}

	public void validate() {
		if (database == null || database.isBlank()) {
			throw new ConfigurationException("Cosmos database name must not be blank");
		}
		if (throughput < 400) {
			throw new ConfigurationException("Cosmos throughput must be at least 400 RU/s: " + throughput);
		}
		if (maxConflictRetries < 0) {
			throw new ConfigurationException("maxConflictRetries must not be negative: " + maxConflictRetries);
		}
	}
}
