package works.graphstate.cosmos;

import works.graphstate.PersistenceFactory;
import works.graphstate.PersistenceSettings;
import works.graphstate.StatePersistence;

/**
 * Stores checkpoints as documents in an Azure Cosmos DB container
 * partitioned by {@code /thread_id}.
 * <p>
 * Accepts connection strings of the form
 * {@code AccountEndpoint=https://account.documents.azure.com:443/;AccountKey=...;}
 */
public interface CosmosStatePersistence extends StatePersistence {
	String BACKEND = "cosmosdb";

	static PersistenceFactory factory(PersistenceSettings settings, CosmosSettings cosmosSettings) {
		settings.validate();
		cosmosSettings.validate();
		return connectionString -> new CosmosStatePersistenceImpl(
			settings,
			cosmosSettings,
			CosmosConnectionInfo.parse(connectionString));
	}

	static PersistenceFactory factory(PersistenceSettings settings) {
		return factory(settings, CosmosSettings.defaults());
	}
}
