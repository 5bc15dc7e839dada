package works.graphstate.cosmos;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import works.graphstate.exceptions.ConfigurationException;

/**
 * The parts of a Cosmos DB connection string
 * ({@code AccountEndpoint=https://...;AccountKey=...;}) that the client needs.
 * Keys are case-insensitive and may appear in any order; other keys are ignored.
 */
public record CosmosConnectionInfo(String endpoint, String key) {

	public static CosmosConnectionInfo parse(String connectionString) {
		if (connectionString == null) {
			throw new ConfigurationException("Cosmos DB connection string is missing");
		}
		String endpoint = null;
		String key = null;
		for (String part: connectionString.split(";")) {
			int equals = part.indexOf('=');
			if (equals < 0) {
				continue;
			}
			// Account keys are base64, so they may contain '=' themselves
			String name = part.substring(0, equals).trim().toLowerCase(Locale.ROOT);
			String value = part.substring(equals + 1).trim();
			switch (name) {
				case "accountendpoint":
					endpoint = value;
					break;
				case "accountkey":
					key = value;
					break;
				default:
					break;
			}
		}
		if (endpoint == null || endpoint.isEmpty()) {
			throw new ConfigurationException("Cosmos DB connection string has no AccountEndpoint");
		}
		if (key == null || key.isEmpty()) {
			throw new ConfigurationException("Cosmos DB connection string has no AccountKey");
		}
		try {
			URI uri = new URI(endpoint);
			if (uri.getHost() == null || !("https".equalsIgnoreCase(uri.getScheme()) || "http".equalsIgnoreCase(uri.getScheme()))) {
				throw new ConfigurationException("Cosmos DB AccountEndpoint must be an http(s) URL: " + endpoint);
			}
		} catch (URISyntaxException e) {
			throw new ConfigurationException("Cosmos DB AccountEndpoint is not a valid URL: " + endpoint, e);
		}
		return new CosmosConnectionInfo(endpoint, key);
	}

	@Override
	public String toString() {
		return "CosmosConnectionInfo[endpoint=" + endpoint + ", key=****]";
	}
}
