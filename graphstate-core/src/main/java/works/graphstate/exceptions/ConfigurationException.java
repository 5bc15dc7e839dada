package works.graphstate.exceptions;

/**
 * The persistence layer could not be configured: a connection string is missing
 * or malformed, or a setting is out of range.
 * Thrown before any connection is attempted; retrying will not help.
 */
public class ConfigurationException extends StatePersistenceException {
	public ConfigurationException(String message) {
		super(message);
	}

	public ConfigurationException(String message, Throwable cause) {
		super(message, cause);
	}

	public ConfigurationException(Throwable cause) {
		super(cause);
	}
}
