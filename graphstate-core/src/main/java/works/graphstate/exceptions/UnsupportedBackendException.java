package works.graphstate.exceptions;

/**
 * The connection string does not match any supported backend.
 */
public class UnsupportedBackendException extends ConfigurationException {
	public UnsupportedBackendException(String message) {
		super(message);
	}

	public UnsupportedBackendException(String message, Throwable cause) {
		super(message, cause);
	}

	public UnsupportedBackendException(Throwable cause) {
		super(cause);
	}
}
