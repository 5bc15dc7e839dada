package works.graphstate.exceptions;

/**
 * The backend could not be reached, rejected our credentials,
 * or could not lend us a connection in time.
 * Callers may retry with backoff; the persistence layer does not retry on its own.
 */
public class BackendConnectionException extends StatePersistenceException {
	public BackendConnectionException(String message) {
		super(message);
	}

	public BackendConnectionException(String message, Throwable cause) {
		super(message, cause);
	}

	public BackendConnectionException(Throwable cause) {
		super(cause);
	}
}
