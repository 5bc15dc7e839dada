package works.graphstate.exceptions;

/**
 * An operation was aborted because it exceeded its deadline.
 * The connection it was using has been returned to the pool.
 */
public class PersistenceTimeoutException extends StatePersistenceException {
	public PersistenceTimeoutException(String message) {
		super(message);
	}

	public PersistenceTimeoutException(String message, Throwable cause) {
		super(message, cause);
	}

	public PersistenceTimeoutException(Throwable cause) {
		super(cause);
	}
}
