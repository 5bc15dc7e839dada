package works.graphstate.exceptions;

/**
 * Base class for failures reported by a {@link works.graphstate.StatePersistence}.
 * <p>
 * Programmer errors are not in this hierarchy: invalid arguments throw
 * {@link IllegalArgumentException}, and lifecycle misuse throws
 * {@link InvalidLifecycleStateException}.
 */
public class StatePersistenceException extends RuntimeException {
	public StatePersistenceException(String message) {
		super(message);
	}

	public StatePersistenceException(String message, Throwable cause) {
		super(message, cause);
	}

	public StatePersistenceException(Throwable cause) {
		super(cause);
	}
}
