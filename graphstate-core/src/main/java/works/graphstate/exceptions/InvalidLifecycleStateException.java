package works.graphstate.exceptions;

/**
 * Thrown when an operation is invoked on a {@link works.graphstate.StatePersistence}
 * that is not in the right lifecycle phase: before {@link works.graphstate.StatePersistence#initialize initialize}
 * or after {@link works.graphstate.StatePersistence#close close}.
 */
public class InvalidLifecycleStateException extends IllegalStateException {
	public InvalidLifecycleStateException(String message) {
		super(message);
	}
}
