package works.graphstate.exceptions;

/**
 * A stored payload is not valid JSON, or is valid JSON of the wrong shape.
 * This indicates corrupted data rather than a transient failure.
 */
public class StateSerializationException extends StatePersistenceException {
	public StateSerializationException(String message) {
		super(message);
	}

	public StateSerializationException(String message, Throwable cause) {
		super(message, cause);
	}

	public StateSerializationException(Throwable cause) {
		super(cause);
	}
}
