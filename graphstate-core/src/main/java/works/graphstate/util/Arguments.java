package works.graphstate.util;

import org.jetbrains.annotations.Nullable;
import tools.jackson.databind.node.ObjectNode;

import static java.util.Objects.requireNonNull;

/**
 * Argument checks shared by every {@link works.graphstate.StatePersistence} implementation,
 * so they all reject the same inputs the same way, before touching the backend.
 */
public final class Arguments {
	private Arguments() { }

	public static String threadId(String threadId) {
		requireNonNull(threadId, "threadId");
		if (threadId.isBlank()) {
			throw new IllegalArgumentException("threadId must not be blank");
		}
		return threadId;
	}

	/**
	 * @return the argument unchanged; null stays null, since it means "unspecified"
	 */
	public static @Nullable String optionalCheckpointId(@Nullable String checkpointId) {
		if (checkpointId != null && checkpointId.isBlank()) {
			throw new IllegalArgumentException("checkpointId must not be blank");
		}
		return checkpointId;
	}

	public static String checkpointId(String checkpointId) {
		requireNonNull(checkpointId, "checkpointId");
		return optionalCheckpointId(checkpointId);
	}

	public static ObjectNode state(ObjectNode state) {
		return requireNonNull(state, "state");
	}

	public static int limit(int limit) {
		if (limit < 0) {
			throw new IllegalArgumentException("limit must not be negative: " + limit);
		}
		return limit;
	}
}
