package works.graphstate;

import java.time.Instant;
import java.util.Optional;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import tools.jackson.databind.node.ObjectNode;

import static java.util.Objects.requireNonNull;

/**
 * One stored checkpoint.
 * <p>
 * {@code state} and {@code metadata} are opaque to the persistence layer.
 * The record holds private copies of them, and its accessors return fresh copies,
 * so a document can be shared freely without risk of mutation.
 *
 * @param metadata null if none was supplied when the checkpoint was saved
 */
public record StateDocument(
	@NotNull String threadId,
	@NotNull String checkpointId,
	@NotNull ObjectNode state,
	@Nullable ObjectNode metadata,
	@NotNull Instant createdAt,
	@NotNull Instant updatedAt
) {
	public StateDocument {
		requireNonNull(threadId);
		requireNonNull(checkpointId);
		state = requireNonNull(state).deepCopy();
		metadata = (metadata == null) ? null : metadata.deepCopy();
		requireNonNull(createdAt);
		requireNonNull(updatedAt);
	}

	@Override
	public ObjectNode state() {
		return state.deepCopy();
	}

	@Override
	public @Nullable ObjectNode metadata() {
		return (metadata == null) ? null : metadata.deepCopy();
	}

	public Optional<ObjectNode> metadataIfAny() {
		return Optional.ofNullable(metadata());
	}
}
