package works.graphstate;

import java.util.List;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;
import tools.jackson.databind.node.ObjectNode;
import works.graphstate.exceptions.BackendConnectionException;
import works.graphstate.exceptions.InvalidLifecycleStateException;
import works.graphstate.exceptions.PersistenceTimeoutException;
import works.graphstate.exceptions.StateSerializationException;

/**
 * Stores snapshots of workflow state, keyed by a thread ID and a checkpoint ID.
 *
 * <p>
 * Each instance moves through three phases:
 * it is created uninitialized, becomes usable after {@link #initialize()},
 * and is unusable again after {@link #close()}.
 * The data operations ({@link #saveState saveState}, {@link #loadState loadState},
 * {@link #listCheckpoints listCheckpoints} and {@link #deleteState deleteState})
 * throw {@link InvalidLifecycleStateException} outside the initialized phase.
 *
 * <p>
 * Implementations are thread-safe. Concurrent operations are served from a
 * connection pool owned by the instance.
 *
 * <p>
 * Write operations report backend failures by returning {@code false} rather than throwing,
 * so that a failed checkpoint write never aborts the caller's workflow.
 * Read operations throw, because the caller can't proceed safely
 * without knowing whether data exists. "Not found" is never an error:
 * it's an empty {@link Optional} or an empty {@link List}.
 */
public interface StatePersistence extends AutoCloseable {
	String DEFAULT_TABLE_NAME = "graph_states";
	int DEFAULT_LIST_LIMIT = 10;

	/**
	 * Opens the connection pool and ensures the table (or container) and its indexes exist.
	 * Idempotent: calling it again re-checks the schema without duplicating anything.
	 *
	 * @throws BackendConnectionException if the backend is unreachable or rejects the configuration
	 * @throws InvalidLifecycleStateException if this instance has been closed
	 */
	void initialize();

	/**
	 * Inserts or replaces the checkpoint identified by {@code threadId} and {@code checkpointId}.
	 * On replacement, {@code state}, {@code metadata} and {@code updatedAt} change;
	 * {@code createdAt} keeps the time of the original insertion.
	 *
	 * @param metadata null if the caller has no metadata; this is stored as "absent", not as an empty object
	 * @return true if the checkpoint was written; false if the backend failed, in which case the failure has been logged
	 */
	boolean saveState(String threadId, String checkpointId, ObjectNode state, @Nullable ObjectNode metadata);

	default boolean saveState(String threadId, String checkpointId, ObjectNode state) {
		return saveState(threadId, checkpointId, state, null);
	}

	/**
	 * @param checkpointId if null, loads the checkpoint with the latest {@code createdAt} for the thread
	 * @return the checkpoint, or empty if there is none
	 * @throws BackendConnectionException if the backend could not be queried
	 * @throws StateSerializationException if the stored payload is corrupt
	 * @throws PersistenceTimeoutException if the query exceeded its deadline
	 */
	Optional<StateDocument> loadState(String threadId, @Nullable String checkpointId);

	default Optional<StateDocument> loadState(String threadId) {
		return loadState(threadId, null);
	}

	/**
	 * @return at most {@code limit} checkpoints for the thread, most recently created first;
	 * ties are broken by insertion order, newest first
	 * @throws BackendConnectionException if the backend could not be queried
	 * @throws StateSerializationException if a stored payload is corrupt
	 * @throws PersistenceTimeoutException if the query exceeded its deadline
	 */
	List<StateDocument> listCheckpoints(String threadId, int limit);

	default List<StateDocument> listCheckpoints(String threadId) {
		return listCheckpoints(threadId, DEFAULT_LIST_LIMIT);
	}

	/**
	 * Deletes one checkpoint, or every checkpoint in the thread if {@code checkpointId} is null.
	 * Deleting something that doesn't exist succeeds.
	 *
	 * @return false only if the backend failed, in which case the failure has been logged
	 */
	boolean deleteState(String threadId, @Nullable String checkpointId);

	/**
	 * Deletes every checkpoint in the thread.
	 */
	default boolean deleteState(String threadId) {
		return deleteState(threadId, null);
	}

	/**
	 * Names the kind of backend, like {@code "postgresql"}.
	 * Drivers put it in the MDC under {@link works.graphstate.logging.MdcKeys#BACKEND}.
	 */
	String backend();

	/**
	 * Distinguishes this instance from others in the same process.
	 * Drivers put it in the MDC under {@link works.graphstate.logging.MdcKeys#INSTANCE_ID}
	 * while an operation runs.
	 */
	String instanceID();

	/**
	 * Stops accepting new operations, waits a bounded time for in-flight ones
	 * (see {@link PersistenceSettings#closeTimeoutMS()}), then releases the connection pool.
	 * Does nothing if this instance was never initialized or is already closed.
	 */
	@Override
	void close();
}
