package works.graphstate;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import tools.jackson.databind.node.ObjectNode;
import works.graphstate.exceptions.PersistenceTimeoutException;

import static java.util.Objects.requireNonNull;
import static java.util.concurrent.TimeUnit.MILLISECONDS;

/**
 * Runs {@link StatePersistence} operations on an {@link ExecutorService}
 * and reports their results as {@link CompletableFuture}s.
 *
 * <p>
 * Each operation may be given a deadline. When it passes, the future completes
 * exceptionally with {@link PersistenceTimeoutException} and the worker thread is interrupted.
 * Cancelling a future also interrupts its worker.
 * Either way, the driver's own per-operation timeout guarantees that the
 * connection is eventually returned to the pool.
 *
 * <p>
 * The submitting thread's {@link MDC} is carried over to the worker.
 * <p>
 * This does not own the executor or the delegate; closing them is up to the caller.
 */
public final class AsyncStatePersistence {
	private final StatePersistence delegate;
	private final ExecutorService executor;

	private AsyncStatePersistence(StatePersistence delegate, ExecutorService executor) {
		this.delegate = requireNonNull(delegate);
		this.executor = requireNonNull(executor);
	}

	public static AsyncStatePersistence of(StatePersistence delegate, ExecutorService executor) {
		return new AsyncStatePersistence(delegate, executor);
	}

	public StatePersistence delegate() {
		return delegate;
	}

	public CompletableFuture<Void> initialize(@Nullable Duration deadline) {
		return submit("initialize", deadline, () -> {
			delegate.initialize();
			return null;
		});
	}

	public CompletableFuture<Boolean> saveState(String threadId, String checkpointId, ObjectNode state, @Nullable ObjectNode metadata, @Nullable Duration deadline) {
		return submit("saveState", deadline, () -> delegate.saveState(threadId, checkpointId, state, metadata));
	}

	public CompletableFuture<Optional<StateDocument>> loadState(String threadId, @Nullable String checkpointId, @Nullable Duration deadline) {
		return submit("loadState", deadline, () -> delegate.loadState(threadId, checkpointId));
	}

	public CompletableFuture<List<StateDocument>> listCheckpoints(String threadId, int limit, @Nullable Duration deadline) {
		return submit("listCheckpoints", deadline, () -> delegate.listCheckpoints(threadId, limit));
	}

	public CompletableFuture<Boolean> deleteState(String threadId, @Nullable String checkpointId, @Nullable Duration deadline) {
		return submit("deleteState", deadline, () -> delegate.deleteState(threadId, checkpointId));
	}

	private <T> CompletableFuture<T> submit(String operationName, @Nullable Duration deadline, Callable<T> work) {
		Map<String, String> callerMDC = MDC.getCopyOfContextMap();
		CompletableFuture<T> result = new CompletableFuture<>();
		Future<?> task = executor.submit(() -> {
			Map<String, String> workerMDC = MDC.getCopyOfContextMap();
			setContextMap(callerMDC);
			try {
				result.complete(work.call());
			} catch (Exception e) {
				result.completeExceptionally(e);
			} finally {
				setContextMap(workerMDC);
			}
		});
		result.whenComplete((value, throwable) -> {
			if (throwable != null && !task.isDone()) {
				LOGGER.debug("Interrupting {} after {}", operationName, throwable.getClass().getSimpleName());
				task.cancel(true);
			}
		});
		if (deadline != null) {
			// Cancelled as soon as the operation finishes
			CompletableFuture<Void> timer = new CompletableFuture<Void>().completeOnTimeout(null, deadline.toMillis(), MILLISECONDS);
			timer.thenRun(() -> result.completeExceptionally(
				new PersistenceTimeoutException(operationName + " exceeded its deadline of " + deadline)));
			result.whenComplete((value, throwable) -> timer.cancel(false));
		}
		return result;
	}

	private static void setContextMap(@Nullable Map<String, String> contextMap) {
		if (contextMap == null) {
			MDC.clear();
		} else {
			MDC.setContextMap(contextMap);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(AsyncStatePersistence.class);
}
