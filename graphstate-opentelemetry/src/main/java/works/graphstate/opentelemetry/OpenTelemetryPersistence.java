package works.graphstate.opentelemetry;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import java.util.List;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.function.Supplier;
import org.jetbrains.annotations.Nullable;
import tools.jackson.databind.node.ObjectNode;
import works.graphstate.StateDocument;
import works.graphstate.StatePersistence;

import static java.util.Objects.requireNonNull;

/**
 * Decorates a {@link StatePersistence} with one span per operation.
 * Results and exceptions pass through unchanged.
 * <p>
 * A {@code false} result from a write marks the span as an error,
 * since the driver has already swallowed the exception that caused it.
 */
public final class OpenTelemetryPersistence implements StatePersistence {
	public static final String INSTRUMENTATION_SCOPE = "works.graphstate";

	public static final AttributeKey<String> BACKEND = AttributeKey.stringKey("graphstate.backend");
	public static final AttributeKey<String> THREAD_ID = AttributeKey.stringKey("graphstate.thread_id");
	public static final AttributeKey<String> CHECKPOINT_ID = AttributeKey.stringKey("graphstate.checkpoint_id");
	public static final AttributeKey<Long> LIMIT = AttributeKey.longKey("graphstate.limit");
	public static final AttributeKey<Boolean> SUCCESS = AttributeKey.booleanKey("graphstate.success");
	public static final AttributeKey<Boolean> FOUND = AttributeKey.booleanKey("graphstate.found");
	public static final AttributeKey<Long> COUNT = AttributeKey.longKey("graphstate.count");

	private final StatePersistence delegate;
	private final Tracer tracer;

	private OpenTelemetryPersistence(StatePersistence delegate, Tracer tracer) {
		this.delegate = requireNonNull(delegate);
		this.tracer = requireNonNull(tracer);
	}

	public static OpenTelemetryPersistence wrapping(StatePersistence delegate, OpenTelemetry openTelemetry) {
		return new OpenTelemetryPersistence(delegate, openTelemetry.getTracer(INSTRUMENTATION_SCOPE));
	}

	public StatePersistence delegate() {
		return delegate;
	}

	@Override
	public void initialize() {
		Span span = tracer.spanBuilder("graphstate.initialize")
			.setSpanKind(SpanKind.CLIENT)
			.setAttribute(BACKEND, delegate.backend())
			.startSpan();
		traced(span, () -> {
			delegate.initialize();
			return null;
		}, (s, r) -> { });
	}

	@Override
	public boolean saveState(String threadId, String checkpointId, ObjectNode state, @Nullable ObjectNode metadata) {
		Span span = spanBuilder("graphstate.save", threadId, checkpointId).startSpan();
		return traced(span, () -> delegate.saveState(threadId, checkpointId, state, metadata), OpenTelemetryPersistence::recordSuccess);
	}

	@Override
	public Optional<StateDocument> loadState(String threadId, @Nullable String checkpointId) {
		Span span = spanBuilder("graphstate.load", threadId, checkpointId).startSpan();
		return traced(span, () -> delegate.loadState(threadId, checkpointId), (s, result) -> {
			s.setAttribute(FOUND, result.isPresent());
			result.ifPresent(doc -> s.setAttribute(CHECKPOINT_ID, doc.checkpointId()));
		});
	}

	@Override
	public List<StateDocument> listCheckpoints(String threadId, int limit) {
		Span span = spanBuilder("graphstate.list", threadId, null)
			.setAttribute(LIMIT, (long) limit)
			.startSpan();
		return traced(span, () -> delegate.listCheckpoints(threadId, limit), (s, result) ->
			s.setAttribute(COUNT, (long) result.size()));
	}

	@Override
	public boolean deleteState(String threadId, @Nullable String checkpointId) {
		Span span = spanBuilder("graphstate.delete", threadId, checkpointId).startSpan();
		return traced(span, () -> delegate.deleteState(threadId, checkpointId), OpenTelemetryPersistence::recordSuccess);
	}

	@Override
	public String backend() {
		return delegate.backend();
	}

	@Override
	public String instanceID() {
		return delegate.instanceID();
	}

	@Override
	public void close() {
		delegate.close();
	}

	private SpanBuilder spanBuilder(String name, @Nullable String threadId, @Nullable String checkpointId) {
		SpanBuilder builder = tracer.spanBuilder(name)
			.setSpanKind(SpanKind.CLIENT)
			.setAttribute(BACKEND, delegate.backend());
		if (threadId != null) {
			builder.setAttribute(THREAD_ID, threadId);
		}
		if (checkpointId != null) {
			builder.setAttribute(CHECKPOINT_ID, checkpointId);
		}
		return builder;
	}

	private static <T> T traced(Span span, Supplier<T> operation, BiConsumer<Span, T> recordResult) {
		try (Scope __ = span.makeCurrent()) {
			T result = operation.get();
			recordResult.accept(span, result);
			return result;
		} catch (RuntimeException | Error e) {
			span.recordException(e);
			span.setStatus(StatusCode.ERROR, e.getClass().getSimpleName());
			throw e;
		} finally {
			span.end();
		}
	}

	private static void recordSuccess(Span span, Boolean success) {
		span.setAttribute(SUCCESS, success);
		if (!success) {
			span.setStatus(StatusCode.ERROR, "Backend failure");
		}
	}
}
