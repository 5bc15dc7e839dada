package works.graphstate.opentelemetry;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.context.Scope;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import works.graphstate.PersistenceSettings;
import works.graphstate.StatePersistence;
import works.graphstate.exceptions.InvalidLifecycleStateException;
import works.graphstate.testing.AbstractPersistenceTest;
import works.graphstate.testing.InMemoryStatePersistence;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.graphstate.opentelemetry.OpenTelemetryPersistence.BACKEND;
import static works.graphstate.opentelemetry.OpenTelemetryPersistence.CHECKPOINT_ID;
import static works.graphstate.opentelemetry.OpenTelemetryPersistence.COUNT;
import static works.graphstate.opentelemetry.OpenTelemetryPersistence.FOUND;
import static works.graphstate.opentelemetry.OpenTelemetryPersistence.SUCCESS;
import static works.graphstate.opentelemetry.OpenTelemetryPersistence.THREAD_ID;

class OpenTelemetryPersistenceTest extends AbstractPersistenceTest {
	InMemorySpanExporter exporter;
	OpenTelemetrySdk openTelemetry;
	InMemoryStatePersistence.Store store;

	@BeforeEach
	void setupOpenTelemetry() {
		exporter = InMemorySpanExporter.create();
		openTelemetry = OpenTelemetrySdk.builder()
			.setTracerProvider(SdkTracerProvider.builder()
				.addSpanProcessor(SimpleSpanProcessor.create(exporter))
				.build())
			.build();
		store = new InMemoryStatePersistence.Store();
		persistenceFactory = settings -> OpenTelemetryPersistence.wrapping(new InMemoryStatePersistence(store, settings), openTelemetry);
	}

	@AfterEach
	void teardownOpenTelemetry() {
		openTelemetry.close();
	}

	@Test
	void initialize_oneSpan() {
		newPersistence().initialize();
		SpanData span = onlySpan();
		assertEquals("graphstate.initialize", span.getName());
		assertEquals(SpanKind.CLIENT, span.getKind());
		assertEquals(InMemoryStatePersistence.BACKEND, span.getAttributes().get(BACKEND));
	}

	@Test
	void save_recordsKeysAndSuccess() {
		StatePersistence p = initializedPersistence();
		exporter.reset();
		String thread = threadId("save");
		assertTrue(p.saveState(thread, "c1", object("step", 1)));

		SpanData span = onlySpan();
		assertEquals("graphstate.save", span.getName());
		assertEquals(thread, span.getAttributes().get(THREAD_ID));
		assertEquals("c1", span.getAttributes().get(CHECKPOINT_ID));
		assertEquals(Boolean.TRUE, span.getAttributes().get(SUCCESS));
		assertEquals(StatusCode.UNSET, span.getStatus().getStatusCode());
	}

	@Test
	void load_recordsWhetherFound() {
		StatePersistence p = initializedPersistence();
		String thread = threadId("load");
		p.saveState(thread, "c1", object("step", 1));
		exporter.reset();

		assertTrue(p.loadState(thread).isPresent());
		assertFalse(p.loadState(thread, "missing").isPresent());

		List<SpanData> spans = exporter.getFinishedSpanItems();
		assertEquals(2, spans.size());
		assertEquals("graphstate.load", spans.get(0).getName());
		assertEquals(Boolean.TRUE, spans.get(0).getAttributes().get(FOUND));
		assertEquals("c1", spans.get(0).getAttributes().get(CHECKPOINT_ID), "Latest checkpoint ID is recorded once known");
		assertEquals(Boolean.FALSE, spans.get(1).getAttributes().get(FOUND));
		assertEquals("missing", spans.get(1).getAttributes().get(CHECKPOINT_ID));
	}

	@Test
	void list_recordsCount() {
		StatePersistence p = initializedPersistence();
		String thread = threadId("list");
		p.saveState(thread, "c1", object());
		clock.tick();
		p.saveState(thread, "c2", object());
		exporter.reset();

		assertEquals(2, p.listCheckpoints(thread).size());
		SpanData span = onlySpan();
		assertEquals("graphstate.list", span.getName());
		assertEquals(2L, span.getAttributes().get(COUNT));
		assertNull(span.getAttributes().get(CHECKPOINT_ID));
	}

	@Test
	void delete_recordsSuccess() {
		StatePersistence p = initializedPersistence();
		exporter.reset();
		assertTrue(p.deleteState(threadId("delete")));
		SpanData span = onlySpan();
		assertEquals("graphstate.delete", span.getName());
		assertEquals(Boolean.TRUE, span.getAttributes().get(SUCCESS));
	}

	@Test
	void exception_recordedAndRethrown() {
		StatePersistence p = newPersistence();
		assertThrows(InvalidLifecycleStateException.class, () -> p.loadState(threadId("early")));
		SpanData span = onlySpan();
		assertEquals(StatusCode.ERROR, span.getStatus().getStatusCode());
		assertTrue(span.getEvents().stream().anyMatch(e -> e.getName().equals("exception")), "Exception event is recorded");
	}

	@Test
	void spans_childrenOfCurrentSpan() {
		StatePersistence p = initializedPersistence();
		exporter.reset();
		Span parent = openTelemetry.getTracer("test").spanBuilder("parent").startSpan();
		try (Scope __ = parent.makeCurrent()) {
			p.saveState(threadId("nested"), "c1", object());
		} finally {
			parent.end();
		}
		List<SpanData> spans = exporter.getFinishedSpanItems();
		assertEquals(2, spans.size());
		SpanData child = spans.get(0);
		assertEquals("graphstate.save", child.getName());
		assertEquals(parent.getSpanContext().getSpanId(), child.getParentSpanId());
		assertEquals(parent.getSpanContext().getTraceId(), child.getTraceId());
	}

	@Test
	void identity_delegated() {
		InMemoryStatePersistence inner = new InMemoryStatePersistence(store, PersistenceSettings.defaults());
		OpenTelemetryPersistence outer = OpenTelemetryPersistence.wrapping(inner, openTelemetry);
		assertEquals(inner.instanceID(), outer.instanceID());
		assertEquals(inner.backend(), outer.backend());
		outer.close();
		assertThrows(InvalidLifecycleStateException.class, inner::initialize);
	}

	private SpanData onlySpan() {
		List<SpanData> spans = exporter.getFinishedSpanItems();
		assertEquals(1, spans.size(), () -> "Expected one span: " + spans);
		return spans.get(0);
	}
}
