/**
 * OpenTelemetry tracing for {@link works.graphstate.StatePersistence}.
 * <p>
 * Wrap any driver with {@link works.graphstate.opentelemetry.OpenTelemetryPersistence#wrapping}
 * to get one span per operation, parented to whatever span is current on the calling thread.
 */
package works.graphstate.opentelemetry;
