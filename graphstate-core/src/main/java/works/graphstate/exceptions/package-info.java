/**
 * Exceptions that can reach the user of {@link works.graphstate.StatePersistence}.
 * <p>
 * {@code saveState} and {@code deleteState} never throw these for backend failures;
 * they report such failures by returning {@code false}.
 */
package works.graphstate.exceptions;
