package works.graphstate.util;

import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.graphstate.exceptions.InvalidLifecycleStateException;

import static java.lang.System.nanoTime;

/**
 * Tracks the phase of a {@link works.graphstate.StatePersistence} and the operations in flight,
 * so that {@code close} can stop admitting new work and wait for the old.
 * <p>
 * Drivers hold one of these rather than inheriting lifecycle behaviour from a base class.
 */
public final class Lifecycle {
	public enum Phase { UNINITIALIZED, INITIALIZED, CLOSED }

	private final String description;
	private Phase phase = Phase.UNINITIALIZED;
	private int inFlight = 0;

	public Lifecycle(String description) {
		this.description = description;
	}

	public synchronized Phase phase() {
		return phase;
	}

	/**
	 * @throws InvalidLifecycleStateException if already closed
	 */
	public synchronized void checkNotClosed() {
		if (phase == Phase.CLOSED) {
			throw new InvalidLifecycleStateException(description + " is closed and cannot be reinitialized");
		}
	}

	public synchronized void markInitialized() {
		checkNotClosed();
		phase = Phase.INITIALIZED;
	}

	/**
	 * Admits one operation. The caller must close the returned ticket when the operation finishes.
	 *
	 * @throws InvalidLifecycleStateException unless initialized and not yet closed
	 */
	public synchronized Operation begin(String operationName) {
		switch (phase) {
			case UNINITIALIZED:
				throw new InvalidLifecycleStateException("Cannot " + operationName + ": " + description + " has not been initialized");
			case CLOSED:
				throw new InvalidLifecycleStateException("Cannot " + operationName + ": " + description + " is closed");
			default:
				++inFlight;
				return new Operation();
		}
	}

	/**
	 * Moves to {@link Phase#CLOSED}. After this, {@link #begin} rejects everything.
	 *
	 * @return the phase we were in before, so the caller knows whether there's anything to release
	 */
	public synchronized Phase beginClose() {
		Phase previous = phase;
		phase = Phase.CLOSED;
		return previous;
	}

	/**
	 * Waits until every admitted operation has finished, or the timeout elapses.
	 *
	 * @return true if nothing is in flight any longer
	 */
	public synchronized boolean awaitQuiescence(long timeoutMS) throws InterruptedException {
		long deadline = nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMS);
		while (inFlight > 0) {
			long remaining = deadline - nanoTime();
			if (remaining <= 0) {
				LOGGER.debug("{}: {} operation(s) still in flight after {} ms", description, inFlight, timeoutMS);
				return false;
			}
			TimeUnit.NANOSECONDS.timedWait(this, remaining);
		}
		return true;
	}

	public synchronized int inFlight() {
		return inFlight;
	}

	private synchronized void finish() {
		--inFlight;
		if (inFlight == 0) {
			notifyAll();
		}
	}

	public final class Operation implements AutoCloseable {
		private boolean finished = false;

		private Operation() { }

		@Override
		public void close() {
			if (!finished) {
				finished = true;
				finish();
			}
		}
	}

	@Override
	public String toString() {
		return "Lifecycle(" + description + ")";
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Lifecycle.class);
}
