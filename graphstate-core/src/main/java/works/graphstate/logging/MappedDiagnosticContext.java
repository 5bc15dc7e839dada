package works.graphstate.logging;

import java.util.LinkedHashMap;
import java.util.Map;
import org.jetbrains.annotations.Nullable;
import org.slf4j.MDC;

import static works.graphstate.logging.MdcKeys.BACKEND;
import static works.graphstate.logging.MdcKeys.INSTANCE_ID;
import static works.graphstate.logging.MdcKeys.THREAD_ID;

public final class MappedDiagnosticContext {
	private MappedDiagnosticContext() { }

	public static MDCScope setupMDC(String backend, String instanceID) {
		return setupMDC(backend, instanceID, null);
	}

	/**
	 * Sets our MDC keys for the duration of one operation.
	 * Closing the returned scope restores whatever values the keys had before,
	 * so scopes can nest.
	 */
	public static MDCScope setupMDC(String backend, String instanceID, @Nullable String threadId) {
		MDCScope result = new MDCScope();
		result.put(BACKEND, backend);
		result.put(INSTANCE_ID, instanceID);
		if (threadId != null) {
			result.put(THREAD_ID, threadId);
		}
		return result;
	}

	public static final class MDCScope implements AutoCloseable {
		private final Map<String, String> previousValues = new LinkedHashMap<>();

		private MDCScope() { }

		void put(String key, String value) {
			previousValues.putIfAbsent(key, MDC.get(key));
			MDC.put(key, value);
		}

		@Override
		public void close() {
			previousValues.forEach((key, value) -> {
				if (value == null) {
					MDC.remove(key);
				} else {
					MDC.put(key, value);
				}
			});
		}
	}
}
