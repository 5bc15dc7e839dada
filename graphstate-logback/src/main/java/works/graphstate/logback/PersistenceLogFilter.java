package works.graphstate.logback;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.spi.FilterReply;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.stream.Stream;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.slf4j.Marker;
import works.graphstate.StatePersistence;
import works.graphstate.logging.MdcKeys;

import static ch.qos.logback.core.spi.FilterReply.DENY;
import static ch.qos.logback.core.spi.FilterReply.NEUTRAL;
import static java.util.stream.Collectors.toMap;
import static works.graphstate.logging.MdcKeys.INSTANCE_ID;

/**
 * A Logback {@link TurboFilter} that provides per-instance logging control.
 * Intended to suppress expected warnings and errors during testing,
 * such as the ones a driver logs when a save fails on purpose.
 * <p>
 * A {@link StatePersistence} registered with {@link #withController}
 * will have its log levels governed by {@link LogController#setLogging}
 * without affecting other instances.
 * <p>
 * This class infers that a log message is associated with a particular instance
 * by checking the MDC for the key {@link MdcKeys#INSTANCE_ID},
 * which every driver sets while an operation runs.
 * <p>
 * Log levels are determined using the following precedence:
 * <ol>
 *     <li>
 *         If the specific logger is configured with some level,
 *         that level is used;
 *     </li>
 *     <li>
 *         otherwise, if the message comes from an instance registered
 *         with a controller that has an override for that specific logger,
 *         that override is used;
 *     </li>
 *     <li>
 *         otherwise, the usual Logback rules apply, which means
 *         that the logger inherits the level from its ancestors.
 *     </li>
 * </ol>
 */
public class PersistenceLogFilter extends TurboFilter {
	private static final ConcurrentHashMap<String, LogController> controllersByInstanceID = new ConcurrentHashMap<>();

	public static final class LogController {
		final Map<String, Level> overrides = new ConcurrentHashMap<>();

		// SLF4J's Level has no OFF
		public void setLogging(Level level, Class<?>... loggers) {
			overrides.putAll(Stream.of(loggers).collect(toMap(Class::getName, __ -> level)));
		}

		public void setLogging(Level level, String... loggers) {
			overrides.putAll(Stream.of(loggers).collect(toMap(Function.identity(), __ -> level)));
		}

		public void clear() {
			overrides.clear();
		}
	}

	/**
	 * Causes the given <code>controller</code> to control logs emitted
	 * while <code>persistence</code> is running an operation.
	 *
	 * @return <code>persistence</code>, for chaining
	 */
	public static <P extends StatePersistence> P withController(LogController controller, P persistence) {
		String instanceID = persistence.instanceID();
		LOGGER.debug("Registering controller {} for instance {}", System.identityHashCode(controller), instanceID);
		LogController old = controllersByInstanceID.put(instanceID, controller);
		assert old == null || old == controller: "Must not register two log controllers for the same instance: " + instanceID;
		return persistence;
	}

	public static void release(StatePersistence persistence) {
		controllersByInstanceID.remove(persistence.instanceID());
	}

	@Override
	public FilterReply decide(Marker marker, Logger logger, Level messageLevel, String format, Object[] params, Throwable t) {
		if (logger.getLevel() != null) {
			return NEUTRAL;
		}
		String instanceID = MDC.get(INSTANCE_ID);
		if (instanceID == null) {
			return NEUTRAL;
		}
		var controller = controllersByInstanceID.get(instanceID);
		if (controller == null) {
			return NEUTRAL;
		}
		Level overrideLevel = controller.overrides.get(logger.getName());
		if (overrideLevel == null) {
			return NEUTRAL;
		}

		if (messageLevel.isGreaterOrEqual(overrideLevel)) {
			return NEUTRAL;
		} else {
			return DENY;
		}
	}

	private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(PersistenceLogFilter.class);
}
