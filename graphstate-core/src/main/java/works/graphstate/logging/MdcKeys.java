package works.graphstate.logging;

/**
 * Keys this library puts in the SLF4J {@link org.slf4j.MDC MDC}.
 */
public final class MdcKeys {
	private MdcKeys() { }

	/**
	 * Which backend the operation is talking to, such as {@code postgresql}.
	 */
	public static final String BACKEND = "graphstate.backend";

	/**
	 * Identifies one {@link works.graphstate.StatePersistence} instance,
	 * so logs from two instances in the same process can be told apart.
	 */
	public static final String INSTANCE_ID = "graphstate.instance";

	public static final String THREAD_ID = "graphstate.thread";
}
