package works.graphstate;

import java.time.Clock;
import java.util.regex.Pattern;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;
import works.graphstate.exceptions.ConfigurationException;

/**
 * Settings shared by every backend.
 * Backend-specific settings, if any, live alongside each driver.
 */
@Value
@Builder(toBuilder = true)
public class PersistenceSettings {
	/**
	 * The table (or container) holding the checkpoints.
	 * It is interpolated into DDL, so it must be a plain identifier:
	 * letters, digits and underscores, not starting with a digit.
	 * At most {@value #MAX_TABLE_NAME_LENGTH} characters, so that constraint and index names
	 * derived from it (the longest being {@code uq_<table>_thread_checkpoint})
	 * fit PostgreSQL's 63-character identifier limit without truncation.
	 */
	@Default String tableName = StatePersistence.DEFAULT_TABLE_NAME;

	/**
	 * Deadline for each individual operation, enforced by the backend
	 * so that an aborted operation still returns its connection to the pool.
	 */
	@Default long operationTimeoutMS = 30_000;

	/**
	 * Upper bound on the number of pooled connections.
	 */
	@Default int maxPoolSize = 10;

	/**
	 * How long to wait when opening a connection or borrowing one from the pool.
	 */
	@Default long connectionTimeoutMS = 30_000;

	/**
	 * How long {@link StatePersistence#close()} waits for in-flight operations
	 * before disposing of the pool underneath them.
	 */
	@Default long closeTimeoutMS = 10_000;

	/**
	 * Source of {@link StateDocument#createdAt()} and {@link StateDocument#updatedAt()}.
	 */
	@Default Clock clock = Clock.systemUTC();

	public static PersistenceSettings defaults() {
		return builder().build();
	}

	public void validate() {
		if (tableName == null || !TABLE_NAME_PATTERN.matcher(tableName).matches()) {
			throw new ConfigurationException("Invalid table name \"" + tableName + "\": must match " + TABLE_NAME_PATTERN.pattern());
		}
		if (operationTimeoutMS <= 0) {
			throw new ConfigurationException("operationTimeoutMS must be positive: " + operationTimeoutMS);
		}
		if (maxPoolSize <= 0) {
			throw new ConfigurationException("maxPoolSize must be positive: " + maxPoolSize);
		}
		if (connectionTimeoutMS <= 0) {
			throw new ConfigurationException("connectionTimeoutMS must be positive: " + connectionTimeoutMS);
		}
		if (closeTimeoutMS < 0) {
			throw new ConfigurationException("closeTimeoutMS must not be negative: " + closeTimeoutMS);
		}
		if (clock == null) {
			throw new ConfigurationException("clock must not be null");
		}
	}

	public static final int MAX_TABLE_NAME_LENGTH = 42;
	private static final Pattern TABLE_NAME_PATTERN = Pattern.compile("[A-Za-z_][A-Za-z0-9_]{0," + (MAX_TABLE_NAME_LENGTH - 1) + "}");
}
