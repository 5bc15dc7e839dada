package works.graphstate.selector;

import java.util.Map;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;
import org.jetbrains.annotations.Nullable;
import works.graphstate.PersistenceSettings;
import works.graphstate.cosmos.CosmosSettings;

/**
 * Fallbacks for {@link BackendSelector} when the caller doesn't supply a value explicitly.
 */
@Value
@Builder(toBuilder = true)
public class PersistenceConfig {
	public static final String CONNECTION_STRING_VARIABLE = "DATABASE_CONNECTION_STRING";
	public static final String TABLE_NAME_VARIABLE = "DATABASE_TABLE_NAME";

	@Nullable String connectionString;

	/**
	 * Takes precedence over {@link PersistenceSettings#tableName()} in {@link #settings}.
	 */
	@Nullable String tableName;

	@Default PersistenceSettings settings = PersistenceSettings.defaults();
	@Default CosmosSettings cosmos = CosmosSettings.defaults();

	public static PersistenceConfig defaults() {
		return builder().build();
	}

	public static PersistenceConfig fromEnvironment() {
		return fromEnvironment(System.getenv());
	}

	/**
	 * Empty variables count as unset.
	 */
	public static PersistenceConfig fromEnvironment(Map<String, String> environment) {
		return builder()
			.connectionString(nonEmpty(environment.get(CONNECTION_STRING_VARIABLE)))
			.tableName(nonEmpty(environment.get(TABLE_NAME_VARIABLE)))
			.build();
	}

	private static @Nullable String nonEmpty(@Nullable String value) {
		return (value == null || value.isEmpty()) ? null : value;
	}
}
