package works.graphstate.spring.boot;

import io.opentelemetry.api.OpenTelemetry;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledIfEnvironmentVariable;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import works.graphstate.PersistenceSettings;
import works.graphstate.StatePersistence;
import works.graphstate.exceptions.BackendConnectionException;
import works.graphstate.exceptions.ConfigurationException;
import works.graphstate.exceptions.InvalidLifecycleStateException;
import works.graphstate.json.StateJson;
import works.graphstate.opentelemetry.OpenTelemetryPersistence;
import works.graphstate.postgres.PostgresStatePersistence;
import works.graphstate.selector.PersistenceConfig;
import works.graphstate.testing.InMemoryStatePersistence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GraphStateAutoConfigurationTest {
	static final String UNREACHABLE_POSTGRES = "postgresql://user:pw@127.0.0.1:1/db";

	final ApplicationContextRunner runner = new ApplicationContextRunner()
		.withConfiguration(AutoConfigurations.of(GraphStateAutoConfiguration.class));

	@Test
	void connectionString_selectsBackend() {
		runner
			.withPropertyValues(
				"graphstate.connection-string=" + UNREACHABLE_POSTGRES,
				"graphstate.initialize-on-startup=false")
			.run(context -> {
				assertThat(context).hasSingleBean(StatePersistence.class);
				StatePersistence persistence = context.getBean(StatePersistence.class);
				assertThat(persistence).isInstanceOf(PostgresStatePersistence.class);
				assertThatThrownBy(() -> persistence.loadState("thread"))
					.isInstanceOf(InvalidLifecycleStateException.class);
			});
	}

	@Test
	void properties_mappedOntoSettings() {
		runner
			.withPropertyValues(
				"graphstate.connection-string=" + UNREACHABLE_POSTGRES,
				"graphstate.table-name=my_states",
				"graphstate.operation-timeout=5s",
				"graphstate.max-pool-size=3",
				"graphstate.connection-timeout=750ms",
				"graphstate.close-timeout=0s",
				"graphstate.cosmos.database=other_db",
				"graphstate.cosmos.throughput=1000",
				"graphstate.initialize-on-startup=false")
			.run(context -> {
				PersistenceConfig config = context.getBean(PersistenceConfig.class);
				assertThat(config.connectionString()).isEqualTo(UNREACHABLE_POSTGRES);
				assertThat(config.tableName()).isEqualTo("my_states");
				assertThat(config.settings().operationTimeoutMS()).isEqualTo(5_000);
				assertThat(config.settings().maxPoolSize()).isEqualTo(3);
				assertThat(config.settings().connectionTimeoutMS()).isEqualTo(750);
				assertThat(config.settings().closeTimeoutMS()).isZero();
				assertThat(config.cosmos().database()).isEqualTo("other_db");
				assertThat(config.cosmos().throughput()).isEqualTo(1000);
				assertThat(config.cosmos().maxConflictRetries()).isEqualTo(3);
			});
	}

	@Test
	void unsetProperties_useDefaults() {
		runner
			.withPropertyValues(
				"graphstate.connection-string=" + UNREACHABLE_POSTGRES,
				"graphstate.initialize-on-startup=false")
			.run(context -> {
				PersistenceConfig config = context.getBean(PersistenceConfig.class);
				assertThat(config.settings()).isEqualTo(PersistenceSettings.defaults().toBuilder()
					.clock(config.settings().clock())
					.build());
			});
	}

	@Test
	void environmentVariableNames_usedAsFallback() {
		runner
			.withPropertyValues(
				"DATABASE_CONNECTION_STRING=" + UNREACHABLE_POSTGRES,
				"DATABASE_TABLE_NAME=from_env",
				"graphstate.initialize-on-startup=false")
			.run(context -> {
				PersistenceConfig config = context.getBean(PersistenceConfig.class);
				assertThat(config.connectionString()).isEqualTo(UNREACHABLE_POSTGRES);
				assertThat(config.tableName()).isEqualTo("from_env");
				assertThat(context).hasSingleBean(StatePersistence.class);
			});
	}

	@Test
	void graphstateProperties_winOverEnvironmentVariables() {
		runner
			.withPropertyValues(
				"DATABASE_TABLE_NAME=from_env",
				"graphstate.table-name=from_properties",
				"graphstate.connection-string=" + UNREACHABLE_POSTGRES,
				"graphstate.initialize-on-startup=false")
			.run(context -> assertThat(context.getBean(PersistenceConfig.class).tableName()).isEqualTo("from_properties"));
	}

	@Test
	@DisabledIfEnvironmentVariable(named = "DATABASE_CONNECTION_STRING", matches = ".*")
	void noConnectionString_startupFails() {
		runner.run(context -> {
			assertThat(context).hasFailed();
			assertThat(context.getStartupFailure()).rootCause().isInstanceOf(ConfigurationException.class);
		});
	}

	@Test
	void invalidTableName_startupFails() {
		runner
			.withPropertyValues(
				"graphstate.connection-string=" + UNREACHABLE_POSTGRES,
				"graphstate.table-name=no-dashes",
				"graphstate.initialize-on-startup=false")
			.run(context -> {
				assertThat(context).hasFailed();
				assertThat(context.getStartupFailure()).rootCause().isInstanceOf(ConfigurationException.class);
			});
	}

	@Test
	void unreachableBackend_startupFailsWhenInitializing() {
		runner
			.withPropertyValues(
				"graphstate.connection-string=" + UNREACHABLE_POSTGRES,
				"graphstate.connection-timeout=500ms",
				"graphstate.close-timeout=0s")
			.run(context -> {
				assertThat(context).hasFailed();
				assertThat(firstInChain(context.getStartupFailure(), BackendConnectionException.class))
					.as("BackendConnectionException somewhere in the cause chain")
					.isNotNull();
			});
	}

	@Test
	void decorators_appliedThenInitialized_andClosedWithContext() {
		InMemoryStatePersistence.Store store = new InMemoryStatePersistence.Store();
		AtomicReference<StatePersistence> replacement = new AtomicReference<>();
		runner
			.withPropertyValues("graphstate.connection-string=" + UNREACHABLE_POSTGRES)
			.withBean(StatePersistenceDecorator.class, () -> original -> {
				// Swap the unreachable driver for one that can initialize
				original.close();
				replacement.set(new InMemoryStatePersistence(store, PersistenceSettings.defaults()));
				return replacement.get();
			})
			.run(context -> {
				StatePersistence persistence = context.getBean(StatePersistence.class);
				assertThat(persistence).isSameAs(replacement.get());
				assertThat(persistence.saveState("thread", "c1", new StateJson().newObject())).isTrue();
			});
		assertThatThrownBy(() -> replacement.get().loadState("thread"))
			.isInstanceOf(InvalidLifecycleStateException.class);
	}

	@Test
	void openTelemetryBean_wrapsPersistence() {
		runner
			.withPropertyValues(
				"graphstate.connection-string=" + UNREACHABLE_POSTGRES,
				"graphstate.initialize-on-startup=false")
			.withBean(OpenTelemetry.class, OpenTelemetry::noop)
			.run(context -> {
				StatePersistence persistence = context.getBean(StatePersistence.class);
				assertThat(persistence).isInstanceOf(OpenTelemetryPersistence.class);
				assertThat(((OpenTelemetryPersistence) persistence).delegate()).isInstanceOf(PostgresStatePersistence.class);
			});
	}

	@Test
	void userDefinedBean_autoConfigurationBacksOff() {
		InMemoryStatePersistence mine = new InMemoryStatePersistence(new InMemoryStatePersistence.Store(), PersistenceSettings.defaults());
		runner
			.withBean(StatePersistence.class, () -> mine)
			.run(context -> {
				assertThat(context).hasNotFailed();
				assertThat(context.getBean(StatePersistence.class)).isSameAs(mine);
			});
	}

	private static <T extends Throwable> T firstInChain(Throwable failure, Class<T> type) {
		for (Throwable t = failure; t != null; t = t.getCause()) {
			if (type.isInstance(t)) {
				return type.cast(t);
			}
		}
		return null;
	}

}
