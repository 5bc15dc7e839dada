package works.graphstate.spring.boot;

import io.opentelemetry.api.OpenTelemetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import works.graphstate.PersistenceSettings;
import works.graphstate.StatePersistence;
import works.graphstate.cosmos.CosmosSettings;
import works.graphstate.opentelemetry.OpenTelemetryPersistence;
import works.graphstate.selector.BackendSelector;
import works.graphstate.selector.PersistenceConfig;

import static works.graphstate.selector.PersistenceConfig.CONNECTION_STRING_VARIABLE;
import static works.graphstate.selector.PersistenceConfig.TABLE_NAME_VARIABLE;

@AutoConfiguration
@EnableConfigurationProperties(GraphStateProperties.class)
public class GraphStateAutoConfiguration {

	@Bean
	@ConditionalOnMissingBean
	PersistenceConfig graphStatePersistenceConfig(GraphStateProperties properties, Environment environment) {
		String connectionString = (properties.connectionString() != null)
			? properties.connectionString()
			: environment.getProperty(CONNECTION_STRING_VARIABLE);
		String tableName = (properties.tableName() != null)
			? properties.tableName()
			: environment.getProperty(TABLE_NAME_VARIABLE);
		return PersistenceConfig.builder()
			.connectionString(connectionString)
			.tableName(tableName)
			.settings(settings(properties))
			.cosmos(cosmosSettings(properties.cosmos()))
			.build();
	}

	@Bean(destroyMethod = "close")
	@ConditionalOnMissingBean
	StatePersistence statePersistence(
		PersistenceConfig config,
		GraphStateProperties properties,
		ObjectProvider<StatePersistenceDecorator> decorators
	) {
		StatePersistence result = BackendSelector.create(null, null, config);
		for (StatePersistenceDecorator decorator: decorators.orderedStream().toList()) {
			result = decorator.decorate(result);
		}
		if (properties.initializeOnStartup() == null || properties.initializeOnStartup()) {
			try {
				result.initialize();
			} catch (RuntimeException e) {
				result.close();
				throw e;
			}
		} else {
			LOGGER.debug("Not initializing {} at startup", result.backend());
		}
		return result;
	}

	@Configuration(proxyBeanMethods = false)
	@ConditionalOnClass({OpenTelemetry.class, OpenTelemetryPersistence.class})
	static class TracingConfiguration {
		@Bean
		@ConditionalOnBean(OpenTelemetry.class)
		StatePersistenceDecorator openTelemetryStatePersistenceDecorator(OpenTelemetry openTelemetry) {
			return persistence -> OpenTelemetryPersistence.wrapping(persistence, openTelemetry);
		}
	}

	private static PersistenceSettings settings(GraphStateProperties properties) {
		var builder = PersistenceSettings.builder();
		if (properties.operationTimeout() != null) {
			builder.operationTimeoutMS(properties.operationTimeout().toMillis());
		}
		if (properties.maxPoolSize() != null) {
			builder.maxPoolSize(properties.maxPoolSize());
		}
		if (properties.connectionTimeout() != null) {
			builder.connectionTimeoutMS(properties.connectionTimeout().toMillis());
		}
		if (properties.closeTimeout() != null) {
			builder.closeTimeoutMS(properties.closeTimeout().toMillis());
		}
		return builder.build();
	}

	private static CosmosSettings cosmosSettings(GraphStateProperties.Cosmos cosmos) {
		var builder = CosmosSettings.builder();
		if (cosmos != null) {
			if (cosmos.database() != null) {
				builder.database(cosmos.database());
			}
			if (cosmos.throughput() != null) {
				builder.throughput(cosmos.throughput());
			}
			if (cosmos.maxConflictRetries() != null) {
				builder.maxConflictRetries(cosmos.maxConflictRetries());
			}
			if (cosmos.gatewayMode() != null) {
				builder.gatewayMode(cosmos.gatewayMode());
			}
		}
		return builder.build();
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(GraphStateAutoConfiguration.class);
}
