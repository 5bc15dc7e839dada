package works.graphstate.spring.boot;

import works.graphstate.StatePersistence;

/**
 * Beans of this type wrap the auto-configured {@link StatePersistence}
 * before it's initialized, in {@link org.springframework.core.annotation.Order order}.
 */
@FunctionalInterface
public interface StatePersistenceDecorator {
	StatePersistence decorate(StatePersistence persistence);
}
