package works.graphstate;

/**
 * Creates a {@link StatePersistence} for a particular backend.
 * <p>
 * Each driver module offers a {@code factory} method returning one of these,
 * closed over that driver's settings.
 * Building an instance does not open any connection;
 * that happens in {@link StatePersistence#initialize()}.
 * The caller owns the returned instance and is responsible for closing it.
 */
@FunctionalInterface
public interface PersistenceFactory {
	/**
	 * @param connectionString in whatever format the backend accepts
	 * @throws works.graphstate.exceptions.ConfigurationException if the connection string can't be parsed
	 */
	StatePersistence build(String connectionString);
}
