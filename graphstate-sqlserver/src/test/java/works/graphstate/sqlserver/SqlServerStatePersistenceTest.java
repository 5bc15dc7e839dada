package works.graphstate.sqlserver;

import org.junit.jupiter.api.Test;
import works.graphstate.PersistenceSettings;
import works.graphstate.StatePersistence;
import works.graphstate.exceptions.BackendConnectionException;
import works.graphstate.exceptions.ConfigurationException;
import works.graphstate.exceptions.InvalidLifecycleStateException;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Behaviour that doesn't need a running database.
 */
class SqlServerStatePersistenceTest {
	static final PersistenceSettings FAST_FAILING = PersistenceSettings.builder()
		.connectionTimeoutMS(500)
		.closeTimeoutMS(0)
		.build();
	static final String UNREACHABLE = "jdbc:sqlserver://127.0.0.1:1;databaseName=db;user=sa;password=pw;loginTimeout=1";

	@Test
	void uninitialized_rejectsOperations() {
		StatePersistence p = SqlServerStatePersistence.factory(FAST_FAILING).build(UNREACHABLE);
		assertThrows(InvalidLifecycleStateException.class, () -> p.deleteState("thread"));
		assertDoesNotThrow(p::close);
		assertThrows(InvalidLifecycleStateException.class, p::initialize);
	}

	@Test
	void unreachableServer_initializeThrows() {
		try (StatePersistence p = SqlServerStatePersistence.factory(FAST_FAILING).build(UNREACHABLE)) {
			assertThrows(BackendConnectionException.class, p::initialize);
		}
	}

	@Test
	void badConnectionString_rejectedByFactory() {
		var factory = SqlServerStatePersistence.factory(PersistenceSettings.defaults());
		assertThrows(ConfigurationException.class, () -> factory.build("postgresql://host/db"));
	}

	@Test
	void tableNameIsBracketQuoted_andTimestampsReadAsText() {
		var table = new CheckpointTable("graph_states");
		assertEquals("[graph_states]", table.quoted);
		assertEquals(
			"SELECT TOP (?) c.thread_id, c.checkpoint_id, c.state, c.metadata,"
				+ " CONVERT(VARCHAR(27), c.created_at, 126) AS created_at, CONVERT(VARCHAR(27), c.updated_at, 126) AS updated_at"
				+ " FROM [graph_states] AS c WHERE c.thread_id = ? ORDER BY c.created_at DESC, c.id DESC",
			table.selectNewest);
	}
}
