package works.graphstate;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import works.graphstate.exceptions.ConfigurationException;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PersistenceSettingsTest {

	@Test
	void defaults() {
		PersistenceSettings settings = PersistenceSettings.defaults();
		assertEquals("graph_states", settings.tableName());
		assertEquals(30_000, settings.operationTimeoutMS());
		assertEquals(10, settings.maxPoolSize());
		assertDoesNotThrow(settings::validate);
	}

	@ParameterizedTest
	@ValueSource(strings = { "checkpoints", "_private", "Graph_States_2" })
	void validTableNames(String name) {
		assertDoesNotThrow(() -> PersistenceSettings.builder().tableName(name).build().validate());
	}

	@ParameterizedTest
	@ValueSource(strings = { "", "2fast", "graph-states", "states; DROP TABLE x", "dbo.states" })
	void invalidTableNames(String name) {
		var settings = PersistenceSettings.builder().tableName(name).build();
		assertThrows(ConfigurationException.class, settings::validate);
	}

	@Test
	void tableNameLength_leavesRoomForDerivedIndexNames() {
		String longest = "t".repeat(PersistenceSettings.MAX_TABLE_NAME_LENGTH);
		assertDoesNotThrow(() -> PersistenceSettings.builder().tableName(longest).build().validate());
		assertTrue(("uq_" + longest + "_thread_checkpoint").length() <= 63);
		assertTrue(("idx_" + longest + "_created_at").length() <= 63);
		var tooLong = PersistenceSettings.builder().tableName(longest + "t").build();
		assertThrows(ConfigurationException.class, tooLong::validate);
	}

	@Test
	void nonPositiveTimeouts_rejected() {
		assertThrows(ConfigurationException.class, () -> PersistenceSettings.builder().operationTimeoutMS(0).build().validate());
		assertThrows(ConfigurationException.class, () -> PersistenceSettings.builder().maxPoolSize(0).build().validate());
		assertThrows(ConfigurationException.class, () -> PersistenceSettings.builder().closeTimeoutMS(-1).build().validate());
	}
}
