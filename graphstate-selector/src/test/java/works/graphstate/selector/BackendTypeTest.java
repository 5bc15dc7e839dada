package works.graphstate.selector;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import works.graphstate.exceptions.ConfigurationException;
import works.graphstate.exceptions.UnsupportedBackendException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.graphstate.selector.BackendType.COSMOS_DB;
import static works.graphstate.selector.BackendType.POSTGRESQL;
import static works.graphstate.selector.BackendType.SQL_SERVER;

class BackendTypeTest {

	@ParameterizedTest
	@ValueSource(strings = {
		"AccountEndpoint=https://acct.documents.azure.com:443/;AccountKey=abc==;",
		"accountendpoint=https://localhost:8081/;accountkey=k",
		"ACCOUNTKEY=k;ACCOUNTENDPOINT=https://localhost:8081/",
	})
	void cosmos(String connectionString) {
		assertEquals(COSMOS_DB, BackendType.detect(connectionString));
	}

	@ParameterizedTest
	@ValueSource(strings = {
		"postgresql://user:pw@localhost:5432/db",
		"postgres://localhost/db",
		"PostgreSQL://LOCALHOST/DB",
	})
	void postgres(String connectionString) {
		assertEquals(POSTGRESQL, BackendType.detect(connectionString));
	}

	@ParameterizedTest
	@ValueSource(strings = {
		"mssql+pyodbc://user:pw@host:1433/db?driver=ODBC+Driver+18+for+SQL+Server",
		"mssql://host/db",
		"jdbc:sqlserver://host:1433;databaseName=db",
		"SQLSERVER://host/db",
	})
	void sqlServer(String connectionString) {
		assertEquals(SQL_SERVER, BackendType.detect(connectionString));
	}

	@Test
	void cosmosCheckedFirst() {
		// Mentions mssql, but has both Cosmos keys
		assertEquals(COSMOS_DB, BackendType.detect("AccountEndpoint=https://mssql.example.com/;AccountKey=k"));
	}

	@Test
	void postgresMustBeAPrefix() {
		assertThrows(UnsupportedBackendException.class, () -> BackendType.detect("jdbc:postgresql://host/db"));
	}

	@Test
	void endpointWithoutKey_isNotCosmos() {
		assertThrows(UnsupportedBackendException.class, () -> BackendType.detect("AccountEndpoint=https://acct.documents.azure.com:443/"));
	}

	@Test
	void unrecognized_messageNamesSupportedFormats() {
		var e = assertThrows(UnsupportedBackendException.class, () -> BackendType.detect("mysql://host/db"));
		assertInstanceOf(ConfigurationException.class, e);
		assertTrue(e.getMessage().contains("AccountEndpoint="), e.getMessage());
		assertTrue(e.getMessage().contains("postgresql://"), e.getMessage());
		assertTrue(e.getMessage().contains("mssql+pyodbc://"), e.getMessage());
	}
}
