package works.graphstate.selector;

import java.util.Locale;
import works.graphstate.exceptions.UnsupportedBackendException;

public enum BackendType {
	COSMOS_DB,
	POSTGRESQL,
	SQL_SERVER,
	;

	/**
	 * Infers the backend from the form of the connection string, ignoring case.
	 * The checks are made in declaration order, and the first match wins.
	 *
	 * @throws UnsupportedBackendException if the string matches none of them
	 */
	public static BackendType detect(String connectionString) {
		String s = connectionString.toLowerCase(Locale.ROOT);
		if (s.contains("accountendpoint") && s.contains("accountkey")) {
			return COSMOS_DB;
		} else if (s.startsWith("postgresql://") || s.startsWith("postgres://")) {
			return POSTGRESQL;
		} else if (s.contains("mssql") || s.contains("sqlserver")) {
			return SQL_SERVER;
		} else {
			throw new UnsupportedBackendException("Unable to detect database type from connection string. Supported formats: "
				+ "Cosmos DB (AccountEndpoint=...;AccountKey=...), "
				+ "PostgreSQL (postgresql://...), "
				+ "SQL Server (mssql+pyodbc://... or jdbc:sqlserver://...)");
		}
	}
}
