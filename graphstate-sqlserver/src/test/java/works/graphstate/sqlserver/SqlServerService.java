package works.graphstate.sqlserver;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.testcontainers.containers.MSSQLServerContainer;
import org.testcontainers.utility.DockerImageName;

/**
 * The dockerized SQL Server shared by every test class in this module.
 * It starts the first time it's used.
 * <p>
 * All tests use the same database, so they must use distinct thread IDs or table names.
 */
final class SqlServerService {
	// We do logging in a static initializer, so this needs to be initialized first
	private static final Logger LOGGER = LoggerFactory.getLogger(SqlServerService.class);

	public static final DockerImageName SQLSERVER_IMAGE_NAME = DockerImageName.parse("mcr.microsoft.com/mssql/server:2022-latest");

	private SqlServerService() { }

	private static final class Holder {
		static final MSSQLServerContainer<?> CONTAINER = sqlServerContainer();
	}

	/**
	 * In the SQLAlchemy format, so that the URL translation gets exercised too.
	 */
	static String connectionString() {
		var c = Holder.CONTAINER;
		return "mssql+pyodbc://" + c.getUsername() + ":" + c.getPassword()
			+ "@" + c.getHost() + ":" + c.getMappedPort(MSSQLServerContainer.MS_SQL_SERVER_PORT)
			+ "/master?driver=ODBC+Driver+18+for+SQL+Server&TrustServerCertificate=yes&Encrypt=no";
	}

	static Connection directConnection() throws SQLException {
		var c = Holder.CONTAINER;
		return DriverManager.getConnection(c.getJdbcUrl(), c.getUsername(), c.getPassword());
	}

	private static MSSQLServerContainer<?> sqlServerContainer() {
		MSSQLServerContainer<?> container = new MSSQLServerContainer<>(SQLSERVER_IMAGE_NAME)
			.acceptLicense();
		container.start();
		LOGGER.info("SQL Server: {}:{}", container.getHost(), container.getMappedPort(MSSQLServerContainer.MS_SQL_SERVER_PORT));
		return container;
	}
}
