package com.assetdb.db.util;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.utility.DockerImageName;

/**
 * Helper class for setting up PostgreSQL test containers. Every database test starts from the
 * schema and fixture data in {@code /db/01-schema.sql}.
 */
public class PostgresTestHelper {

  private static final String SCHEMA_SQL_PATH = "/db/01-schema.sql";

  /**
   * Creates a PostgreSQL container.
   *
   * @param databaseName The name to use for the test database
   * @return A configured PostgreSQLContainer ready to start
   */
  public static PostgreSQLContainer<?> createPostgresContainer(String databaseName) {
    return new PostgreSQLContainer<>(DockerImageName.parse("postgres:16"))
        .withDatabaseName(databaseName)
        .withUsername("assetdb")
        .withPassword("assetdb");
  }

  /**
   * Creates a JDBC connection to the PostgreSQL container.
   *
   * @throws SQLException If connection fails
   */
  public static Connection createConnection(PostgreSQLContainer<?> container) throws SQLException {
    return DriverManager.getConnection(
        container.getJdbcUrl(), container.getUsername(), container.getPassword());
  }

  /**
   * Runs the schema script in a started container.
   *
   * @param connection The JDBC connection to use
   * @param testClass The test class that is using this helper (used to locate resources)
   * @throws RuntimeException If the schema file cannot be found or executed
   */
  public static void initializeSchema(Connection connection, Class<?> testClass) {
    try (var stmt = connection.createStatement();
        InputStream in = testClass.getResourceAsStream(SCHEMA_SQL_PATH)) {
      if (in == null) {
        throw new RuntimeException("Schema file not found: " + SCHEMA_SQL_PATH);
      }
      stmt.execute(new String(in.readAllBytes(), StandardCharsets.UTF_8));
    } catch (Exception e) {
      throw new RuntimeException("Failed to initialize database schema", e);
    }
  }

  /**
   * Starts a PostgreSQL container, creates a connection, and initializes the schema.
   *
   * @throws SQLException If database connection fails
   */
  public static PostgresContext setupPostgres(String databaseName, Class<?> testClass)
      throws SQLException {
    PostgreSQLContainer<?> container = createPostgresContainer(databaseName);
    container.start();

    Connection connection = createConnection(container);
    initializeSchema(connection, testClass);

    return new PostgresContext(container, connection);
  }

  /** Creates a small connection pool for the container. */
  public static HikariDataSource createDataSource(PostgreSQLContainer<?> container) {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl(container.getJdbcUrl());
    config.setUsername(container.getUsername());
    config.setPassword(container.getPassword());
    config.setMaximumPoolSize(2);
    return new HikariDataSource(config);
  }

  /** Holds the PostgreSQL container and a connection to it. */
  public static class PostgresContext {
    private final PostgreSQLContainer<?> container;
    private final Connection connection;

    public PostgresContext(PostgreSQLContainer<?> container, Connection connection) {
      this.container = container;
      this.connection = connection;
    }

    public PostgreSQLContainer<?> getContainer() {
      return container;
    }

    public Connection getConnection() {
      return connection;
    }

    /** Closes the connection and stops the container. Call it in test tearDown methods. */
    public void close() {
      try {
        if (connection != null && !connection.isClosed()) {
          connection.close();
        }
      } catch (SQLException e) {
        System.err.println("Error closing connection: " + e.getMessage());
      }

      if (container != null && container.isRunning()) {
        container.stop();
      }
    }
  }
}
