package com.assetdb.config;

import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import java.util.function.Function;

/**
 * Configuration record for the PostgreSQL connection pool and the access engine's queries.
 *
 * <p>Read from the environment:
 *
 * <ul>
 *   <li>{@code DB_URL}, {@code DB_USER}, {@code DB_PASSWORD}: connection settings (URL required)
 *   <li>{@code DB_POOL_SIZE}: maximum pool size, default 10
 *   <li>{@code ACCESS_ASSIGNED_QUERY_TIMEOUT_SECONDS}: timeout of the assigned-folder query,
 *       default 30, 0 disables it
 * </ul>
 *
 * @param jdbcUrl The JDBC URL of the database
 * @param user The database user
 * @param password The database password
 * @param maxPoolSize The maximum number of pooled connections
 * @param assignedQueryTimeoutSeconds The statement timeout of the assigned-folder query
 */
public record DatabaseConfig(
    String jdbcUrl,
    String user,
    String password,
    int maxPoolSize,
    int assignedQueryTimeoutSeconds
) {

  public static final int DEFAULT_POOL_SIZE = 10;
  public static final int DEFAULT_ASSIGNED_QUERY_TIMEOUT_SECONDS = 30;

  public DatabaseConfig {
    if (Strings.isNullOrEmpty(jdbcUrl)) {
      throw new IllegalArgumentException("DB_URL is required");
    }
    if (maxPoolSize < 1) {
      throw new IllegalArgumentException("Pool size must be positive: " + maxPoolSize);
    }
    if (assignedQueryTimeoutSeconds < 0) {
      throw new IllegalArgumentException(
          "Query timeout must not be negative: " + assignedQueryTimeoutSeconds);
    }
  }

  /** Reads the configuration from the process environment. */
  public static DatabaseConfig fromEnvironment() {
    return fromEnvironment(System::getenv);
  }

  /**
   * Reads the configuration through a variable lookup.
   *
   * @throws IllegalArgumentException if a variable is missing or not a valid number
   */
  public static DatabaseConfig fromEnvironment(Function<String, String> env) {
    return new DatabaseConfig(
        env.apply("DB_URL"),
        env.apply("DB_USER"),
        env.apply("DB_PASSWORD"),
        intValue(env, "DB_POOL_SIZE", DEFAULT_POOL_SIZE),
        intValue(env, "ACCESS_ASSIGNED_QUERY_TIMEOUT_SECONDS", DEFAULT_ASSIGNED_QUERY_TIMEOUT_SECONDS));
  }

  private static int intValue(Function<String, String> env, String name, int defaultValue) {
    String value = env.apply(name);
    if (Strings.isNullOrEmpty(value)) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(name + " is not a number: " + value, e);
    }
  }

  /**
   * Returns a string representation of this object without the password, safe to use in logs.
   */
  public String toSecureString() {
    return MoreObjects.toStringHelper(this)
        .add("jdbcUrl", jdbcUrl())
        .add("user", user())
        .add("maxPoolSize", maxPoolSize())
        .add("assignedQueryTimeoutSeconds", assignedQueryTimeoutSeconds())
        .toString();
  }

  @Override
  public String toString() {
    return toSecureString();
  }
}
