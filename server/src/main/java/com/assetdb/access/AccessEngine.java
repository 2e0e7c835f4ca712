package com.assetdb.access;

import com.assetdb.common.status.Status;
import com.assetdb.common.status.StatusOr;
import com.assetdb.config.DataSources;
import com.assetdb.config.DatabaseConfig;
import com.assetdb.security.AccessUser;
import com.zaxxer.hikari.HikariDataSource;
import java.util.Objects;
import org.tinylog.Logger;

/**
 * Entry point of the folder access engine.
 *
 * <p>The engine owns the connection pool and the {@link AccessGroupStore}. Each incoming request
 * gets its own {@link AccessRequest} via {@link #forRequest}, which memoizes resolved access for
 * that request only. The surrounding server calls {@link #accessGroupsChanged()} whenever an
 * access group is saved or deleted.
 */
public class AccessEngine implements AutoCloseable {

  /**
   * @param dataSource the connection pool
   * @param assignedQueryTimeoutSeconds statement timeout of the assigned-folder query
   */
  public record Config(HikariDataSource dataSource, int assignedQueryTimeoutSeconds) {}

  private final Config config;
  private final AccessGroupStore accessGroups;
  private final PermissionCombiner combiner;

  public AccessEngine(Config config) {
    this.config = Objects.requireNonNull(config);
    this.accessGroups = new AccessGroupStore(config.dataSource());
    this.combiner = new PermissionCombiner(accessGroups);
  }

  /**
   * Opens a connection pool for the configuration and loads the access groups.
   *
   * @return the started engine, or the failure of the initial load (the pool is closed then)
   */
  public static StatusOr<AccessEngine> create(DatabaseConfig dbConfig) {
    HikariDataSource dataSource = DataSources.create(dbConfig);
    AccessEngine engine =
        new AccessEngine(new Config(dataSource, dbConfig.assignedQueryTimeoutSeconds()));
    Status loaded = engine.accessGroups.reload();
    if (loaded.isError()) {
      engine.close();
      return StatusOr.ofStatus(loaded);
    }
    Logger.info("Access engine started with {}", dbConfig.toSecureString());
    return StatusOr.ofValue(engine);
  }

  /** Starts the access decisions of one request made by the given user. */
  public AccessRequest forRequest(AccessUser user) {
    return new AccessRequest(config, combiner, Objects.requireNonNull(user));
  }

  /**
   * Reloads the access groups after one was saved or deleted. Requests already running keep the
   * access they resolved.
   */
  public Status accessGroupsChanged() {
    return accessGroups.reload();
  }

  public AccessGroupStore accessGroups() {
    return accessGroups;
  }

  @Override
  public void close() {
    if (config.dataSource() != null && !config.dataSource().isClosed()) {
      config.dataSource().close();
    }
  }
}
