package com.assetdb.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.tinylog.Logger;

/** Builds the HikariCP connection pool. */
public final class DataSources {

  private DataSources() {
    // Utility class
  }

  /** Builds the pool settings for a database configuration without connecting. */
  public static HikariConfig hikariConfig(DatabaseConfig dbConfig) {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl(dbConfig.jdbcUrl());
    config.setUsername(dbConfig.user());
    config.setPassword(dbConfig.password());
    config.setMaximumPoolSize(dbConfig.maxPoolSize());
    config.setMinimumIdle(Math.min(2, dbConfig.maxPoolSize()));
    config.setIdleTimeout(30000);
    config.setMaxLifetime(1800000);
    config.setConnectionTimeout(30000);
    config.setAutoCommit(true);
    config.setPoolName("AssetDbPool");
    config.addDataSourceProperty("cachePrepStmts", "true");
    config.addDataSourceProperty("prepStmtCacheSize", "250");
    config.addDataSourceProperty("prepStmtCacheSqlLimit", "2048");
    return config;
  }

  /** Opens a connection pool for the configuration. */
  public static HikariDataSource create(DatabaseConfig dbConfig) {
    Logger.info("Initializing database connection pool: {}", dbConfig.toSecureString());
    return new HikariDataSource(hikariConfig(dbConfig));
  }
}
