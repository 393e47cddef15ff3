/*
 * Copyright (C) 2026 Daniel Henneberger
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.henneberger.vertx.pg.configuration;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import dev.henneberger.vertx.configuration.core.StoreConnectionException;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the shared connection pool and checks that the database answers before handing it out.
 */
final class PostgresConnectionManager {

  private static final Logger LOG = LoggerFactory.getLogger(PostgresConnectionManager.class);
  private static final long MIN_IDLE_TIMEOUT_MS = 10_000L;
  private static final long MIN_CONNECTION_TIMEOUT_MS = 250L;

  private PostgresConnectionManager() {
  }

  static HikariDataSource connect(PostgresConfigurationOptions options) {
    Objects.requireNonNull(options, "options");

    PostgresConnectionString connectionString;
    try {
      connectionString = PostgresConnectionString.parse(options.getConnectionString());
    } catch (IllegalArgumentException e) {
      throw new StoreConnectionException(StoreConnectionException.Phase.CONNECT,
        "postgres configuration store connection error : " + e.getMessage(), e);
    }

    HikariDataSource pool;
    try {
      pool = new HikariDataSource(poolConfig(options, connectionString));
    } catch (RuntimeException e) {
      throw new StoreConnectionException(StoreConnectionException.Phase.CONNECT,
        "postgres configuration store connection error : " + e.getMessage(), e);
    }

    try {
      ping(pool, options.getMaxIdleTime());
    } catch (SQLException e) {
      pool.close();
      throw new StoreConnectionException(StoreConnectionException.Phase.PING,
        "postgres configuration store ping error : " + e.getMessage(), e);
    }

    LOG.info("Connected configuration store pool {} to {}", pool.getPoolName(), connectionString.redacted());
    return pool;
  }

  static HikariConfig poolConfig(PostgresConfigurationOptions options, PostgresConnectionString connectionString) {
    long idleMillis = options.getMaxIdleTime().toMillis();

    HikariConfig config = new HikariConfig();
    config.setPoolName("pg-config-" + options.getTable());
    config.setDriverClassName("org.postgresql.Driver");
    config.setJdbcUrl(connectionString.jdbcUrl());
    config.setDataSourceProperties(connectionString.properties());
    config.setMaximumPoolSize(options.getMaxPoolSize());
    config.setMinimumIdle(1);
    config.setIdleTimeout(Math.max(idleMillis, MIN_IDLE_TIMEOUT_MS));
    config.setConnectionTimeout(Math.max(idleMillis, MIN_CONNECTION_TIMEOUT_MS));
    return config;
  }

  private static void ping(HikariDataSource pool, Duration timeout) throws SQLException {
    int seconds = (int) Math.max(1L, timeout.toSeconds());
    try (Connection connection = pool.getConnection()) {
      if (!connection.isValid(seconds)) {
        throw new SQLException("connection did not answer within " + seconds + "s");
      }
    }
  }
}
