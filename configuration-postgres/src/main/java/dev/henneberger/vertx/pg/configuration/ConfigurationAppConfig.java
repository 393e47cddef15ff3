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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Reads store properties from the process environment.
 */
public final class ConfigurationAppConfig {

  private static final String DEFAULT_TABLE = "configuration";

  private final String connectionString;
  private final String table;
  private final String maxIdleTime;
  private final String maxPoolSize;
  private final String profile;

  private ConfigurationAppConfig(String connectionString,
                                 String table,
                                 String maxIdleTime,
                                 String maxPoolSize,
                                 String profile) {
    this.connectionString = connectionString;
    this.table = table;
    this.maxIdleTime = maxIdleTime;
    this.maxPoolSize = maxPoolSize;
    this.profile = profile;
  }

  public static ConfigurationAppConfig fromEnv() {
    return fromMap(System.getenv());
  }

  static ConfigurationAppConfig fromMap(Map<String, String> env) {
    Objects.requireNonNull(env, "env");

    String connectionString = envOrDefault(env, "PG_CONFIG_CONNECTION_STRING", env.get("DATABASE_URL"));
    String table = envOrDefault(env, "PG_CONFIG_TABLE", DEFAULT_TABLE);
    String maxIdleTime = envOrDefault(env, "PG_CONFIG_MAX_IDLE_TIME", null);
    String maxPoolSize = envOrDefault(env, "PG_CONFIG_MAX_POOL_SIZE", null);
    String profile = envOrDefault(env, "PG_CONFIG_PROFILE", null);

    return new ConfigurationAppConfig(connectionString, table, maxIdleTime, maxPoolSize, profile);
  }

  public String connectionString() {
    return connectionString;
  }

  public String table() {
    return table;
  }

  public String maxIdleTime() {
    return maxIdleTime;
  }

  public String profile() {
    return profile;
  }

  /**
   * Properties in the shape {@link PostgresConfigurationStore#init(Map)} expects. Unset values are omitted.
   */
  public Map<String, String> toProperties() {
    Map<String, String> properties = new LinkedHashMap<>();
    putIfPresent(properties, PostgresConfigurationOptions.CONNECTION_STRING_KEY, connectionString);
    putIfPresent(properties, PostgresConfigurationOptions.TABLE_KEY, table);
    putIfPresent(properties, PostgresConfigurationOptions.MAX_IDLE_TIME_KEY, maxIdleTime);
    putIfPresent(properties, PostgresConfigurationOptions.MAX_POOL_SIZE_KEY, maxPoolSize);
    return properties;
  }

  /**
   * Options for {@link PostgresConfigurationStore#init(PostgresConfigurationOptions)}: the
   * {@code PG_CONFIG_PROFILE} preset when one is named, with explicitly set variables applied on top.
   *
   * @throws dev.henneberger.vertx.configuration.core.ConfigurationException when a value is invalid
   */
  public PostgresConfigurationOptions toOptions() {
    PostgresConfigurationOptions explicit = PostgresConfigurationOptions.fromProperties(toProperties());
    if (profile == null) {
      return explicit;
    }
    PostgresConfigurationOptions options = ConfigurationOptionPresets.apply(
      ConfigurationOptionPresets.Profile.parse(profile), new PostgresConfigurationOptions());
    options
      .setConnectionString(explicit.getConnectionString())
      .setTable(explicit.getTable());
    if (maxIdleTime != null) {
      options.setMaxIdleTime(explicit.getMaxIdleTime());
    }
    if (maxPoolSize != null) {
      options.setMaxPoolSize(explicit.getMaxPoolSize());
    }
    return options;
  }

  private static void putIfPresent(Map<String, String> properties, String key, String value) {
    if (value != null) {
      properties.put(key, value);
    }
  }

  private static String envOrDefault(Map<String, String> env, String key, String defaultValue) {
    String value = env.get(key);
    return value == null || value.isBlank() ? defaultValue : value;
  }
}
