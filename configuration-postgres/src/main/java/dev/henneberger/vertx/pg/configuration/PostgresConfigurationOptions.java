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

import dev.henneberger.vertx.configuration.core.ConfigurationException;
import dev.henneberger.vertx.configuration.core.Durations;
import dev.henneberger.vertx.configuration.core.OptionValidation;
import dev.henneberger.vertx.configuration.core.ReconnectPolicy;
import io.vertx.codegen.annotations.DataObject;
import io.vertx.codegen.annotations.GenIgnore;
import io.vertx.core.json.JsonObject;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Connection, table and listener configuration for {@link PostgresConfigurationStore}.
 */
@DataObject
public class PostgresConfigurationOptions {

  public static final String CONNECTION_STRING_KEY = "connectionString";
  public static final String TABLE_KEY = "table";
  public static final String MAX_IDLE_TIME_KEY = "connMaxIdleTime";
  public static final String MAX_POOL_SIZE_KEY = "maxPoolSize";
  public static final String PREFLIGHT_ENABLED_KEY = "preflightEnabled";
  public static final String EXPIRE_ON_IDLE_KEY = "expireOnIdle";
  public static final String NOTIFICATION_POLL_INTERVAL_KEY = "notificationPollInterval";

  /**
   * PostgreSQL truncates identifiers longer than this.
   */
  public static final int MAX_IDENTIFIER_LENGTH = 64;
  public static final Duration DEFAULT_MAX_IDLE_TIME = Duration.ofSeconds(30);
  public static final Duration DEFAULT_NOTIFICATION_POLL_INTERVAL = Duration.ofMillis(500);
  public static final int DEFAULT_MAX_POOL_SIZE = 10;

  private String connectionString;
  private String table;
  private Duration maxIdleTime;
  private int maxPoolSize;
  private boolean preflightEnabled;
  private boolean expireOnIdle;
  private Duration notificationPollInterval;
  private ReconnectPolicy reconnectPolicy;

  public PostgresConfigurationOptions() {
    init();
  }

  public PostgresConfigurationOptions(JsonObject json) {
    init();
    PostgresConfigurationOptionsConverter.fromJson(json, this);
  }

  public PostgresConfigurationOptions(PostgresConfigurationOptions other) {
    this.connectionString = other.connectionString;
    this.table = other.table;
    this.maxIdleTime = other.maxIdleTime;
    this.maxPoolSize = other.maxPoolSize;
    this.preflightEnabled = other.preflightEnabled;
    this.expireOnIdle = other.expireOnIdle;
    this.notificationPollInterval = other.notificationPollInterval;
    this.reconnectPolicy = other.reconnectPolicy.copy();
  }

  /**
   * Builds options from the flat string properties handed over by the host at init time.
   *
   * @throws ConfigurationException when a required property is missing or malformed
   */
  public static PostgresConfigurationOptions fromProperties(Map<String, String> properties) {
    Objects.requireNonNull(properties, "properties");
    PostgresConfigurationOptions options = new PostgresConfigurationOptions();

    String connectionString = properties.get(CONNECTION_STRING_KEY);
    OptionValidation.require(CONNECTION_STRING_KEY, connectionString,
      ConfigurationException.Reason.MISSING_CONNECTION_STRING);
    options.setConnectionString(connectionString);

    String table = properties.get(TABLE_KEY);
    validateTable(table);
    options.setTable(table);

    String maxIdleTime = properties.get(MAX_IDLE_TIME_KEY);
    if (maxIdleTime != null && !maxIdleTime.isEmpty()) {
      options.setMaxIdleTime(parseDuration(MAX_IDLE_TIME_KEY, maxIdleTime,
        ConfigurationException.Reason.INVALID_MAX_TIMEOUT));
    }

    String pollInterval = properties.get(NOTIFICATION_POLL_INTERVAL_KEY);
    if (pollInterval != null && !pollInterval.isEmpty()) {
      options.setNotificationPollInterval(parseDuration(NOTIFICATION_POLL_INTERVAL_KEY, pollInterval,
        ConfigurationException.Reason.INVALID_OPTION));
    }

    String maxPoolSize = properties.get(MAX_POOL_SIZE_KEY);
    if (maxPoolSize != null && !maxPoolSize.isEmpty()) {
      try {
        options.setMaxPoolSize(Integer.parseInt(maxPoolSize.trim()));
      } catch (NumberFormatException e) {
        throw new ConfigurationException(ConfigurationException.Reason.INVALID_OPTION,
          MAX_POOL_SIZE_KEY + " must be an integer", e);
      }
    }

    options.setPreflightEnabled(parseFlag(PREFLIGHT_ENABLED_KEY, properties.get(PREFLIGHT_ENABLED_KEY), false));
    options.setExpireOnIdle(parseFlag(EXPIRE_ON_IDLE_KEY, properties.get(EXPIRE_ON_IDLE_KEY), false));

    options.validate();
    return options;
  }

  public String getConnectionString() {
    return connectionString;
  }

  public PostgresConfigurationOptions setConnectionString(String connectionString) {
    this.connectionString = connectionString;
    return this;
  }

  public String getTable() {
    return table;
  }

  public PostgresConfigurationOptions setTable(String table) {
    this.table = table;
    return this;
  }

  /**
   * Bound applied to connection setup and to each idle wait for notifications.
   */
  @GenIgnore
  public Duration getMaxIdleTime() {
    return maxIdleTime;
  }

  @GenIgnore
  public PostgresConfigurationOptions setMaxIdleTime(Duration maxIdleTime) {
    this.maxIdleTime = Objects.requireNonNull(maxIdleTime, "maxIdleTime");
    return this;
  }

  public int getMaxPoolSize() {
    return maxPoolSize;
  }

  public PostgresConfigurationOptions setMaxPoolSize(int maxPoolSize) {
    this.maxPoolSize = maxPoolSize;
    return this;
  }

  public boolean isPreflightEnabled() {
    return preflightEnabled;
  }

  public PostgresConfigurationOptions setPreflightEnabled(boolean preflightEnabled) {
    this.preflightEnabled = preflightEnabled;
    return this;
  }

  public boolean isExpireOnIdle() {
    return expireOnIdle;
  }

  public PostgresConfigurationOptions setExpireOnIdle(boolean expireOnIdle) {
    this.expireOnIdle = expireOnIdle;
    return this;
  }

  @GenIgnore
  public Duration getNotificationPollInterval() {
    return notificationPollInterval;
  }

  @GenIgnore
  public PostgresConfigurationOptions setNotificationPollInterval(Duration notificationPollInterval) {
    this.notificationPollInterval = Objects.requireNonNull(notificationPollInterval, "notificationPollInterval");
    return this;
  }

  @GenIgnore
  public ReconnectPolicy getReconnectPolicy() {
    return reconnectPolicy;
  }

  @GenIgnore
  public PostgresConfigurationOptions setReconnectPolicy(ReconnectPolicy reconnectPolicy) {
    this.reconnectPolicy = Objects.requireNonNull(reconnectPolicy, "reconnectPolicy");
    return this;
  }

  /**
   * Length of a single blocking wait. A cancelled listener notices within one wait, so it is capped at
   * half the idle timeout to leave room for the {@code UNLISTEN} before the idle timeout elapses.
   */
  Duration effectivePollInterval() {
    Duration cap = maxIdleTime.dividedBy(2);
    if (cap.isZero()) {
      cap = maxIdleTime;
    }
    return notificationPollInterval.compareTo(cap) < 0 ? notificationPollInterval : cap;
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject();
    PostgresConfigurationOptionsConverter.toJson(this, json);
    return json;
  }

  public PostgresConfigurationOptions merge(JsonObject other) {
    JsonObject json = toJson();
    json.mergeIn(other);
    return new PostgresConfigurationOptions(json);
  }

  void validate() {
    OptionValidation.require(CONNECTION_STRING_KEY, connectionString,
      ConfigurationException.Reason.MISSING_CONNECTION_STRING);
    validateTable(table);
    OptionValidation.requirePositive(MAX_IDLE_TIME_KEY, maxIdleTime, ConfigurationException.Reason.INVALID_MAX_TIMEOUT);
    OptionValidation.requirePositive(NOTIFICATION_POLL_INTERVAL_KEY, notificationPollInterval,
      ConfigurationException.Reason.INVALID_OPTION);
    OptionValidation.requireMin(MAX_POOL_SIZE_KEY, maxPoolSize, 1);
    Objects.requireNonNull(reconnectPolicy, "reconnectPolicy").validate();
  }

  static void validateTable(String table) {
    OptionValidation.require(TABLE_KEY, table, ConfigurationException.Reason.MISSING_TABLE_NAME);
    OptionValidation.requireAscii("table name", table);
    OptionValidation.requireMaxLength("tableName", table, MAX_IDENTIFIER_LENGTH);
    if (!ConfigurationQueryBuilder.isIdentifier(table)) {
      throw new ConfigurationException(ConfigurationException.Reason.INVALID_CHARACTERS,
        "invalid table name '" + table + "'. only letters, digits and underscores are supported");
    }
  }

  private static Duration parseDuration(String key, String value, ConfigurationException.Reason reason) {
    try {
      return Durations.parse(value);
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException(reason, "invalid " + key + " setting '" + value + "'", e);
    }
  }

  private static boolean parseFlag(String key, String value, boolean defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    String normalized = value.trim();
    if ("true".equalsIgnoreCase(normalized) || "1".equals(normalized) || "yes".equalsIgnoreCase(normalized)) {
      return true;
    }
    if ("false".equalsIgnoreCase(normalized) || "0".equals(normalized) || "no".equalsIgnoreCase(normalized)) {
      return false;
    }
    throw new ConfigurationException(ConfigurationException.Reason.INVALID_OPTION,
      key + " must be a boolean, got '" + value + "'");
  }

  private void init() {
    maxIdleTime = DEFAULT_MAX_IDLE_TIME;
    maxPoolSize = DEFAULT_MAX_POOL_SIZE;
    preflightEnabled = false;
    expireOnIdle = false;
    notificationPollInterval = DEFAULT_NOTIFICATION_POLL_INTERVAL;
    reconnectPolicy = ReconnectPolicy.none();
  }
}
