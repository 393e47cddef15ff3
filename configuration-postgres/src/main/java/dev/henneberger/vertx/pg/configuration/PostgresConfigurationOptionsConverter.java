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

import dev.henneberger.vertx.configuration.core.ReconnectPolicy;
import io.vertx.core.json.JsonObject;
import java.time.Duration;

final class PostgresConfigurationOptionsConverter {

  private PostgresConfigurationOptionsConverter() {
  }

  static void fromJson(JsonObject json, PostgresConfigurationOptions options) {
    if (json == null) {
      return;
    }

    if (json.containsKey("connectionString")) {
      options.setConnectionString(json.getString("connectionString"));
    }
    if (json.containsKey("table")) {
      options.setTable(json.getString("table"));
    }
    if (json.containsKey("maxIdleTimeMs")) {
      options.setMaxIdleTime(Duration.ofMillis(json.getLong("maxIdleTimeMs")));
    }
    if (json.containsKey("maxPoolSize")) {
      options.setMaxPoolSize(json.getInteger("maxPoolSize"));
    }
    if (json.containsKey("preflightEnabled")) {
      options.setPreflightEnabled(json.getBoolean("preflightEnabled"));
    }
    if (json.containsKey("expireOnIdle")) {
      options.setExpireOnIdle(json.getBoolean("expireOnIdle"));
    }
    if (json.containsKey("notificationPollIntervalMs")) {
      options.setNotificationPollInterval(Duration.ofMillis(json.getLong("notificationPollIntervalMs")));
    }

    JsonObject reconnectJson = json.getJsonObject("reconnectPolicy");
    if (reconnectJson != null) {
      options.setReconnectPolicy(ReconnectPolicy.fromJson(reconnectJson));
    }
  }

  static void toJson(PostgresConfigurationOptions options, JsonObject json) {
    json.put("connectionString", options.getConnectionString());
    json.put("table", options.getTable());
    json.put("maxIdleTimeMs", options.getMaxIdleTime().toMillis());
    json.put("maxPoolSize", options.getMaxPoolSize());
    json.put("preflightEnabled", options.isPreflightEnabled());
    json.put("expireOnIdle", options.isExpireOnIdle());
    json.put("notificationPollIntervalMs", options.getNotificationPollInterval().toMillis());

    ReconnectPolicy reconnectPolicy = options.getReconnectPolicy();
    if (reconnectPolicy != null && reconnectPolicy.isEnabled()) {
      json.put("reconnectPolicy", reconnectPolicy.toJson());
    }
  }
}
