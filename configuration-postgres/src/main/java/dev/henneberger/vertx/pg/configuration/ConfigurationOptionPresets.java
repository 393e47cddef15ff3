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
import dev.henneberger.vertx.configuration.core.ReconnectPolicy;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Named option bundles for the usual ways a configuration store is deployed. Each preset only touches
 * tuning knobs; the connection string and table always come from the caller.
 */
public final class ConfigurationOptionPresets {

  public enum Profile {
    /** Long-running services: strict preflight, listeners that ride out database restarts. */
    PRODUCTION,
    /** A developer database: small pool, fast notification pickup, errors surface immediately. */
    LOCAL,
    /** Short jobs that should not keep a connection open once updates stop arriving. */
    EXPIRING;

    public static Profile parse(String value) {
      Objects.requireNonNull(value, "value");
      try {
        return Profile.valueOf(value.trim().toUpperCase(Locale.ROOT));
      } catch (IllegalArgumentException e) {
        throw new ConfigurationException(ConfigurationException.Reason.INVALID_OPTION,
          "unknown configuration profile '" + value + "'", e);
      }
    }
  }

  private ConfigurationOptionPresets() {
  }

  public static PostgresConfigurationOptions apply(Profile profile, PostgresConfigurationOptions options) {
    Objects.requireNonNull(profile, "profile");
    switch (profile) {
      case PRODUCTION:
        applyProductionDefaults(options);
        break;
      case LOCAL:
        applyLocalDevDefaults(options);
        break;
      case EXPIRING:
        applyExpiringListenerDefaults(options);
        break;
      default:
        throw new IllegalArgumentException("unhandled profile " + profile);
    }
    return options;
  }

  /**
   * Every subscription pins one pooled connection, so the pool leaves headroom for reads next to a
   * handful of listeners. Listener connections are re-established until the store is closed.
   */
  public static void applyProductionDefaults(PostgresConfigurationOptions options) {
    Objects.requireNonNull(options, "options");
    options
      .setPreflightEnabled(true)
      .setMaxPoolSize(8)
      .setMaxIdleTime(Duration.ofMinutes(1))
      .setNotificationPollInterval(Duration.ofSeconds(1))
      .setExpireOnIdle(false)
      .setReconnectPolicy(
        ReconnectPolicy.exponentialBackoff()
          .setInitialDelay(Duration.ofSeconds(1))
          .setMaxDelay(Duration.ofMinutes(1))
          .setMultiplier(2.0d)
          .setJitter(0.25d)
      );
  }

  public static void applyLocalDevDefaults(PostgresConfigurationOptions options) {
    Objects.requireNonNull(options, "options");
    options
      .setPreflightEnabled(true)
      .setMaxPoolSize(3)
      .setMaxIdleTime(Duration.ofSeconds(5))
      .setNotificationPollInterval(Duration.ofMillis(100))
      .setExpireOnIdle(false)
      .setReconnectPolicy(ReconnectPolicy.none());
  }

  /**
   * A listener that hears nothing for one idle window stops on its own and releases its connection.
   */
  public static void applyExpiringListenerDefaults(PostgresConfigurationOptions options) {
    Objects.requireNonNull(options, "options");
    options
      .setPreflightEnabled(false)
      .setMaxPoolSize(2)
      .setMaxIdleTime(Duration.ofSeconds(30))
      .setNotificationPollInterval(Duration.ofMillis(500))
      .setExpireOnIdle(true)
      .setReconnectPolicy(ReconnectPolicy.none());
  }
}
