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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.henneberger.vertx.configuration.core.ConfigurationException;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class ConfigurationOptionPresetsTest {

  @Test
  void productionKeepsListenersAliveAcrossOutages() {
    PostgresConfigurationOptions options = new PostgresConfigurationOptions();
    ConfigurationOptionPresets.applyProductionDefaults(options);

    assertTrue(options.isPreflightEnabled());
    assertFalse(options.isExpireOnIdle());
    assertEquals(8, options.getMaxPoolSize());
    assertEquals(Duration.ofMinutes(1), options.getMaxIdleTime());
    assertTrue(options.getReconnectPolicy().isEnabled());
    assertEquals(Duration.ofSeconds(1), options.getReconnectPolicy().getInitialDelay());
    assertEquals(Duration.ofSeconds(1), options.effectivePollInterval());
  }

  @Test
  void localPicksUpNotificationsQuicklyWithoutRetrying() {
    PostgresConfigurationOptions options = new PostgresConfigurationOptions();
    ConfigurationOptionPresets.applyLocalDevDefaults(options);

    assertEquals(3, options.getMaxPoolSize());
    assertEquals(Duration.ofMillis(100), options.effectivePollInterval());
    assertFalse(options.getReconnectPolicy().isEnabled());
  }

  @Test
  void expiringListenersStopAfterOneIdleWindow() {
    PostgresConfigurationOptions options = ConfigurationOptionPresets.apply(
      ConfigurationOptionPresets.Profile.EXPIRING, new PostgresConfigurationOptions());

    assertTrue(options.isExpireOnIdle());
    assertEquals(Duration.ofSeconds(30), options.getMaxIdleTime());
    assertEquals(2, options.getMaxPoolSize());
  }

  @Test
  void presetsLeaveConnectionSettingsAlone() {
    PostgresConfigurationOptions options = new PostgresConfigurationOptions()
      .setConnectionString("host=db")
      .setTable("cfg");

    PostgresConfigurationOptions applied = ConfigurationOptionPresets.apply(
      ConfigurationOptionPresets.Profile.PRODUCTION, options);

    assertSame(options, applied);
    assertEquals("host=db", applied.getConnectionString());
    assertEquals("cfg", applied.getTable());
  }

  @Test
  void parsesProfileNames() {
    assertEquals(ConfigurationOptionPresets.Profile.LOCAL, ConfigurationOptionPresets.Profile.parse(" local "));
    ConfigurationException error = assertThrows(ConfigurationException.class,
      () -> ConfigurationOptionPresets.Profile.parse("staging"));
    assertEquals(ConfigurationException.Reason.INVALID_OPTION, error.reason());
  }
}
