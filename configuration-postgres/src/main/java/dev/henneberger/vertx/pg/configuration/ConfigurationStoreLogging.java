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

import dev.henneberger.vertx.configuration.core.ConfigurationMetricsListener;
import dev.henneberger.vertx.configuration.core.ConfigurationStore;
import dev.henneberger.vertx.configuration.core.ConfigurationSubscription;
import dev.henneberger.vertx.configuration.core.SubscriptionState;
import dev.henneberger.vertx.configuration.core.SubscriptionStateChange;
import dev.henneberger.vertx.configuration.core.UpdateEvent;
import java.util.Objects;
import org.slf4j.Logger;

/**
 * Routes a store's subscription lifecycle and dropped notifications to an application logger.
 */
public final class ConfigurationStoreLogging {

  private static final int MAX_LOGGED_PAYLOAD = 256;

  private ConfigurationStoreLogging() {
  }

  /**
   * A listener that stopped on an error logs at error level, a retry at warn, anything else at info.
   * Updates are logged at debug with their keys only, never values. Cancelling the returned
   * subscription detaches both the state and the decode-failure logging.
   */
  public static ConfigurationSubscription attachDefaultLogging(ConfigurationStore store,
                                                               Logger logger,
                                                               String storeName) {
    Objects.requireNonNull(store, "store");
    Objects.requireNonNull(logger, "logger");
    String name = storeName == null || storeName.isBlank() ? "configuration" : storeName;

    ConfigurationSubscription states = store.onStateChange(change -> logStateChange(logger, name, change));
    ConfigurationSubscription updates = store.addMetricsListener(new ConfigurationMetricsListener() {
      @Override
      public void onUpdate(UpdateEvent event) {
        if (logger.isDebugEnabled()) {
          logger.debug("table={} subscription={} updated keys={}", name, event.getId(), event.getItems().keySet());
        }
      }

      @Override
      public void onDecodeFailure(String subscriptionId, String payload, Throwable error) {
        logger.warn("table={} subscription={} dropped notification payload={} reason={}",
          name, subscriptionId, abbreviate(payload), error.getMessage());
      }

      @Override
      public void onStateChange(SubscriptionStateChange stateChange) {
      }
    });

    return () -> {
      states.cancel();
      updates.cancel();
    };
  }

  static void logStateChange(Logger logger, String name, SubscriptionStateChange change) {
    Throwable cause = change.cause();
    if (change.state() == SubscriptionState.STOPPED && cause != null) {
      logger.error("table={} subscription={} listener stopped after {} attempt(s)",
        name, change.subscriptionId(), change.attempt(), cause);
    } else if (change.state() == SubscriptionState.RETRYING) {
      logger.warn("table={} subscription={} reconnecting, attempt={} cause={}",
        name, change.subscriptionId(), change.attempt(), cause == null ? "unknown" : cause.toString());
    } else {
      logger.info("table={} subscription={} {} -> {}",
        name, change.subscriptionId(), change.previousState(), change.state());
    }
  }

  static String abbreviate(String payload) {
    if (payload == null) {
      return "null";
    }
    return payload.length() <= MAX_LOGGED_PAYLOAD ? payload : payload.substring(0, MAX_LOGGED_PAYLOAD) + "...";
  }
}
