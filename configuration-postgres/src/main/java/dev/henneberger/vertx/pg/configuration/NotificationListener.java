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
import dev.henneberger.vertx.configuration.core.ListenException;
import dev.henneberger.vertx.configuration.core.NotificationDecodeException;
import dev.henneberger.vertx.configuration.core.ReconnectPolicy;
import dev.henneberger.vertx.configuration.core.SubscribeRequest;
import dev.henneberger.vertx.configuration.core.SubscriptionState;
import dev.henneberger.vertx.configuration.core.SubscriptionStateChange;
import dev.henneberger.vertx.configuration.core.UpdateEvent;
import dev.henneberger.vertx.configuration.core.UpdateHandler;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import javax.sql.DataSource;
import org.postgresql.PGConnection;
import org.postgresql.PGNotification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds one pooled connection for the lifetime of a subscription, {@code LISTEN}s on the channel and
 * hands every notification to the subscriber's handler, one at a time.
 */
final class NotificationListener implements ChannelListener {

  private static final Logger LOG = LoggerFactory.getLogger(NotificationListener.class);

  private final Vertx vertx;
  private final DataSource dataSource;
  private final PostgresConfigurationOptions options;
  private final NotificationPayloadDecoder decoder;
  private final String subscriptionId;
  private final String channel;
  private final SubscribeRequest request;
  private final UpdateHandler handler;
  private final ConfigurationMetricsListener observer;
  private final AtomicBoolean shouldRun = new AtomicBoolean(true);
  private final Promise<Void> terminated = Promise.promise();

  private volatile Thread worker;
  private volatile SubscriptionState state = SubscriptionState.STARTING;

  NotificationListener(Vertx vertx,
                       DataSource dataSource,
                       PostgresConfigurationOptions options,
                       NotificationPayloadDecoder decoder,
                       String subscriptionId,
                       SubscribeRequest request,
                       UpdateHandler handler,
                       ConfigurationMetricsListener observer) {
    this.vertx = Objects.requireNonNull(vertx, "vertx");
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    this.options = Objects.requireNonNull(options, "options");
    this.decoder = Objects.requireNonNull(decoder, "decoder");
    this.subscriptionId = Objects.requireNonNull(subscriptionId, "subscriptionId");
    this.channel = options.getTable();
    this.request = Objects.requireNonNull(request, "request");
    this.handler = Objects.requireNonNull(handler, "handler");
    this.observer = Objects.requireNonNull(observer, "observer");
  }

  @Override
  public String subscriptionId() {
    return subscriptionId;
  }

  @Override
  public String channel() {
    return channel;
  }

  SubscriptionState state() {
    return state;
  }

  /**
   * Completes once the worker has released its connection, whatever the reason it stopped.
   */
  Future<Void> terminated() {
    return terminated.future();
  }

  synchronized void start() {
    if (worker != null) {
      return;
    }
    if (!shouldRun.get()) {
      finish(null, 0);
      return;
    }
    worker = new Thread(this::runLoop, "pg-config-listen-" + channel);
    worker.setDaemon(true);
    worker.start();
  }

  @Override
  public boolean cancel() {
    if (!shouldRun.compareAndSet(true, false)) {
      return false;
    }
    LOG.debug("Cancelling subscription {} on channel {}", subscriptionId, channel);
    Thread thread = worker;
    if (thread != null && thread != Thread.currentThread()) {
      thread.interrupt();
    }
    return true;
  }

  boolean awaitTermination(Duration timeout) throws InterruptedException {
    Thread thread = worker;
    if (thread == null) {
      return terminated.future().isComplete();
    }
    thread.join(Math.max(1L, timeout.toMillis()));
    return !thread.isAlive();
  }

  private void runLoop() {
    long attempt = 0;
    Throwable failure = null;
    try {
      while (shouldRun.get()) {
        attempt++;
        transition(SubscriptionState.STARTING, null, attempt);
        try {
          runSession(attempt);
          return;
        } catch (Exception e) {
          if (!shouldRun.get()) {
            return;
          }
          LOG.error("Listener for subscription {} on channel {} failed", subscriptionId, channel, e);

          ReconnectPolicy reconnectPolicy = options.getReconnectPolicy();
          if (!reconnectPolicy.allowsReconnect(e, attempt)) {
            failure = e;
            return;
          }
          transition(SubscriptionState.RETRYING, e, attempt);
          sleepInterruptibly(reconnectPolicy.delayMillis(attempt));
        }
      }
    } finally {
      finish(failure, attempt);
    }
  }

  private void runSession(long attempt) throws SQLException {
    Connection connection;
    try {
      connection = dataSource.getConnection();
    } catch (SQLException e) {
      throw new ListenException(channel, "could not acquire a connection to listen on channel " + channel, e);
    }

    try (Connection conn = connection) {
      PGConnection pgConnection = conn.unwrap(PGConnection.class);
      listen(conn);
      try {
        transition(SubscriptionState.LISTENING, null, attempt);
        awaitNotifications(pgConnection);
      } finally {
        // the connection goes back to the pool and must not keep the registration
        Thread.interrupted();
        unlisten(conn);
      }
    }
  }

  private void listen(Connection connection) {
    try (Statement statement = connection.createStatement()) {
      statement.setQueryTimeout(timeoutSeconds(options.getMaxIdleTime()));
      statement.execute("LISTEN " + ConfigurationQueryBuilder.quoteIdentifier(channel));
      LOG.debug("Subscription {} listening on channel {}", subscriptionId, channel);
    } catch (SQLException e) {
      throw new ListenException(channel, "error listening to channel " + channel, e);
    }
  }

  private void unlisten(Connection connection) {
    try (Statement statement = connection.createStatement()) {
      statement.setQueryTimeout(timeoutSeconds(options.getMaxIdleTime()));
      statement.execute("UNLISTEN " + ConfigurationQueryBuilder.quoteIdentifier(channel));
    } catch (SQLException e) {
      LOG.warn("Could not UNLISTEN channel {} for subscription {}", channel, subscriptionId, e);
    }
  }

  private void awaitNotifications(PGConnection pgConnection) throws SQLException {
    int sliceMillis = (int) Math.max(1L, Math.min(Integer.MAX_VALUE, options.effectivePollInterval().toMillis()));
    long idleNanos = options.getMaxIdleTime().toNanos();
    long idleDeadline = System.nanoTime() + idleNanos;

    while (shouldRun.get()) {
      PGNotification[] notifications = pgConnection.getNotifications(sliceMillis);
      if (notifications == null || notifications.length == 0) {
        if (options.isExpireOnIdle() && System.nanoTime() - idleDeadline >= 0) {
          LOG.debug("Subscription {} idle for {}, stopping", subscriptionId, options.getMaxIdleTime());
          return;
        }
        continue;
      }

      idleDeadline = System.nanoTime() + idleNanos;
      for (PGNotification notification : notifications) {
        if (!shouldRun.get()) {
          return;
        }
        if (!channel.equals(notification.getName())) {
          continue;
        }
        handleNotification(notification.getParameter());
      }
    }
  }

  void handleNotification(String payload) {
    Optional<UpdateEvent> decoded;
    try {
      decoded = decoder.decode(subscriptionId, payload);
    } catch (NotificationDecodeException e) {
      LOG.warn("Dropping notification for subscription {} on channel {}: {}", subscriptionId, channel, e.getMessage());
      observer.onDecodeFailure(subscriptionId, payload, e);
      return;
    } catch (RuntimeException e) {
      LOG.error("Unexpected failure decoding notification for subscription {}", subscriptionId, e);
      observer.onDecodeFailure(subscriptionId, payload, e);
      return;
    }

    if (decoded.isEmpty()) {
      LOG.debug("Ignoring notification without a data object on channel {}", channel);
      return;
    }
    UpdateEvent event = decoded.get();
    if (!request.accepts(event)) {
      return;
    }
    dispatchAndAwait(event);
  }

  private void dispatchAndAwait(UpdateEvent event) {
    CountDownLatch latch = new CountDownLatch(1);
    AtomicBoolean delivered = new AtomicBoolean(false);
    vertx.runOnContext(v -> invokeHandler(event, latch, delivered));
    try {
      latch.await();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return;
    }
    if (delivered.get()) {
      observer.onUpdate(event);
    }
  }

  private void invokeHandler(UpdateEvent event, CountDownLatch latch, AtomicBoolean delivered) {
    if (!shouldRun.get()) {
      latch.countDown();
      return;
    }
    delivered.set(true);
    try {
      Future<Void> result = handler.handle(event);
      if (result == null) {
        result = Future.succeededFuture();
      }
      result.onComplete(ar -> {
        if (ar.failed()) {
          logHandlerFailure(ar.cause());
        }
        latch.countDown();
      });
    } catch (Throwable err) {
      logHandlerFailure(err);
      latch.countDown();
    }
  }

  private void logHandlerFailure(Throwable error) {
    LOG.error("fail to call handler to notify event for configuration update subscribe: {}", subscriptionId, error);
  }

  private void finish(Throwable failure, long attempt) {
    shouldRun.set(false);
    transition(SubscriptionState.STOPPED, failure, attempt);
    terminated.tryComplete();
  }

  private void transition(SubscriptionState nextState, Throwable cause, long attempt) {
    SubscriptionState previous = this.state;
    if (previous == nextState && cause == null) {
      return;
    }
    this.state = nextState;
    observer.onStateChange(new SubscriptionStateChange(subscriptionId, previous, nextState, cause, attempt));
  }

  private void sleepInterruptibly(long millis) {
    if (millis <= 0) {
      return;
    }
    try {
      Thread.sleep(millis);
    } catch (InterruptedException ignored) {
      Thread.currentThread().interrupt();
    }
  }

  private static int timeoutSeconds(Duration timeout) {
    return (int) Math.max(1L, Math.min(Integer.MAX_VALUE, timeout.toSeconds()));
  }
}
