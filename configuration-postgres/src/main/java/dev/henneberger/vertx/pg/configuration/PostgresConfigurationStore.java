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

import com.zaxxer.hikari.HikariDataSource;
import dev.henneberger.vertx.configuration.core.AlreadyInitializedException;
import dev.henneberger.vertx.configuration.core.ConfigurationItem;
import dev.henneberger.vertx.configuration.core.ConfigurationMetricsListener;
import dev.henneberger.vertx.configuration.core.ConfigurationStore;
import dev.henneberger.vertx.configuration.core.ConfigurationSubscription;
import dev.henneberger.vertx.configuration.core.GetRequest;
import dev.henneberger.vertx.configuration.core.GetResponse;
import dev.henneberger.vertx.configuration.core.PreflightFailedException;
import dev.henneberger.vertx.configuration.core.PreflightIssue;
import dev.henneberger.vertx.configuration.core.PreflightReport;
import dev.henneberger.vertx.configuration.core.PreflightReports;
import dev.henneberger.vertx.configuration.core.QueryException;
import dev.henneberger.vertx.configuration.core.SubscribeRequest;
import dev.henneberger.vertx.configuration.core.SubscriptionState;
import dev.henneberger.vertx.configuration.core.SubscriptionStateChange;
import dev.henneberger.vertx.configuration.core.UnsubscribeRequest;
import dev.henneberger.vertx.configuration.core.UpdateEvent;
import dev.henneberger.vertx.configuration.core.UpdateHandler;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Vertx;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration store backed by a PostgreSQL table, with change subscriptions delivered through
 * {@code LISTEN}/{@code NOTIFY} on a channel named after the table.
 *
 * <p>The table is expected to expose {@code key}, {@code value}, {@code version} and a JSON
 * {@code metadata} column. Writers publish updates with
 * {@code pg_notify('<table>', '{"data": {"key": ..., "value": ..., "version": ..., "metadata": {...}}}')}.
 * Table and channel names are used exactly as configured, without case folding.
 */
public class PostgresConfigurationStore implements ConfigurationStore {

  private static final Logger LOG = LoggerFactory.getLogger(PostgresConfigurationStore.class);
  private static final String STORE_NAME = "postgres";
  private static final Set<String> REQUIRED_COLUMNS = Set.of("key", "value", "version", "metadata");
  private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(5);

  private final Vertx vertx;
  private final NotificationPayloadDecoder decoder = new NotificationPayloadDecoder();
  private final SubscriptionRegistry<NotificationListener> registry = new SubscriptionRegistry<>();
  private final List<Handler<SubscriptionStateChange>> stateHandlers = new CopyOnWriteArrayList<>();
  private final List<ConfigurationMetricsListener> metricsListeners = new CopyOnWriteArrayList<>();
  private final AtomicBoolean initClaimed = new AtomicBoolean(false);
  private final AtomicBoolean closed = new AtomicBoolean(false);
  private final ConfigurationMetricsListener listenerSink = new ListenerSink();

  private volatile PostgresConfigurationOptions options;
  private volatile HikariDataSource dataSource;

  public PostgresConfigurationStore(Vertx vertx) {
    this.vertx = Objects.requireNonNull(vertx, "vertx");
  }

  @Override
  public Future<Void> init(Map<String, String> properties) {
    Future<Void> claim = claimInit();
    if (claim.failed()) {
      return claim;
    }
    PostgresConfigurationOptions parsed;
    try {
      parsed = PostgresConfigurationOptions.fromProperties(properties);
    } catch (RuntimeException e) {
      LOG.error("Invalid {} configuration store properties: {}", STORE_NAME, e.getMessage());
      return Future.failedFuture(e);
    }
    return connect(parsed);
  }

  /**
   * Initializes the store from already built options. A store can be initialized once, whether or not
   * that attempt succeeded.
   */
  public Future<Void> init(PostgresConfigurationOptions options) {
    Objects.requireNonNull(options, "options");
    Future<Void> claim = claimInit();
    if (claim.failed()) {
      return claim;
    }
    PostgresConfigurationOptions resolved = new PostgresConfigurationOptions(options);
    try {
      resolved.validate();
    } catch (RuntimeException e) {
      LOG.error("Invalid {} configuration store options: {}", STORE_NAME, e.getMessage());
      return Future.failedFuture(e);
    }
    return connect(resolved);
  }

  private Future<Void> claimInit() {
    if (closed.get()) {
      return Future.failedFuture(new IllegalStateException("configuration store is closed"));
    }
    if (!initClaimed.compareAndSet(false, true)) {
      return Future.failedFuture(new AlreadyInitializedException(STORE_NAME));
    }
    return Future.succeededFuture();
  }

  private Future<Void> connect(PostgresConfigurationOptions resolved) {
    return vertx.<Void>executeBlocking(() -> {
      HikariDataSource pool = PostgresConnectionManager.connect(resolved);
      try {
        PreflightReport report = runPreflightChecks(pool, resolved);
        if (!report.ok()) {
          if (resolved.isPreflightEnabled()) {
            throw new PreflightFailedException(report);
          }
          LOG.warn("{}", PreflightReports.describeFailure(report));
        }
        if (!report.warnings().isEmpty()) {
          LOG.warn("{}", PreflightReports.describeWarnings(report));
        }
      } catch (RuntimeException e) {
        pool.close();
        throw e;
      }
      this.options = resolved;
      this.dataSource = pool;
      if (closed.get()) {
        closeDataSource();
        throw new IllegalStateException("configuration store is closed");
      }
      LOG.info("{} configuration store initialized on table {}", STORE_NAME, resolved.getTable());
      return null;
    }).onFailure(err -> LOG.error("Failed to initialize {} configuration store", STORE_NAME, err));
  }

  @Override
  public Future<GetResponse> get(GetRequest request) {
    Objects.requireNonNull(request, "request");
    HikariDataSource pool;
    try {
      pool = requireReady();
    } catch (IllegalStateException e) {
      return Future.failedFuture(e);
    }

    ConfigurationQuery query;
    try {
      query = ConfigurationQueryBuilder.build(request.getKeys(), request.getMetadata(), options.getTable());
    } catch (QueryException e) {
      return Future.failedFuture(e);
    }

    return vertx.executeBlocking(() -> {
      Map<String, ConfigurationItem> items = new LinkedHashMap<>();
      try (Connection connection = pool.getConnection();
           PreparedStatement statement = connection.prepareStatement(query.sql())) {
        statement.setQueryTimeout(queryTimeoutSeconds());
        query.bind(statement);
        try (ResultSet rs = statement.executeQuery()) {
          while (rs.next()) {
            ConfigurationItem item = ConfigurationRows.read(rs);
            items.put(item.getKey(), item);
          }
        }
      } catch (SQLException e) {
        throw new QueryException("postgres configuration store query error : " + e.getMessage(), e);
      }
      return items.isEmpty() ? GetResponse.empty() : new GetResponse(items);
    });
  }

  @Override
  public Future<String> subscribe(SubscribeRequest request, UpdateHandler handler) {
    Objects.requireNonNull(request, "request");
    Objects.requireNonNull(handler, "handler");
    HikariDataSource pool;
    try {
      pool = requireReady();
    } catch (IllegalStateException e) {
      return Future.failedFuture(e);
    }

    String subscriptionId = UUID.randomUUID().toString();
    NotificationListener listener = new NotificationListener(
      vertx, pool, options, decoder, subscriptionId, request, handler, listenerSink);

    Optional<NotificationListener> superseded;
    try {
      superseded = registry.register(listener);
    } catch (IllegalStateException e) {
      return Future.failedFuture(e);
    }
    superseded.ifPresent(previous -> LOG.info(
      "Subscription {} supersedes {} on channel {}", subscriptionId, previous.subscriptionId(), listener.channel()));

    listener.terminated().onComplete(ar -> registry.discard(listener));
    listener.start();
    LOG.info("Subscription {} started on channel {}", subscriptionId, listener.channel());
    return Future.succeededFuture(subscriptionId);
  }

  @Override
  public Future<Void> unsubscribe(UnsubscribeRequest request) {
    Objects.requireNonNull(request, "request");
    Optional<NotificationListener> removed = registry.remove(request.getId());
    if (removed.isPresent()) {
      LOG.info("Unsubscribed {} from channel {}", request.getId(), removed.get().channel());
    } else {
      LOG.debug("Unsubscribe for unknown subscription {} ignored", request.getId());
    }
    return Future.succeededFuture();
  }

  @Override
  public Future<PreflightReport> preflight() {
    HikariDataSource pool;
    try {
      pool = requireReady();
    } catch (IllegalStateException e) {
      return Future.failedFuture(e);
    }
    PostgresConfigurationOptions current = options;
    return vertx.executeBlocking(() -> runPreflightChecks(pool, current));
  }

  @Override
  public Optional<SubscriptionState> subscriptionState(String subscriptionId) {
    return registry.find(subscriptionId).map(NotificationListener::state);
  }

  @Override
  public ConfigurationSubscription onStateChange(Handler<SubscriptionStateChange> handler) {
    Handler<SubscriptionStateChange> resolved = Objects.requireNonNull(handler, "handler");
    stateHandlers.add(resolved);
    return () -> stateHandlers.remove(resolved);
  }

  @Override
  public ConfigurationSubscription addMetricsListener(ConfigurationMetricsListener listener) {
    ConfigurationMetricsListener resolved = Objects.requireNonNull(listener, "listener");
    metricsListeners.add(resolved);
    return () -> metricsListeners.remove(resolved);
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    List<NotificationListener> listeners = registry.cancelAll();
    for (NotificationListener listener : listeners) {
      try {
        if (!listener.awaitTermination(CLOSE_TIMEOUT)) {
          LOG.warn("Listener {} on channel {} did not stop within {}",
            listener.subscriptionId(), listener.channel(), CLOSE_TIMEOUT);
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        break;
      }
    }
    closeDataSource();
    LOG.info("{} configuration store closed", STORE_NAME);
  }

  Optional<NotificationListener> listener(String subscriptionId) {
    return registry.find(subscriptionId);
  }

  private HikariDataSource requireReady() {
    if (closed.get()) {
      throw new IllegalStateException("configuration store is closed");
    }
    HikariDataSource pool = dataSource;
    if (pool == null) {
      throw new IllegalStateException("configuration store is not initialized");
    }
    return pool;
  }

  private int queryTimeoutSeconds() {
    return (int) Math.max(1L, Math.min(Integer.MAX_VALUE, options.getMaxIdleTime().toSeconds()));
  }

  private synchronized void closeDataSource() {
    HikariDataSource pool = dataSource;
    dataSource = null;
    if (pool != null) {
      pool.close();
    }
  }

  static PreflightReport runPreflightChecks(HikariDataSource pool, PostgresConfigurationOptions options) {
    List<PreflightIssue> issues = new ArrayList<>();
    try (Connection conn = pool.getConnection()) {
      if (checkTableExists(conn, options.getTable(), issues)) {
        checkColumns(conn, options.getTable(), issues);
      }
    } catch (SQLException e) {
      throw new QueryException("postgres configuration store query error : " + e.getMessage(), e);
    }
    return new PreflightReport(issues);
  }

  private static boolean checkTableExists(Connection conn, String table, List<PreflightIssue> issues) throws SQLException {
    try (PreparedStatement statement = conn.prepareStatement("SELECT EXISTS (SELECT FROM pg_tables WHERE tablename = ?)")) {
      statement.setString(1, table);
      try (ResultSet rs = statement.executeQuery()) {
        if (rs.next() && rs.getBoolean(1)) {
          return true;
        }
      }
    }
    issues.add(PreflightIssue.error(
      "TABLE_MISSING",
      "Configuration table '" + table + "' does not exist",
      "Create the table with key, value, version and metadata columns."
    ));
    return false;
  }

  private static void checkColumns(Connection conn, String table, List<PreflightIssue> issues) throws SQLException {
    Set<String> missing = new TreeSet<>(REQUIRED_COLUMNS);
    try (PreparedStatement statement = conn.prepareStatement(
      "SELECT column_name FROM information_schema.columns WHERE table_name = ?")) {
      statement.setString(1, table);
      try (ResultSet rs = statement.executeQuery()) {
        while (rs.next()) {
          missing.remove(rs.getString(1));
        }
      }
    }
    if (!missing.isEmpty()) {
      issues.add(PreflightIssue.error(
        "COLUMNS_MISSING",
        "Configuration table '" + table + "' is missing columns " + missing,
        "Add the missing columns; metadata must hold a JSON object of strings."
      ));
    }
  }

  private final class ListenerSink implements ConfigurationMetricsListener {

    @Override
    public void onUpdate(UpdateEvent event) {
      for (ConfigurationMetricsListener listener : metricsListeners) {
        listener.onUpdate(event);
      }
    }

    @Override
    public void onDecodeFailure(String subscriptionId, String payload, Throwable error) {
      for (ConfigurationMetricsListener listener : metricsListeners) {
        listener.onDecodeFailure(subscriptionId, payload, error);
      }
    }

    @Override
    public void onStateChange(SubscriptionStateChange change) {
      for (ConfigurationMetricsListener listener : metricsListeners) {
        listener.onStateChange(change);
      }
      for (Handler<SubscriptionStateChange> handler : stateHandlers) {
        vertx.runOnContext(v -> handler.handle(change));
      }
    }
  }
}
