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
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.zaxxer.hikari.HikariDataSource;
import dev.henneberger.vertx.configuration.core.ConfigurationMetricsListener;
import dev.henneberger.vertx.configuration.core.SubscribeRequest;
import dev.henneberger.vertx.configuration.core.SubscriptionState;
import dev.henneberger.vertx.configuration.core.SubscriptionStateChange;
import dev.henneberger.vertx.configuration.core.UpdateEvent;
import dev.henneberger.vertx.configuration.core.UpdateHandler;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class NotificationListenerTest {

  private static final String PAYLOAD = "{\"data\":{\"key\":\"feature.a\",\"value\":\"on\",\"version\":\"3\"}}";

  private Vertx vertx;
  private HikariDataSource dataSource;
  private final RecordingObserver observer = new RecordingObserver();
  private final List<UpdateEvent> received = new CopyOnWriteArrayList<>();

  @BeforeEach
  void setUp() {
    vertx = Vertx.vertx();
    dataSource = new HikariDataSource();
  }

  @AfterEach
  void tearDown() throws Exception {
    dataSource.close();
    vertx.close().toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
  }

  private NotificationListener listener(SubscribeRequest request, UpdateHandler handler) {
    PostgresConfigurationOptions options = new PostgresConfigurationOptions()
      .setConnectionString("host=localhost")
      .setTable("cfg");
    return new NotificationListener(vertx, dataSource, options, new NotificationPayloadDecoder(),
      "sub-1", request, handler, observer);
  }

  private UpdateHandler recording() {
    return event -> {
      received.add(event);
      return Future.succeededFuture();
    };
  }

  @Test
  void deliversDecodedUpdateToHandler() {
    NotificationListener listener = listener(SubscribeRequest.all(), recording());

    listener.handleNotification(PAYLOAD);

    assertEquals(1, received.size());
    assertEquals("on", received.get(0).getItems().get("feature.a").getValue());
    assertEquals("sub-1", received.get(0).getId());
    assertEquals(1, observer.updates.size());
    assertEquals("cfg", listener.channel());
  }

  @Test
  void malformedPayloadIsReportedAndSkipped() {
    NotificationListener listener = listener(SubscribeRequest.all(), recording());

    listener.handleNotification("{not json");
    listener.handleNotification(PAYLOAD);

    assertEquals(List.of("{not json"), observer.decodeFailures);
    assertEquals(1, received.size());
  }

  @Test
  void payloadWithoutDataObjectIsIgnored() {
    NotificationListener listener = listener(SubscribeRequest.all(), recording());

    listener.handleNotification("{\"data\":[]}");

    assertTrue(received.isEmpty());
    assertTrue(observer.decodeFailures.isEmpty());
  }

  @Test
  void keyFilterSkipsOtherKeys() {
    NotificationListener listener = listener(SubscribeRequest.keys("feature.b"), recording());

    listener.handleNotification(PAYLOAD);

    assertTrue(received.isEmpty());
  }

  @Test
  void handlerFailuresDoNotStopDelivery() {
    NotificationListener failing = listener(SubscribeRequest.all(), event -> {
      received.add(event);
      return Future.failedFuture("downstream unavailable");
    });
    failing.handleNotification(PAYLOAD);

    NotificationListener throwing = listener(SubscribeRequest.all(), event -> {
      received.add(event);
      throw new IllegalStateException("boom");
    });
    throwing.handleNotification(PAYLOAD);

    assertEquals(2, received.size());
  }

  @Test
  void cancelledListenerDeliversNothing() {
    NotificationListener listener = listener(SubscribeRequest.all(), recording());

    assertTrue(listener.cancel());
    assertFalse(listener.cancel());
    listener.handleNotification(PAYLOAD);

    assertTrue(received.isEmpty());
    assertTrue(observer.updates.isEmpty());
  }

  @Test
  void listenerCancelledBeforeStartStopsImmediately() throws Exception {
    NotificationListener listener = listener(SubscribeRequest.all(), recording());

    listener.cancel();
    listener.start();

    listener.terminated().toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
    assertEquals(SubscriptionState.STOPPED, listener.state());
    assertEquals(SubscriptionState.STOPPED, observer.states.get(observer.states.size() - 1).state());
  }

  private static final class RecordingObserver implements ConfigurationMetricsListener {
    private final List<UpdateEvent> updates = new CopyOnWriteArrayList<>();
    private final List<String> decodeFailures = new CopyOnWriteArrayList<>();
    private final List<SubscriptionStateChange> states = new CopyOnWriteArrayList<>();

    @Override
    public void onUpdate(UpdateEvent event) {
      updates.add(event);
    }

    @Override
    public void onDecodeFailure(String subscriptionId, String payload, Throwable error) {
      decodeFailures.add(payload);
    }

    @Override
    public void onStateChange(SubscriptionStateChange stateChange) {
      states.add(stateChange);
    }
  }
}
