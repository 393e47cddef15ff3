package dev.henneberger.vertx.configuration.core;

import io.vertx.core.Future;
import io.vertx.core.Handler;
import java.util.Map;
import java.util.Optional;

public interface ConfigurationStore extends AutoCloseable {
  Future<Void> init(Map<String, String> properties);
  Future<GetResponse> get(GetRequest request);
  Future<String> subscribe(SubscribeRequest request, UpdateHandler handler);
  Future<Void> unsubscribe(UnsubscribeRequest request);
  Future<PreflightReport> preflight();
  Optional<SubscriptionState> subscriptionState(String subscriptionId);
  ConfigurationSubscription onStateChange(Handler<SubscriptionStateChange> handler);
  ConfigurationSubscription addMetricsListener(ConfigurationMetricsListener listener);

  @Override
  void close();
}
