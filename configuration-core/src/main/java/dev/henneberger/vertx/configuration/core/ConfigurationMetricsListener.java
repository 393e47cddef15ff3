package dev.henneberger.vertx.configuration.core;

public interface ConfigurationMetricsListener {
  void onUpdate(UpdateEvent event);
  void onDecodeFailure(String subscriptionId, String payload, Throwable error);
  void onStateChange(SubscriptionStateChange stateChange);
}
