package dev.henneberger.vertx.configuration.core;

@FunctionalInterface
public interface ConfigurationSubscription {
  void cancel();
}
