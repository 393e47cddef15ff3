package dev.henneberger.vertx.configuration.core;

public enum SubscriptionState {
  STARTING,
  LISTENING,
  RETRYING,
  STOPPED
}
