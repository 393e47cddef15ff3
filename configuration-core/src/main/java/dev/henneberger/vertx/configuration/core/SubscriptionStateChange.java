package dev.henneberger.vertx.configuration.core;

import java.util.Objects;

public final class SubscriptionStateChange {
  private final String subscriptionId;
  private final SubscriptionState previousState;
  private final SubscriptionState state;
  private final Throwable cause;
  private final long attempt;

  public SubscriptionStateChange(String subscriptionId,
                                 SubscriptionState previousState,
                                 SubscriptionState state,
                                 Throwable cause,
                                 long attempt) {
    this.subscriptionId = Objects.requireNonNull(subscriptionId, "subscriptionId");
    this.previousState = previousState;
    this.state = Objects.requireNonNull(state, "state");
    this.cause = cause;
    this.attempt = attempt;
  }

  public String subscriptionId() {
    return subscriptionId;
  }

  public SubscriptionState previousState() {
    return previousState;
  }

  public SubscriptionState state() {
    return state;
  }

  public Throwable cause() {
    return cause;
  }

  public long attempt() {
    return attempt;
  }

  public boolean isTerminal() {
    return state == SubscriptionState.STOPPED;
  }
}
