package dev.henneberger.vertx.configuration.core;

import java.util.Objects;

public final class StoreConnectionException extends ConfigurationStoreException {

  public enum Phase {
    CONNECT,
    PING
  }

  private final Phase phase;

  public StoreConnectionException(Phase phase, String message, Throwable cause) {
    super(message, cause);
    this.phase = Objects.requireNonNull(phase, "phase");
  }

  public Phase phase() {
    return phase;
  }
}
