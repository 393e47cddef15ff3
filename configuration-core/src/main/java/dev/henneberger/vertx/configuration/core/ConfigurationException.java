package dev.henneberger.vertx.configuration.core;

import java.util.Objects;

/**
 * Invalid or missing store properties. Always fatal to initialization.
 */
public final class ConfigurationException extends ConfigurationStoreException {

  public enum Reason {
    MISSING_CONNECTION_STRING,
    MISSING_TABLE_NAME,
    INVALID_CHARACTERS,
    TOO_LONG_IDENTIFIER,
    INVALID_MAX_TIMEOUT,
    INVALID_OPTION
  }

  private final Reason reason;

  public ConfigurationException(Reason reason, String message) {
    super(message);
    this.reason = Objects.requireNonNull(reason, "reason");
  }

  public ConfigurationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = Objects.requireNonNull(reason, "reason");
  }

  public Reason reason() {
    return reason;
  }
}
