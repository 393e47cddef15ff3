package dev.henneberger.vertx.configuration.core;

/**
 * Base type for failures raised by a configuration store.
 */
public class ConfigurationStoreException extends RuntimeException {

  public ConfigurationStoreException(String message) {
    super(message);
  }

  public ConfigurationStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
