package dev.henneberger.vertx.configuration.core;

public final class NotificationDecodeException extends ConfigurationStoreException {

  public NotificationDecodeException(String message) {
    super(message);
  }

  public NotificationDecodeException(String message, Throwable cause) {
    super(message, cause);
  }
}
