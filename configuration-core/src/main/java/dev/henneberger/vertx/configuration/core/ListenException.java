package dev.henneberger.vertx.configuration.core;

public final class ListenException extends ConfigurationStoreException {

  private final String channel;

  public ListenException(String channel, String message, Throwable cause) {
    super(message, cause);
    this.channel = channel;
  }

  public String channel() {
    return channel;
  }
}
