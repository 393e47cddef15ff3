package dev.henneberger.vertx.configuration.core;

public final class QueryException extends ConfigurationStoreException {

  public QueryException(String message) {
    super(message);
  }

  public QueryException(String message, Throwable cause) {
    super(message, cause);
  }
}
