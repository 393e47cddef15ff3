package dev.henneberger.vertx.configuration.core;

public final class AlreadyInitializedException extends IllegalStateException {

  public AlreadyInitializedException(String storeName) {
    super(storeName + " configuration store already initialized");
  }
}
