package dev.henneberger.vertx.configuration.core;

import io.vertx.core.Future;

@FunctionalInterface
public interface UpdateHandler {
  Future<Void> handle(UpdateEvent event);
}
