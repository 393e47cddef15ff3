package dev.henneberger.vertx.configuration.core;

import java.util.Objects;

public final class UnsubscribeRequest {

  private final String id;

  public UnsubscribeRequest(String id) {
    this.id = Objects.requireNonNull(id, "id");
  }

  public String getId() {
    return id;
  }
}
