package dev.henneberger.vertx.configuration.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A pushed change to the configuration table, delivered to the subscription that received it.
 */
public final class UpdateEvent {

  private final String id;
  private final Map<String, ConfigurationItem> items;

  public UpdateEvent(String id, Map<String, ConfigurationItem> items) {
    this.id = Objects.requireNonNull(id, "id");
    this.items = items == null || items.isEmpty()
      ? Collections.emptyMap()
      : Collections.unmodifiableMap(new LinkedHashMap<>(items));
  }

  public static UpdateEvent of(String id, ConfigurationItem item) {
    Objects.requireNonNull(item, "item");
    return new UpdateEvent(id, Collections.singletonMap(item.getKey(), item));
  }

  public String getId() {
    return id;
  }

  public Map<String, ConfigurationItem> getItems() {
    return items;
  }

  @Override
  public String toString() {
    return "UpdateEvent{" +
      "id='" + id + '\'' +
      ", items=" + items +
      '}';
  }
}
