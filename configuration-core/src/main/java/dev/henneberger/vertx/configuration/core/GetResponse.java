package dev.henneberger.vertx.configuration.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public final class GetResponse {

  private final Map<String, ConfigurationItem> items;

  public GetResponse(Map<String, ConfigurationItem> items) {
    this.items = items == null || items.isEmpty()
      ? Collections.emptyMap()
      : Collections.unmodifiableMap(new LinkedHashMap<>(items));
  }

  public static GetResponse empty() {
    return new GetResponse(null);
  }

  public Map<String, ConfigurationItem> getItems() {
    return items;
  }

  public ConfigurationItem item(String key) {
    return items.get(key);
  }

  public boolean isEmpty() {
    return items.isEmpty();
  }
}
