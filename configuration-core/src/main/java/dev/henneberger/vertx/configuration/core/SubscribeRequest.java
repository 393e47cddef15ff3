package dev.henneberger.vertx.configuration.core;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Subscription request. When keys are given only updates to those keys are delivered.
 */
public final class SubscribeRequest {

  private final Set<String> keys;
  private final Map<String, String> metadata;

  public SubscribeRequest(List<String> keys, Map<String, String> metadata) {
    this.keys = keys == null
      ? Collections.emptySet()
      : Collections.unmodifiableSet(new LinkedHashSet<>(keys));
    this.metadata = metadata == null
      ? Collections.emptyMap()
      : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  public static SubscribeRequest all() {
    return new SubscribeRequest(null, null);
  }

  public static SubscribeRequest keys(String... keys) {
    Objects.requireNonNull(keys, "keys");
    return new SubscribeRequest(Arrays.asList(keys), null);
  }

  public Set<String> getKeys() {
    return keys;
  }

  public Map<String, String> getMetadata() {
    return metadata;
  }

  public boolean accepts(UpdateEvent event) {
    Objects.requireNonNull(event, "event");
    if (keys.isEmpty()) {
      return true;
    }
    for (String key : event.getItems().keySet()) {
      if (!keys.contains(key)) {
        return false;
      }
    }
    return true;
  }
}
