package dev.henneberger.vertx.configuration.core;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Point lookup request. An empty key list selects every row; metadata entries are
 * equality filters that are ANDed together.
 */
public final class GetRequest {

  private final List<String> keys;
  private final Map<String, String> metadata;

  public GetRequest(List<String> keys, Map<String, String> metadata) {
    this.keys = keys == null ? Collections.emptyList() : List.copyOf(keys);
    this.metadata = metadata == null
      ? Collections.emptyMap()
      : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  public static GetRequest all() {
    return new GetRequest(null, null);
  }

  public static GetRequest keys(String... keys) {
    Objects.requireNonNull(keys, "keys");
    return new GetRequest(Arrays.asList(keys), null);
  }

  public GetRequest withMetadata(String field, String value) {
    Map<String, String> copy = new LinkedHashMap<>(metadata);
    copy.put(Objects.requireNonNull(field, "field"), Objects.requireNonNull(value, "value"));
    return new GetRequest(keys, copy);
  }

  public List<String> getKeys() {
    return keys;
  }

  public Map<String, String> getMetadata() {
    return metadata;
  }
}
