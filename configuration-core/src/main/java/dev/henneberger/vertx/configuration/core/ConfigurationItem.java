package dev.henneberger.vertx.configuration.core;

import io.vertx.core.json.JsonObject;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single configuration row: its value, an opaque version token and string metadata.
 */
public final class ConfigurationItem {

  private final String key;
  private final String value;
  private final String version;
  private final Map<String, String> metadata;

  public ConfigurationItem(String key, String value, String version, Map<String, String> metadata) {
    this.key = Objects.requireNonNull(key, "key");
    this.value = value;
    this.version = version;
    this.metadata = metadata == null || metadata.isEmpty()
      ? Collections.emptyMap()
      : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  public String getKey() {
    return key;
  }

  public String getValue() {
    return value;
  }

  public String getVersion() {
    return version;
  }

  public Map<String, String> getMetadata() {
    return metadata;
  }

  public JsonObject toJson() {
    return new JsonObject()
      .put("key", key)
      .put("value", value)
      .put("version", version)
      .put("metadata", new JsonObject(new LinkedHashMap<>(metadata)));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ConfigurationItem)) {
      return false;
    }
    ConfigurationItem other = (ConfigurationItem) o;
    return key.equals(other.key)
      && Objects.equals(value, other.value)
      && Objects.equals(version, other.version)
      && metadata.equals(other.metadata);
  }

  @Override
  public int hashCode() {
    return Objects.hash(key, value, version, metadata);
  }

  @Override
  public String toString() {
    return "ConfigurationItem{" +
      "key='" + key + '\'' +
      ", value='" + value + '\'' +
      ", version='" + version + '\'' +
      ", metadata=" + metadata +
      '}';
  }
}
