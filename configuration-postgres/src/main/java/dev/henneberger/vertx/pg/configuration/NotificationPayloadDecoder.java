/*
 * Copyright (C) 2026 Daniel Henneberger
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.henneberger.vertx.pg.configuration;

import dev.henneberger.vertx.configuration.core.ConfigurationItem;
import dev.henneberger.vertx.configuration.core.NotificationDecodeException;
import dev.henneberger.vertx.configuration.core.UpdateEvent;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.Json;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Decodes a {@code NOTIFY} payload of the form
 * {@code {"data": {"key": ..., "value": ..., "version": ..., "metadata": {...}}}}.
 * Field names inside {@code data} match case-insensitively; unknown fields are ignored.
 */
final class NotificationPayloadDecoder {

  private static final String DATA_FIELD = "data";

  /**
   * @return the decoded event, or empty when the payload carries no {@code data} object
   * @throws NotificationDecodeException when the payload is not a JSON object or a known field has the wrong type
   */
  Optional<UpdateEvent> decode(String subscriptionId, String payload) {
    if (payload == null || payload.isBlank()) {
      throw new NotificationDecodeException("notification payload is empty");
    }

    Object parsed;
    try {
      parsed = Json.decodeValue(payload);
    } catch (DecodeException e) {
      throw new NotificationDecodeException("notification payload is not valid JSON", e);
    }
    if (!(parsed instanceof JsonObject)) {
      throw new NotificationDecodeException("notification payload is not a JSON object");
    }

    Object data = ((JsonObject) parsed).getValue(DATA_FIELD);
    if (!(data instanceof JsonObject)) {
      return Optional.empty();
    }

    String key = null;
    String value = null;
    String version = null;
    Map<String, String> metadata = new LinkedHashMap<>();
    for (Map.Entry<String, Object> field : (JsonObject) data) {
      switch (field.getKey().toLowerCase(Locale.ROOT)) {
        case "key":
          key = scalar("key", field.getValue());
          break;
        case "value":
          value = scalar("value", field.getValue());
          break;
        case "version":
          version = scalar("version", field.getValue());
          break;
        case "metadata":
          metadata = metadata(field.getValue());
          break;
        default:
          break;
      }
    }

    if (key == null) {
      throw new NotificationDecodeException("notification data has no key");
    }
    return Optional.of(UpdateEvent.of(subscriptionId, new ConfigurationItem(key, value, version, metadata)));
  }

  private static String scalar(String field, Object raw) {
    if (raw == null || raw instanceof String) {
      return (String) raw;
    }
    if (raw instanceof Number || raw instanceof Boolean) {
      return String.valueOf(raw);
    }
    throw new NotificationDecodeException("notification field '" + field + "' must be a string");
  }

  private static Map<String, String> metadata(Object raw) {
    Map<String, String> metadata = new LinkedHashMap<>();
    if (raw == null) {
      return metadata;
    }
    if (!(raw instanceof JsonObject)) {
      String kind = raw instanceof JsonArray ? "an array" : "a scalar";
      throw new NotificationDecodeException("notification metadata must be an object, got " + kind);
    }
    for (Map.Entry<String, Object> entry : (JsonObject) raw) {
      if (!(entry.getValue() instanceof String)) {
        throw new NotificationDecodeException("notification metadata '" + entry.getKey() + "' must be a string");
      }
      metadata.put(entry.getKey(), (String) entry.getValue());
    }
    return metadata;
  }
}
