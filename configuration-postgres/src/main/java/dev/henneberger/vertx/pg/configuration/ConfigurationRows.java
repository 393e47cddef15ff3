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
import dev.henneberger.vertx.configuration.core.QueryException;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

final class ConfigurationRows {

  private ConfigurationRows() {
  }

  static ConfigurationItem read(ResultSet rs) throws SQLException {
    String key = rs.getString("key");
    if (key == null) {
      throw new QueryException("configuration row has a NULL key");
    }
    String value = rs.getString("value");
    String version = rs.getString("version");
    Map<String, String> metadata = decodeMetadata(key, rs.getString("metadata"));
    return new ConfigurationItem(key, value, version, metadata);
  }

  /**
   * Decodes the JSON metadata column. NULL or blank columns mean no metadata; anything other than an
   * object of string values is rejected.
   */
  static Map<String, String> decodeMetadata(String key, String json) {
    if (json == null || json.isBlank() || "null".equals(json.trim())) {
      return Collections.emptyMap();
    }

    JsonObject object;
    try {
      object = new JsonObject(json);
    } catch (DecodeException | ClassCastException e) {
      throw new QueryException("metadata of configuration item '" + key + "' is not a JSON object", e);
    }

    Map<String, String> metadata = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : object) {
      Object raw = entry.getValue();
      if (!(raw instanceof String)) {
        throw new QueryException("metadata field '" + entry.getKey() + "' of configuration item '" + key
          + "' is not a string");
      }
      metadata.put(entry.getKey(), (String) raw);
    }
    return metadata;
  }
}
