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

import dev.henneberger.vertx.configuration.core.QueryException;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.TreeMap;
import java.util.regex.Pattern;
import org.postgresql.core.Utils;

/**
 * Assembles the point-lookup query. Keys become an {@code IN} list and metadata entries become
 * {@code column = ?} clauses, ANDed in lexicographic column order. All values are bound as parameters;
 * metadata field names are column identifiers and must be plain names. The table name is always quoted,
 * so it is matched case-sensitively, the same way {@code LISTEN} and {@code pg_notify} treat it.
 */
public final class ConfigurationQueryBuilder {

  private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  private ConfigurationQueryBuilder() {
  }

  public static ConfigurationQuery build(List<String> keys, Map<String, String> metadata, String table) {
    Objects.requireNonNull(table, "table");
    List<String> parameters = new ArrayList<>();
    StringBuilder sql = new StringBuilder("SELECT * FROM ");
    try {
      Utils.escapeIdentifier(sql, table);
    } catch (SQLException e) {
      throw new QueryException("invalid table name '" + table + "'", e);
    }

    boolean hasWhere = false;
    if (keys != null && !keys.isEmpty()) {
      StringJoiner placeholders = new StringJoiner(", ", " WHERE key IN (", ")");
      for (String key : keys) {
        placeholders.add("?");
        parameters.add(Objects.requireNonNull(key, "key"));
      }
      sql.append(placeholders);
      hasWhere = true;
    }

    if (metadata != null && !metadata.isEmpty()) {
      for (Map.Entry<String, String> filter : new TreeMap<>(metadata).entrySet()) {
        String column = filter.getKey();
        if (!isIdentifier(column)) {
          throw new QueryException("invalid metadata filter field '" + column + "'");
        }
        sql.append(hasWhere ? " AND " : " WHERE ").append(column).append(" = ?");
        parameters.add(Objects.requireNonNull(filter.getValue(), "metadata value"));
        hasWhere = true;
      }
    }

    return new ConfigurationQuery(sql.toString(), parameters);
  }

  static boolean isIdentifier(String value) {
    return value != null
      && value.length() <= PostgresConfigurationOptions.MAX_IDENTIFIER_LENGTH
      && IDENTIFIER.matcher(value).matches();
  }

  /**
   * Double-quotes an identifier for statements that cannot take it as a parameter, such as {@code LISTEN}.
   */
  static String quoteIdentifier(String identifier) throws SQLException {
    return Utils.escapeIdentifier(null, identifier).toString();
  }
}
