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

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.util.List;
import java.util.Objects;

/**
 * A read query and the values bound to its placeholders, in order.
 */
public final class ConfigurationQuery {

  private final String sql;
  private final List<String> parameters;

  ConfigurationQuery(String sql, List<String> parameters) {
    this.sql = Objects.requireNonNull(sql, "sql");
    this.parameters = List.copyOf(parameters);
  }

  public String sql() {
    return sql;
  }

  public List<String> parameters() {
    return parameters;
  }

  /**
   * Binds every parameter untyped so the server resolves it against its column, which lets a filter
   * such as {@code version = '2'} match an integer or jsonb column.
   */
  void bind(PreparedStatement statement) throws SQLException {
    for (int i = 0; i < parameters.size(); i++) {
      statement.setObject(i + 1, parameters.get(i), Types.OTHER);
    }
  }

  @Override
  public String toString() {
    return sql + " " + parameters;
  }
}
