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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.henneberger.vertx.configuration.core.QueryException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ConfigurationQueryBuilderTest {

  @Test
  void selectsWholeTableWithoutFilters() {
    ConfigurationQuery query = ConfigurationQueryBuilder.build(List.of(), Map.of(), "cfg");

    assertEquals("SELECT * FROM \"cfg\"", query.sql());
    assertTrue(query.parameters().isEmpty());
  }

  @Test
  void bindsKeysAsInList() {
    ConfigurationQuery query = ConfigurationQueryBuilder.build(List.of("someKey1", "someKey2"), null, "cfg");

    assertEquals("SELECT * FROM \"cfg\" WHERE key IN (?, ?)", query.sql());
    assertEquals(List.of("someKey1", "someKey2"), query.parameters());
  }

  @Test
  void appendsMetadataFiltersInColumnOrder() {
    Map<String, String> metadata = new LinkedHashMap<>();
    metadata.put("version", "1.0");
    metadata.put("environment", "prod");

    ConfigurationQuery query = ConfigurationQueryBuilder.build(List.of("someKey"), metadata, "cfg");

    assertEquals("SELECT * FROM \"cfg\" WHERE key IN (?) AND environment = ? AND version = ?", query.sql());
    assertEquals(List.of("someKey", "prod", "1.0"), query.parameters());
  }

  @Test
  void metadataOnlyFiltersStartTheWhereClause() {
    ConfigurationQuery query = ConfigurationQueryBuilder.build(null, Map.of("version", "2"), "cfg");

    assertEquals("SELECT * FROM \"cfg\" WHERE version = ?", query.sql());
    assertEquals(List.of("2"), query.parameters());
  }

  @Test
  void isDeterministic() {
    Map<String, String> metadata = Map.of("b", "2", "a", "1", "c", "3");

    String first = ConfigurationQueryBuilder.build(List.of("k"), metadata, "cfg").sql();
    for (int i = 0; i < 10; i++) {
      assertEquals(first, ConfigurationQueryBuilder.build(List.of("k"), Map.copyOf(metadata), "cfg").sql());
    }
  }

  @Test
  void rejectsFilterFieldsThatAreNotColumns() {
    QueryException error = assertThrows(QueryException.class,
      () -> ConfigurationQueryBuilder.build(List.of(), Map.of("version; DROP TABLE cfg", "1"), "cfg"));

    assertTrue(error.getMessage().contains("invalid metadata filter field"));
    assertFalse(ConfigurationQueryBuilder.isIdentifier("1abc"));
    assertFalse(ConfigurationQueryBuilder.isIdentifier("a".repeat(65)));
    assertTrue(ConfigurationQueryBuilder.isIdentifier("_owner2"));
  }

  @Test
  void quotesTableNameSoCaseIsPreserved() throws Exception {
    ConfigurationQuery query = ConfigurationQueryBuilder.build(List.of("k"), Map.of(), "AppConfig");

    assertEquals("SELECT * FROM \"AppConfig\" WHERE key IN (?)", query.sql());
    assertEquals("\"AppConfig\"", ConfigurationQueryBuilder.quoteIdentifier("AppConfig"));
  }
}
