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
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.henneberger.vertx.configuration.core.QueryException;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ConfigurationRowsTest {

  @Test
  void decodesStringMetadata() {
    assertEquals(Map.of("owner", "team-a", "tier", "gold"),
      ConfigurationRows.decodeMetadata("k", "{\"owner\":\"team-a\",\"tier\":\"gold\"}"));
  }

  @Test
  void missingMetadataIsEmpty() {
    assertTrue(ConfigurationRows.decodeMetadata("k", null).isEmpty());
    assertTrue(ConfigurationRows.decodeMetadata("k", "  ").isEmpty());
    assertTrue(ConfigurationRows.decodeMetadata("k", "null").isEmpty());
    assertTrue(ConfigurationRows.decodeMetadata("k", "{}").isEmpty());
  }

  @Test
  void rejectsMetadataThatIsNotAnObjectOfStrings() {
    assertThrows(QueryException.class, () -> ConfigurationRows.decodeMetadata("k", "[\"a\"]"));
    assertThrows(QueryException.class, () -> ConfigurationRows.decodeMetadata("k", "not json"));
    QueryException error = assertThrows(QueryException.class,
      () -> ConfigurationRows.decodeMetadata("k", "{\"replicas\":3}"));
    assertTrue(error.getMessage().contains("replicas"));
  }
}
