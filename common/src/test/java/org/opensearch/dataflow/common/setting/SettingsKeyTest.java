/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.common.setting;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class SettingsKeyTest {

  @Test
  void should_resolve_key_by_key_value() {
    assertEquals(
        Optional.of(Settings.Key.PERSIST_FAST_PATH_LIMIT),
        Settings.Key.of("optimizer.persist_fast_path_limit"));
  }

  @Test
  void should_return_empty_for_unknown_key_value() {
    assertTrue(Settings.Key.of("optimizer.unknown").isEmpty());
  }

  @Test
  void every_key_round_trips_through_its_key_value() {
    for (Settings.Key key : Settings.Key.values()) {
      assertEquals(Optional.of(key), Settings.Key.of(key.getKeyValue()));
    }
  }
}
