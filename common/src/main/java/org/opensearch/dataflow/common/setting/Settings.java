/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.common.setting;

import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * System configuration consumed by the optimizer. Values are read once when an optimizer
 * configuration snapshot is taken and are never re-read while a pipeline runs.
 */
public abstract class Settings {

  @RequiredArgsConstructor
  public enum Key {

    /** Consolidate unions that immediately follow a negation (LIR refinement). */
    ENABLE_CONSOLIDATE_AFTER_UNION_NEGATE("optimizer.enable_consolidate_after_union_negate"),

    /** Collect type information during MIR to LIR lowering for specialized arrangements. */
    ENABLE_SPECIALIZED_ARRANGEMENTS("optimizer.enable_specialized_arrangements"),

    /** Exclusive upper bound on the result count of a persist fast-path peek. */
    PERSIST_FAST_PATH_LIMIT("optimizer.persist_fast_path_limit"),

    /** Use the new outer join lowering during HIR to MIR lowering. */
    ENABLE_NEW_OUTER_JOIN_LOWERING("optimizer.enable_new_outer_join_lowering");

    @Getter
    private final String keyValue;

    private static final Map<String, Key> ALL_KEYS;

    static {
      ImmutableMap.Builder<String, Key> builder = new ImmutableMap.Builder<>();
      for (Key key : Key.values()) {
        builder.put(key.getKeyValue(), key);
      }
      ALL_KEYS = builder.build();
    }

    public static Optional<Key> of(String keyValue) {
      return Optional.ofNullable(ALL_KEYS.getOrDefault(keyValue, null));
    }
  }

  /**
   * Get Setting Value.
   */
  public abstract <T> T getSettingValue(Key key);

  public abstract List<?> getSettings();
}
