/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.optimizer;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.opensearch.dataflow.common.setting.Settings;
import org.opensearch.dataflow.dataflow.LoweringFeatures;
import org.opensearch.dataflow.planner.HirToMirConfig;

/**
 * Snapshot of the feature flags a pipeline runs with. Taken once when the pipeline is assembled and
 * never refreshed, so every stage of one pipeline sees the same values.
 */
@Getter
@Builder(toBuilder = true)
@EqualsAndHashCode
@ToString
public final class OptimizerConfig {

  @Builder.Default private final OptimizeMode mode = OptimizeMode.EXECUTE;

  @Builder.Default private final boolean enableConsolidateAfterUnionNegate = true;

  private final boolean enableSpecializedArrangements;

  /** Exclusive upper bound on the number of rows a persist fast-path peek may return. */
  @Builder.Default private final int persistFastPathLimit = 25;

  private final boolean enableNewOuterJoinLowering;

  /** Reads every flag from the current system settings. */
  public static OptimizerConfig fromSettings(Settings settings) {
    return OptimizerConfig.builder()
        .mode(OptimizeMode.EXECUTE)
        .enableConsolidateAfterUnionNegate(
            settings.getSettingValue(Settings.Key.ENABLE_CONSOLIDATE_AFTER_UNION_NEGATE))
        .enableSpecializedArrangements(
            settings.getSettingValue(Settings.Key.ENABLE_SPECIALIZED_ARRANGEMENTS))
        .persistFastPathLimit(settings.getSettingValue(Settings.Key.PERSIST_FAST_PATH_LIMIT))
        .enableNewOuterJoinLowering(
            settings.getSettingValue(Settings.Key.ENABLE_NEW_OUTER_JOIN_LOWERING))
        .build();
  }

  /**
   * Configuration for an explain statement: the system settings in explain mode, with the
   * statement's overrides applied where present.
   */
  public static OptimizerConfig forExplain(Settings settings, ExplainConfig explainConfig) {
    OptimizerConfig base = fromSettings(settings);
    OptimizerConfigBuilder builder = base.toBuilder().mode(OptimizeMode.EXPLAIN);
    explainConfig
        .getEnableNewOuterJoinLowering()
        .ifPresent(builder::enableNewOuterJoinLowering);
    return builder.build();
  }

  public boolean isExplain() {
    return mode == OptimizeMode.EXPLAIN;
  }

  public HirToMirConfig toHirToMirConfig() {
    return new HirToMirConfig(enableNewOuterJoinLowering);
  }

  public LoweringFeatures toLoweringFeatures() {
    return new LoweringFeatures(enableConsolidateAfterUnionNegate, enableSpecializedArrangements);
  }
}
