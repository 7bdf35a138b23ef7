/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.optimizer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.opensearch.dataflow.common.setting.Settings;
import org.opensearch.dataflow.config.SystemSettings;
import org.opensearch.dataflow.dataflow.LoweringFeatures;
import org.opensearch.dataflow.planner.HirToMirConfig;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class OptimizerConfigTest {

  private final SystemSettings settings = new SystemSettings();

  @Test
  void should_read_every_flag_from_settings() {
    settings.update(Settings.Key.ENABLE_SPECIALIZED_ARRANGEMENTS, true);
    settings.update(Settings.Key.PERSIST_FAST_PATH_LIMIT, 7);

    OptimizerConfig config = OptimizerConfig.fromSettings(settings);

    assertEquals(OptimizeMode.EXECUTE, config.getMode());
    assertTrue(config.isEnableConsolidateAfterUnionNegate());
    assertTrue(config.isEnableSpecializedArrangements());
    assertEquals(7, config.getPersistFastPathLimit());
    assertFalse(config.isEnableNewOuterJoinLowering());
  }

  @Test
  void explain_without_overrides_only_changes_mode() {
    OptimizerConfig base = OptimizerConfig.fromSettings(settings);

    OptimizerConfig explain = OptimizerConfig.forExplain(settings, ExplainConfig.defaults());

    assertEquals(base.toBuilder().mode(OptimizeMode.EXPLAIN).build(), explain);
  }

  @Test
  void explain_override_replaces_base_value() {
    ExplainConfig explainConfig = ExplainConfig.builder().enableNewOuterJoinLowering(true).build();

    OptimizerConfig explain = OptimizerConfig.forExplain(settings, explainConfig);

    assertEquals(OptimizeMode.EXPLAIN, explain.getMode());
    assertTrue(explain.isEnableNewOuterJoinLowering());
    assertTrue(explain.isEnableConsolidateAfterUnionNegate());
    assertFalse(explain.isEnableSpecializedArrangements());
    assertEquals(25, explain.getPersistFastPathLimit());
  }

  @Test
  void explain_override_can_disable_a_flag() {
    settings.update(Settings.Key.ENABLE_NEW_OUTER_JOIN_LOWERING, true);
    ExplainConfig explainConfig = ExplainConfig.builder().enableNewOuterJoinLowering(false).build();

    assertFalse(OptimizerConfig.forExplain(settings, explainConfig).isEnableNewOuterJoinLowering());
  }

  @Test
  void config_snapshot_ignores_later_setting_changes() {
    OptimizerConfig config = OptimizerConfig.fromSettings(settings);

    settings.update(Settings.Key.ENABLE_NEW_OUTER_JOIN_LOWERING, true);

    assertFalse(config.isEnableNewOuterJoinLowering());
  }

  @Test
  void should_project_collaborator_options() {
    OptimizerConfig config =
        OptimizerConfig.builder()
            .enableConsolidateAfterUnionNegate(false)
            .enableSpecializedArrangements(true)
            .enableNewOuterJoinLowering(true)
            .build();

    assertEquals(new HirToMirConfig(true), config.toHirToMirConfig());
    assertEquals(new LoweringFeatures(false, true), config.toLoweringFeatures());
  }
}
