/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.dataflow.stage;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Getter;
import org.apache.calcite.rel.RelNode;
import org.apache.calcite.sql.type.SqlTypeName;

/**
 * One unit of a lowered plan. A leaf stage reads a single imported collection; the root stage of an
 * object evaluates the whole fragment over the outputs of its leaves.
 */
@Getter
public class ComputeStage {

  private final String stageId;

  /** How this stage's output reaches its consumer. */
  private final PartitioningScheme outputPartitioning;

  /** Upstream stages feeding this one. Empty for leaves. */
  private final List<String> sourceStageIds;

  /** Sub-plan this stage evaluates. */
  private final RelNode planFragment;

  /** Whether the output must be consolidated before it is exposed. */
  private final boolean consolidateOutput;

  /**
   * Column types of the stage output, used to specialize its arrangement. Empty when
   * specialization is disabled.
   */
  private final List<SqlTypeName> arrangementTypes;

  public ComputeStage(
      String stageId,
      PartitioningScheme outputPartitioning,
      List<String> sourceStageIds,
      RelNode planFragment,
      boolean consolidateOutput,
      List<SqlTypeName> arrangementTypes) {
    this.stageId = stageId;
    this.outputPartitioning = outputPartitioning;
    this.sourceStageIds = ImmutableList.copyOf(sourceStageIds);
    this.planFragment = planFragment;
    this.consolidateOutput = consolidateOutput;
    this.arrangementTypes = ImmutableList.copyOf(arrangementTypes);
  }

  public boolean isLeaf() {
    return sourceStageIds.isEmpty();
  }

  @Override
  public String toString() {
    return "ComputeStage{"
        + "id='"
        + stageId
        + "', exchange="
        + outputPartitioning.getExchangeType()
        + ", deps="
        + sourceStageIds
        + ", consolidate="
        + consolidateOutput
        + '}';
  }
}
