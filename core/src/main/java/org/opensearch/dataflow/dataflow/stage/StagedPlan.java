/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.dataflow.stage;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.opensearch.dataflow.optimizer.Transferable;

/**
 * The lowered form of one object: a list of {@link ComputeStage}s in dependency order, leaves
 * first and the root last.
 */
public class StagedPlan implements Transferable {

  private final String planId;
  private final List<ComputeStage> stages;

  public StagedPlan(String planId, List<ComputeStage> stages) {
    this.planId = planId;
    this.stages = ImmutableList.copyOf(stages);
  }

  public String getPlanId() {
    return planId;
  }

  /** Returns all stages in dependency order (leaves first, root last). */
  public List<ComputeStage> getStages() {
    return stages;
  }

  /** Returns the root stage, which produces the object's contents. */
  public ComputeStage getRootStage() {
    if (stages.isEmpty()) {
      throw new IllegalStateException("StagedPlan has no stages");
    }
    return stages.get(stages.size() - 1);
  }

  public List<ComputeStage> getLeafStages() {
    return stages.stream().filter(ComputeStage::isLeaf).collect(Collectors.toList());
  }

  public ComputeStage getStage(String stageId) {
    return stages.stream()
        .filter(s -> s.getStageId().equals(stageId))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Stage not found: " + stageId));
  }

  public int getStageCount() {
    return stages.size();
  }

  /**
   * Validates the plan. Stages may only consume stages that appear before them.
   *
   * @return list of error messages, empty if the plan is valid
   */
  public List<String> validate() {
    List<String> errors = new ArrayList<>();
    if (planId == null || planId.isEmpty()) {
      errors.add("Plan ID is required");
    }
    if (stages.isEmpty()) {
      errors.add("Plan must have at least one stage");
    }

    Set<String> seen = new HashSet<>();
    for (ComputeStage stage : stages) {
      for (String depId : stage.getSourceStageIds()) {
        if (!seen.contains(depId)) {
          errors.add("Stage '" + stage.getStageId() + "' references unknown stage: " + depId);
        }
      }
      if (!seen.add(stage.getStageId())) {
        errors.add("Duplicate stage id: " + stage.getStageId());
      }
    }
    return errors;
  }

  @Override
  public String toString() {
    return "StagedPlan{id='" + planId + "', stages=" + stages.size() + '}';
  }
}
