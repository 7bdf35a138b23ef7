/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.dataflow;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.extern.log4j.Log4j2;
import org.apache.calcite.rel.RelNode;
import org.apache.calcite.rel.core.TableScan;
import org.apache.calcite.rel.type.RelDataType;
import org.apache.calcite.rel.type.RelDataTypeField;
import org.apache.calcite.sql.type.SqlTypeName;
import org.opensearch.dataflow.common.utils.StringUtils;
import org.opensearch.dataflow.dataflow.stage.ComputeStage;
import org.opensearch.dataflow.dataflow.stage.PartitioningScheme;
import org.opensearch.dataflow.dataflow.stage.StagedPlan;
import org.opensearch.dataflow.expr.OptimizedMirRelationExpr;
import org.opensearch.dataflow.expr.RelationExprs;
import org.opensearch.dataflow.repr.GlobalId;
import org.opensearch.dataflow.transform.TransformException;

/**
 * Splits each object of a dataflow at its catalog reads.
 *
 * <pre>
 * Stage "&lt;id&gt;-0" .. "&lt;id&gt;-(n-1)" (leaves): GATHER exchange, one per read collection
 * Stage "&lt;id&gt;-n" (root):  NONE exchange, evaluates the whole object over the leaves
 * </pre>
 *
 * <p>An object without reads (a constant) is a single root stage. Stage and plan ids are derived
 * from the object id, so lowering the same dataflow twice yields the same plans.
 */
@Log4j2
public class StagedPlanLowering implements PlanLowering {

  @Override
  public DataflowDescription<StagedPlan> finalizeDataflow(
      DataflowDescription<OptimizedMirRelationExpr> dataflow, LoweringFeatures features) {
    Set<GlobalId> available = new HashSet<>(dataflow.getSourceImports());
    dataflow.getIndexImports().values().forEach(index -> available.add(index.getOnId()));
    for (DataflowDescription.BuildDesc<OptimizedMirRelationExpr> build :
        dataflow.getObjectsToBuild()) {
      for (GlobalId dependency : build.getPlan().dependencies()) {
        if (!available.contains(dependency)) {
          throw new TransformException(
              StringUtils.format(
                  "object %s of dataflow %s reads %s, which is neither imported nor built"
                      + " before it",
                  build.getId(), dataflow.getDebugName(), dependency));
        }
      }
      available.add(build.getId());
    }

    DataflowDescription<StagedPlan> lowered =
        dataflow.mapBuilds((id, plan) -> fragment(id, plan.getRoot(), features));
    log.debug(
        "Lowered dataflow {} into {} staged plans",
        dataflow.getDebugName(),
        lowered.getObjectsToBuild().size());
    return lowered;
  }

  StagedPlan fragment(GlobalId id, RelNode root, LoweringFeatures features) {
    List<ComputeStage> stages = new ArrayList<>();
    List<String> leafIds = new ArrayList<>();
    for (TableScan scan : RelationExprs.scans(root)) {
      String stageId = id + "-" + stages.size();
      stages.add(
          new ComputeStage(
              stageId,
              PartitioningScheme.gather(),
              List.of(),
              scan,
              false,
              arrangementTypes(scan.getRowType(), features)));
      leafIds.add(stageId);
    }
    boolean consolidate =
        features.isEnableConsolidateAfterUnionNegate() && RelationExprs.containsMinus(root);
    stages.add(
        new ComputeStage(
            id + "-" + stages.size(),
            PartitioningScheme.none(),
            leafIds,
            root,
            consolidate,
            arrangementTypes(root.getRowType(), features)));

    StagedPlan plan = new StagedPlan(id.toString(), stages);
    List<String> errors = plan.validate();
    if (!errors.isEmpty()) {
      throw new TransformException(
          StringUtils.format("invalid staged plan for %s: %s", id, String.join("; ", errors)));
    }
    return plan;
  }

  private static List<SqlTypeName> arrangementTypes(
      RelDataType rowType, LoweringFeatures features) {
    if (!features.isEnableSpecializedArrangements()) {
      return ImmutableList.of();
    }
    return rowType.getFieldList().stream()
        .map(RelDataTypeField::getType)
        .map(RelDataType::getSqlTypeName)
        .collect(ImmutableList.toImmutableList());
  }
}
