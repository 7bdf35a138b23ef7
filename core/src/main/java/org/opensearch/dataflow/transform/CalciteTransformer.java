/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.transform;

import java.util.List;
import java.util.Map;
import lombok.extern.log4j.Log4j2;
import org.apache.calcite.plan.RelOptRule;
import org.apache.calcite.plan.hep.HepPlanner;
import org.apache.calcite.plan.hep.HepProgramBuilder;
import org.apache.calcite.rel.RelNode;
import org.apache.calcite.rel.rules.CoreRules;
import org.opensearch.dataflow.common.utils.StringUtils;
import org.opensearch.dataflow.dataflow.DataflowDescription;
import org.opensearch.dataflow.dataflow.IndexUsageType;
import org.opensearch.dataflow.expr.MirRelationExpr;
import org.opensearch.dataflow.expr.OptimizedMirRelationExpr;
import org.opensearch.dataflow.repr.GlobalId;

/** Rewrites expressions with fixed Calcite rule lists run by a heuristic planner. */
@Log4j2
public class CalciteTransformer implements Transformer {

  private static final List<RelOptRule> LOGICAL_RULES =
      List.of(
          CoreRules.FILTER_MERGE,
          CoreRules.FILTER_PROJECT_TRANSPOSE,
          CoreRules.PROJECT_MERGE,
          CoreRules.PROJECT_REMOVE,
          CoreRules.UNION_MERGE);

  private static final List<RelOptRule> DATAFLOW_RULES =
      List.of(
          CoreRules.FILTER_INTO_JOIN,
          CoreRules.JOIN_CONDITION_PUSH,
          CoreRules.FILTER_MERGE,
          CoreRules.PROJECT_MERGE);

  @Override
  public OptimizedMirRelationExpr optimizeView(MirRelationExpr expr, TransformContext context) {
    RelNode optimized = run(LOGICAL_RULES, expr.getRoot());
    return OptimizedMirRelationExpr.declareOptimized(new MirRelationExpr(optimized));
  }

  @Override
  public DataflowDescription<OptimizedMirRelationExpr> optimizeDataflow(
      DataflowDescription<OptimizedMirRelationExpr> dataflow, TransformContext context) {
    DataflowDescription<OptimizedMirRelationExpr> optimized =
        dataflow.mapPlans(
            plan ->
                OptimizedMirRelationExpr.declareOptimized(
                    new MirRelationExpr(run(DATAFLOW_RULES, plan.getRoot()))));

    for (Map.Entry<GlobalId, DataflowDescription.IndexImport> index :
        optimized.getIndexImports().entrySet()) {
      GlobalId onId = index.getValue().getOnId();
      boolean used =
          optimized.getObjectsToBuild().stream()
              .anyMatch(build -> build.getPlan().dependencies().contains(onId));
      if (used) {
        context.getMetainfo().recordIndexUsage(index.getKey(), IndexUsageType.FULL_SCAN);
      } else {
        String notice =
            StringUtils.format("index %s on %s is imported but not used", index.getKey(), onId);
        context.getMetainfo().addNotice(notice);
      }
    }
    log.debug("Optimized dataflow {}", dataflow.getDebugName());
    return optimized;
  }

  private static RelNode run(List<RelOptRule> rules, RelNode root) {
    try {
      HepPlanner planner = new HepPlanner(new HepProgramBuilder().addRuleCollection(rules).build());
      planner.setRoot(root);
      return planner.findBestExp();
    } catch (RuntimeException e) {
      throw new TransformException(
          "failed to optimize relational expression: " + e.getMessage(), e);
    }
  }
}
