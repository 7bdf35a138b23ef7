/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.planner;

import java.util.List;
import lombok.extern.log4j.Log4j2;
import org.apache.calcite.plan.RelOptRule;
import org.apache.calcite.plan.hep.HepMatchOrder;
import org.apache.calcite.plan.hep.HepPlanner;
import org.apache.calcite.plan.hep.HepProgram;
import org.apache.calcite.plan.hep.HepProgramBuilder;
import org.apache.calcite.rel.RelNode;
import org.apache.calcite.rel.rules.CoreRules;
import org.opensearch.dataflow.expr.HirRelationExpr;
import org.opensearch.dataflow.expr.MirRelationExpr;

/**
 * Lowers with a Calcite heuristic planner: subqueries are rewritten into correlates. The new outer
 * join lowering additionally pushes filters into join conditions while lowering.
 */
@Log4j2
public class CalciteHirToMirLowering implements HirToMirLowering {

  private static final List<RelOptRule> SUBQUERY_RULES =
      List.of(
          CoreRules.FILTER_SUB_QUERY_TO_CORRELATE,
          CoreRules.PROJECT_SUB_QUERY_TO_CORRELATE,
          CoreRules.JOIN_SUB_QUERY_TO_CORRELATE);

  private static final List<RelOptRule> OUTER_JOIN_RULES =
      List.of(CoreRules.FILTER_INTO_JOIN, CoreRules.JOIN_CONDITION_PUSH);

  @Override
  public MirRelationExpr lower(HirRelationExpr expr, HirToMirConfig config) {
    // HepPlanner is stateful, build one per call.
    HepProgramBuilder builder = new HepProgramBuilder().addMatchOrder(HepMatchOrder.TOP_DOWN);
    builder.addRuleCollection(SUBQUERY_RULES);
    if (config.isEnableNewOuterJoinLowering()) {
      builder.addRuleCollection(OUTER_JOIN_RULES);
    }
    HepProgram program = builder.build();
    try {
      HepPlanner planner = new HepPlanner(program);
      planner.setRoot(expr.getRoot());
      RelNode lowered = planner.findBestExp();
      log.debug("Lowered expression with {} columns", lowered.getRowType().getFieldCount());
      return new MirRelationExpr(lowered);
    } catch (RuntimeException e) {
      throw new PlanException("failed to lower relational expression: " + e.getMessage(), e);
    }
  }
}
