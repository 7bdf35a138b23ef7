/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.planner;

import org.opensearch.dataflow.expr.HirRelationExpr;
import org.opensearch.dataflow.expr.MirRelationExpr;

/** Lowers raw relational expressions into mid-level expressions. */
public interface HirToMirLowering {

  /**
   * @param expr raw expression
   * @param config lowering options
   * @return the lowered expression
   * @throws PlanException if the expression cannot be lowered
   */
  MirRelationExpr lower(HirRelationExpr expr, HirToMirConfig config);
}
