/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.expr;

import org.apache.calcite.rel.RelNode;

/**
 * A mid-level expression that has been through logical optimization. Only the code that ran the
 * optimization may vouch for that, so the single way in is {@link #declareOptimized}.
 */
public final class OptimizedMirRelationExpr extends RelationExpr {

  private OptimizedMirRelationExpr(RelNode root) {
    super(root);
  }

  public static OptimizedMirRelationExpr declareOptimized(MirRelationExpr expr) {
    return new OptimizedMirRelationExpr(expr.getRoot());
  }

  /** Unwraps into a plain MIR expression for further rewriting. */
  public MirRelationExpr asMir() {
    return new MirRelationExpr(getRoot());
  }
}
