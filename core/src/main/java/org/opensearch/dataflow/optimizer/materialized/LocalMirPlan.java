/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.optimizer.materialized;

import org.opensearch.dataflow.expr.OptimizedMirRelationExpr;
import org.opensearch.dataflow.optimizer.Transferable;

/** The view's defining query, optimized on its own. */
public final class LocalMirPlan implements Transferable {

  private final OptimizedMirRelationExpr expr;

  LocalMirPlan(OptimizedMirRelationExpr expr) {
    this.expr = expr;
  }

  public OptimizedMirRelationExpr getExpr() {
    return expr;
  }
}
