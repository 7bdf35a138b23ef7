/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.optimizer.peek;

import org.opensearch.dataflow.dataflow.DataflowDescription;
import org.opensearch.dataflow.expr.OptimizedMirRelationExpr;
import org.opensearch.dataflow.optimizer.Transferable;

/** The peek dataflow with its timestamp fixed. */
public final class ResolvedGlobalMirPlan implements Transferable {

  private final DataflowDescription<OptimizedMirRelationExpr> dataflow;

  ResolvedGlobalMirPlan(DataflowDescription<OptimizedMirRelationExpr> dataflow) {
    this.dataflow = dataflow;
  }

  DataflowDescription<OptimizedMirRelationExpr> dataflow() {
    return dataflow;
  }

  public DataflowDescription<OptimizedMirRelationExpr> getDataflow() {
    return dataflow.copy();
  }
}
