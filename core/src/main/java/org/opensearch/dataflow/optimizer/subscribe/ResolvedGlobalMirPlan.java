/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.optimizer.subscribe;

import org.opensearch.dataflow.dataflow.DataflowDescription;
import org.opensearch.dataflow.expr.OptimizedMirRelationExpr;
import org.opensearch.dataflow.optimizer.Transferable;
import org.opensearch.dataflow.repr.GlobalId;

/** The subscription dataflow with its timestamps fixed. */
public final class ResolvedGlobalMirPlan implements Transferable {

  private final DataflowDescription<OptimizedMirRelationExpr> dataflow;
  private final GlobalId sinkId;

  ResolvedGlobalMirPlan(DataflowDescription<OptimizedMirRelationExpr> dataflow, GlobalId sinkId) {
    this.dataflow = dataflow;
    this.sinkId = sinkId;
  }

  DataflowDescription<OptimizedMirRelationExpr> dataflow() {
    return dataflow;
  }

  GlobalId sinkId() {
    return sinkId;
  }

  public DataflowDescription<OptimizedMirRelationExpr> getDataflow() {
    return dataflow.copy();
  }
}
