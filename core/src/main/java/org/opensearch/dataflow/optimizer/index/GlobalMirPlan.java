/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.optimizer.index;

import org.opensearch.dataflow.dataflow.DataflowDescription;
import org.opensearch.dataflow.expr.OptimizedMirRelationExpr;
import org.opensearch.dataflow.optimizer.Transferable;

/** The index dataflow, assembled and optimized, still in MIR. */
public final class GlobalMirPlan implements Transferable {

  private final DataflowDescription<OptimizedMirRelationExpr> dataflow;

  GlobalMirPlan(DataflowDescription<OptimizedMirRelationExpr> dataflow) {
    this.dataflow = dataflow;
  }

  DataflowDescription<OptimizedMirRelationExpr> dataflow() {
    return dataflow;
  }

  /** Read-only view of the dataflow. */
  public DataflowDescription<OptimizedMirRelationExpr> getDataflow() {
    return dataflow.copy();
  }
}
