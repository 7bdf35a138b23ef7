/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.optimizer.peek;

import org.opensearch.dataflow.dataflow.DataflowDescription;
import org.opensearch.dataflow.expr.OptimizedMirRelationExpr;
import org.opensearch.dataflow.optimizer.OnceGuard;
import org.opensearch.dataflow.optimizer.OptimizerException;
import org.opensearch.dataflow.optimizer.Transferable;

/**
 * The peek dataflow, assembled and optimized but not yet bound to a time. The only way forward is
 * {@link #resolve}.
 */
public final class GlobalMirPlan implements Transferable {

  private final DataflowDescription<OptimizedMirRelationExpr> dataflow;
  private final OnceGuard guard = new OnceGuard("unresolved peek plan");

  GlobalMirPlan(DataflowDescription<OptimizedMirRelationExpr> dataflow) {
    this.dataflow = dataflow;
  }

  public DataflowDescription<OptimizedMirRelationExpr> getDataflow() {
    return dataflow.copy();
  }

  /**
   * Binds the peek to a timestamp. Reading at {@code ts} means {@code asOf = ts} and {@code until =
   * ts + 1}; at the maximum timestamp there is no later time, so {@code until} stays unset.
   *
   * @throws OptimizerException if the plan reads collections but no timestamp was chosen
   * @throws IllegalStateException if this plan was already resolved
   */
  public ResolvedGlobalMirPlan resolve(TimestampContext timestampContext) {
    guard.consume();
    DataflowDescription<OptimizedMirRelationExpr> resolved = dataflow.copy();
    if (timestampContext.getTimestamp().isPresent()) {
      long ts = timestampContext.getTimestamp().get();
      resolved.setAsOf(ts);
      if (ts != Long.MAX_VALUE) {
        resolved.setUntil(ts + 1);
      }
    } else if (!resolved.getSourceImports().isEmpty() || !resolved.getIndexImports().isEmpty()) {
      throw OptimizerException.internal("peek reads collections but has no timestamp");
    }
    return new ResolvedGlobalMirPlan(resolved);
  }
}
