/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.optimizer.subscribe;

import org.opensearch.dataflow.common.utils.StringUtils;
import org.opensearch.dataflow.dataflow.DataflowDescription;
import org.opensearch.dataflow.expr.OptimizedMirRelationExpr;
import org.opensearch.dataflow.optimizer.OnceGuard;
import org.opensearch.dataflow.optimizer.OptimizerException;
import org.opensearch.dataflow.optimizer.Transferable;
import org.opensearch.dataflow.repr.GlobalId;

/**
 * The subscription dataflow, assembled and optimized but not yet bound to a time. The only way
 * forward is {@link #resolve}.
 */
public final class GlobalMirPlan implements Transferable {

  private final DataflowDescription<OptimizedMirRelationExpr> dataflow;
  private final GlobalId sinkId;
  private final OnceGuard guard = new OnceGuard("unresolved subscribe plan");

  GlobalMirPlan(DataflowDescription<OptimizedMirRelationExpr> dataflow, GlobalId sinkId) {
    this.dataflow = dataflow;
    this.sinkId = sinkId;
  }

  public DataflowDescription<OptimizedMirRelationExpr> getDataflow() {
    return dataflow.copy();
  }

  /**
   * Binds the subscription to the timestamps chosen by the caller. Consumes this plan.
   *
   * @param asOf first time the subscription reports
   * @param upTo exclusive time at which the subscription ends, or null to run indefinitely
   * @return the resolved plan
   * @throws OptimizerException if {@code upTo} is before {@code asOf}
   * @throws IllegalStateException if this plan was already resolved
   */
  public ResolvedGlobalMirPlan resolve(long asOf, Long upTo) {
    guard.consume();
    if (upTo != null && upTo < asOf) {
      throw OptimizerException.internal(
          StringUtils.format("subscribe up to %d is before as of %d", upTo, asOf));
    }
    DataflowDescription<OptimizedMirRelationExpr> resolved = dataflow.copy();
    resolved.setAsOf(asOf);
    if (upTo != null) {
      resolved.setUntil(upTo);
      resolved.exportSink(sinkId, resolved.getSinkExports().get(sinkId).withUpTo(upTo));
    }
    return new ResolvedGlobalMirPlan(resolved, sinkId);
  }
}
