/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.optimizer.peek;

import com.google.common.collect.ImmutableSet;
import lombok.Getter;
import org.opensearch.dataflow.dataflow.DataflowMetainfo;
import org.opensearch.dataflow.expr.RowSetFinishing;
import org.opensearch.dataflow.optimizer.OnceGuard;
import org.opensearch.dataflow.optimizer.OptimizerOutput;
import org.opensearch.dataflow.optimizer.OptimizerTimer;
import org.opensearch.dataflow.optimizer.Transferable;
import org.opensearch.dataflow.repr.GlobalId;

/** The finished peek plan together with the finishing to apply to its result. */
public final class GlobalLirPlan implements Transferable {

  private final PeekPlan peekPlan;
  private final DataflowMetainfo metainfo;
  private final OptimizerTimer timer;
  private final ImmutableSet<GlobalId> exportIds;
  private final OnceGuard guard = new OnceGuard("peek plan");
  @Getter private final RowSetFinishing finishing;

  GlobalLirPlan(
      PeekPlan peekPlan,
      DataflowMetainfo metainfo,
      OptimizerTimer timer,
      ImmutableSet<GlobalId> exportIds,
      RowSetFinishing finishing) {
    this.peekPlan = peekPlan;
    this.metainfo = metainfo;
    this.timer = timer;
    this.exportIds = exportIds;
    this.finishing = finishing;
  }

  public boolean isFastPath() {
    return peekPlan.isFastPath();
  }

  public OptimizerOutput<PeekPlan> unapply() {
    guard.consume();
    return OptimizerOutput.of(peekPlan, metainfo, timer, exportIds);
  }
}
