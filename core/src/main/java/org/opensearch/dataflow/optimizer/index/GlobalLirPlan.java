/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.optimizer.index;

import org.opensearch.dataflow.dataflow.DataflowDescription;
import org.opensearch.dataflow.dataflow.DataflowMetainfo;
import org.opensearch.dataflow.dataflow.stage.StagedPlan;
import org.opensearch.dataflow.optimizer.OnceGuard;
import org.opensearch.dataflow.optimizer.OptimizerOutput;
import org.opensearch.dataflow.optimizer.OptimizerTimer;
import org.opensearch.dataflow.optimizer.Transferable;

/** The index dataflow lowered to staged plans. */
public final class GlobalLirPlan implements Transferable {

  private final DataflowDescription<StagedPlan> dataflow;
  private final DataflowMetainfo metainfo;
  private final OptimizerTimer timer;
  private final OnceGuard guard = new OnceGuard("index plan");

  GlobalLirPlan(
      DataflowDescription<StagedPlan> dataflow, DataflowMetainfo metainfo, OptimizerTimer timer) {
    this.dataflow = dataflow;
    this.metainfo = metainfo;
    this.timer = timer;
  }

  /** Hands the finished dataflow to the caller. May be called once. */
  public OptimizerOutput<DataflowDescription<StagedPlan>> unapply() {
    guard.consume();
    return OptimizerOutput.of(dataflow, metainfo, timer, dataflow.exportIds());
  }
}
