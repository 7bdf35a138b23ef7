/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.optimizer.subscribe;

import lombok.Getter;
import org.opensearch.dataflow.dataflow.DataflowDescription;
import org.opensearch.dataflow.dataflow.DataflowMetainfo;
import org.opensearch.dataflow.dataflow.stage.StagedPlan;
import org.opensearch.dataflow.optimizer.OnceGuard;
import org.opensearch.dataflow.optimizer.OptimizerOutput;
import org.opensearch.dataflow.optimizer.OptimizerTimer;
import org.opensearch.dataflow.optimizer.Transferable;
import org.opensearch.dataflow.repr.GlobalId;

/** The subscription dataflow lowered to staged plans. */
public final class GlobalLirPlan implements Transferable {

  private final DataflowDescription<StagedPlan> dataflow;
  private final DataflowMetainfo metainfo;
  private final OptimizerTimer timer;
  private final OnceGuard guard = new OnceGuard("subscribe plan");
  @Getter private final GlobalId sinkId;

  GlobalLirPlan(
      DataflowDescription<StagedPlan> dataflow,
      DataflowMetainfo metainfo,
      OptimizerTimer timer,
      GlobalId sinkId) {
    this.dataflow = dataflow;
    this.metainfo = metainfo;
    this.timer = timer;
    this.sinkId = sinkId;
  }

  public DataflowDescription.SinkDesc getSinkDesc() {
    return dataflow.getSinkExports().get(sinkId);
  }

  public OptimizerOutput<DataflowDescription<StagedPlan>> unapply() {
    guard.consume();
    return OptimizerOutput.of(dataflow, metainfo, timer, dataflow.exportIds());
  }
}
