/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.optimizer.peek;

import java.util.Optional;
import lombok.ToString;
import org.opensearch.dataflow.dataflow.DataflowDescription;
import org.opensearch.dataflow.dataflow.stage.StagedPlan;
import org.opensearch.dataflow.optimizer.Transferable;

/** How a peek will be answered: by a fast path, or by a dataflow installed for the peek. */
@ToString
public final class PeekPlan implements Transferable {

  private final FastPathPlan fastPath;
  private final DataflowDescription<StagedPlan> dataflow;

  private PeekPlan(FastPathPlan fastPath, DataflowDescription<StagedPlan> dataflow) {
    this.fastPath = fastPath;
    this.dataflow = dataflow;
  }

  static PeekPlan fastPath(FastPathPlan fastPath) {
    return new PeekPlan(fastPath, null);
  }

  static PeekPlan slowPath(DataflowDescription<StagedPlan> dataflow) {
    return new PeekPlan(null, dataflow);
  }

  public boolean isFastPath() {
    return fastPath != null;
  }

  public Optional<FastPathPlan> getFastPath() {
    return Optional.ofNullable(fastPath);
  }

  public Optional<DataflowDescription<StagedPlan>> getDataflow() {
    return Optional.ofNullable(dataflow);
  }
}
