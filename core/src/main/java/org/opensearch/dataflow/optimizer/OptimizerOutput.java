/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.optimizer;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.time.Duration;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import org.opensearch.dataflow.dataflow.DataflowMetainfo;
import org.opensearch.dataflow.repr.GlobalId;

/**
 * Everything a finished pipeline hands back to its caller.
 *
 * @param <T> the physical plan
 */
@Getter
@ToString
@RequiredArgsConstructor
public final class OptimizerOutput<T> {

  private final T plan;
  private final DataflowMetainfo metainfo;

  /** Sum of the time spent in every stage of the pipeline. */
  private final Duration duration;

  private final ImmutableMap<String, Duration> stageDurations;

  /** Ids of the indexes and sinks the plan exports. */
  private final ImmutableSet<GlobalId> exportIds;

  public static <T> OptimizerOutput<T> of(
      T plan, DataflowMetainfo metainfo, OptimizerTimer timer, ImmutableSet<GlobalId> exportIds) {
    return new OptimizerOutput<>(
        plan, metainfo.copy(), timer.total(), timer.stageDurations(), exportIds);
  }
}
