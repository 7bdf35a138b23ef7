/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.optimizer;

import com.google.common.collect.ImmutableMap;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Accumulates elapsed time per stage over one pipeline run. Stages of a pipeline run one after
 * another; the synchronized methods only make the hand-off between threads visible.
 */
public final class OptimizerTimer {

  private final Map<String, Duration> stages = new LinkedHashMap<>();

  public synchronized void record(String stage, Duration elapsed) {
    stages.merge(stage, elapsed, Duration::plus);
  }

  public synchronized Duration total() {
    return stages.values().stream().reduce(Duration.ZERO, Duration::plus);
  }

  public synchronized ImmutableMap<String, Duration> stageDurations() {
    return ImmutableMap.copyOf(stages);
  }
}
