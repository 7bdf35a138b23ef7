/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.dataflow;

import org.opensearch.dataflow.dataflow.stage.StagedPlan;
import org.opensearch.dataflow.expr.OptimizedMirRelationExpr;
import org.opensearch.dataflow.transform.TransformException;

/** Lowers an optimized MIR dataflow into its physical form. */
public interface PlanLowering {

  /**
   * Lowers every object of the dataflow. Imports, exports and timestamps carry over unchanged.
   *
   * @param dataflow optimized MIR dataflow
   * @param features lowering options
   * @return the lowered dataflow
   * @throws TransformException if the dataflow cannot be lowered
   */
  DataflowDescription<StagedPlan> finalizeDataflow(
      DataflowDescription<OptimizedMirRelationExpr> dataflow, LoweringFeatures features);
}
