/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.transform;

import org.opensearch.dataflow.dataflow.DataflowDescription;
import org.opensearch.dataflow.expr.MirRelationExpr;
import org.opensearch.dataflow.expr.OptimizedMirRelationExpr;

/** Rewrites mid-level expressions. */
public interface Transformer {

  /**
   * Optimizes a single expression without knowledge of the dataflow it ends up in.
   *
   * @throws TransformException if a rewrite fails
   */
  OptimizedMirRelationExpr optimizeView(MirRelationExpr expr, TransformContext context);

  /**
   * Optimizes every object of a dataflow in the context of its imports.
   *
   * @throws TransformException if a rewrite fails
   */
  DataflowDescription<OptimizedMirRelationExpr> optimizeDataflow(
      DataflowDescription<OptimizedMirRelationExpr> dataflow, TransformContext context);
}
