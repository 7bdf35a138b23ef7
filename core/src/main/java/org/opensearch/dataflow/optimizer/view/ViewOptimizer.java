/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.optimizer.view;

import lombok.Getter;
import org.opensearch.dataflow.dataflow.DataflowMetainfo;
import org.opensearch.dataflow.expr.HirRelationExpr;
import org.opensearch.dataflow.expr.MirRelationExpr;
import org.opensearch.dataflow.expr.OptimizedMirRelationExpr;
import org.opensearch.dataflow.optimizer.OptimizeStage;
import org.opensearch.dataflow.optimizer.OptimizerConfig;
import org.opensearch.dataflow.optimizer.OptimizerContext;
import org.opensearch.dataflow.optimizer.OptimizerTimer;
import org.opensearch.dataflow.transform.TransformContext;

/**
 * Optimizes the defining query of a view: lowers it, then runs logical optimization. The result
 * does not depend on the dataflow the view is later imported into.
 */
public class ViewOptimizer extends OptimizeStage<HirRelationExpr, OptimizedMirRelationExpr> {

  private final OptimizerContext context;
  @Getter private final OptimizerConfig config;
  @Getter private final DataflowMetainfo metainfo = new DataflowMetainfo();

  public ViewOptimizer(OptimizerContext context, OptimizerConfig config) {
    this(context, config, new OptimizerTimer());
  }

  public ViewOptimizer(OptimizerContext context, OptimizerConfig config, OptimizerTimer timer) {
    super("optimize_view", timer);
    this.context = context;
    this.config = config;
  }

  @Override
  protected OptimizedMirRelationExpr doOptimize(HirRelationExpr expr) {
    MirRelationExpr lowered = context.getLowering().lower(expr, config.toHirToMirConfig());
    return context.getTransformer().optimizeView(lowered, new TransformContext(metainfo));
  }
}
