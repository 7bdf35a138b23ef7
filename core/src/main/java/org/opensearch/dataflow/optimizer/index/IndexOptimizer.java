/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.optimizer.index;

import java.util.List;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;
import org.opensearch.dataflow.catalog.CatalogEntry;
import org.opensearch.dataflow.catalog.CatalogItemType;
import org.opensearch.dataflow.catalog.ComputeInstanceSnapshot;
import org.opensearch.dataflow.common.utils.StringUtils;
import org.opensearch.dataflow.coord.DataflowBuilder;
import org.opensearch.dataflow.dataflow.DataflowDescription;
import org.opensearch.dataflow.dataflow.DataflowMetainfo;
import org.opensearch.dataflow.dataflow.stage.StagedPlan;
import org.opensearch.dataflow.exception.AdapterException;
import org.opensearch.dataflow.expr.OptimizedMirRelationExpr;
import org.opensearch.dataflow.optimizer.Optimize;
import org.opensearch.dataflow.optimizer.OptimizeStage;
import org.opensearch.dataflow.optimizer.OptimizerConfig;
import org.opensearch.dataflow.optimizer.OptimizerContext;
import org.opensearch.dataflow.optimizer.OptimizerException;
import org.opensearch.dataflow.optimizer.OptimizerTimer;
import org.opensearch.dataflow.repr.GlobalId;
import org.opensearch.dataflow.transform.TransformContext;

/**
 * Pipeline for {@code CREATE INDEX}.
 *
 * <pre>
 * IndexPlan --indexToGlobal--&gt; GlobalMirPlan --globalToLir--&gt; GlobalLirPlan
 * </pre>
 */
@Log4j2
public class IndexOptimizer {

  private final OptimizerContext context;
  private final DataflowBuilder dataflowBuilder;

  /** Id the index is exported under. */
  @Getter private final GlobalId exportId;

  @Getter private final OptimizerConfig config;
  private final OptimizerTimer timer = new OptimizerTimer();
  private final DataflowMetainfo metainfo = new DataflowMetainfo();

  public IndexOptimizer(
      OptimizerContext context,
      ComputeInstanceSnapshot computeInstance,
      GlobalId exportId,
      OptimizerConfig config) {
    this.context = context;
    this.dataflowBuilder = new DataflowBuilder(context, computeInstance);
    this.exportId = exportId;
    this.config = config;
  }

  public Optimize<IndexPlan, GlobalMirPlan> indexToGlobal() {
    return new IndexToGlobal();
  }

  public Optimize<GlobalMirPlan, GlobalLirPlan> globalToLir() {
    return new GlobalToLir();
  }

  private class IndexToGlobal extends OptimizeStage<IndexPlan, GlobalMirPlan> {

    IndexToGlobal() {
      super("index_to_global", timer);
    }

    @Override
    protected GlobalMirPlan doOptimize(IndexPlan plan) {
      CatalogEntry on = context.getCatalog().getEntry(plan.getOn());
      if (on.getItemType() == CatalogItemType.INDEX) {
        throw AdapterException.invalidObject(
            StringUtils.format("cannot create an index on index %s", on.getId()));
      }
      List<Integer> keys = plan.getKeys();
      for (Integer key : keys) {
        if (key < 0 || key >= on.arity()) {
          throw OptimizerException.internal(
              StringUtils.format(
                  "index key %d is out of range for %s with %d columns",
                  key,
                  on.getId(),
                  on.arity()));
        }
      }

      DataflowDescription<OptimizedMirRelationExpr> dataflow =
          new DataflowDescription<>(plan.getName());
      dataflowBuilder.importIntoDataflow(on.getId(), dataflow);
      dataflow.exportIndex(exportId, new DataflowDescription.IndexDesc(on.getId(), keys));
      dataflowBuilder.reoptimizeImportedViews(dataflow, config);

      DataflowDescription<OptimizedMirRelationExpr> optimized =
          context.getTransformer().optimizeDataflow(dataflow, new TransformContext(metainfo));
      log.debug("Built index dataflow {} exporting {}", plan.getName(), exportId);
      return new GlobalMirPlan(optimized);
    }
  }

  private class GlobalToLir extends OptimizeStage<GlobalMirPlan, GlobalLirPlan> {

    GlobalToLir() {
      super("global_to_lir", timer);
    }

    @Override
    protected GlobalLirPlan doOptimize(GlobalMirPlan plan) {
      DataflowDescription<StagedPlan> lowered =
          context.getPlanLowering().finalizeDataflow(plan.dataflow(), config.toLoweringFeatures());
      return new GlobalLirPlan(lowered, metainfo, timer);
    }
  }
}
