/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.optimizer.subscribe;

import java.util.List;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;
import org.opensearch.dataflow.catalog.ComputeInstanceSnapshot;
import org.opensearch.dataflow.coord.DataflowBuilder;
import org.opensearch.dataflow.dataflow.DataflowDescription;
import org.opensearch.dataflow.dataflow.DataflowMetainfo;
import org.opensearch.dataflow.dataflow.stage.StagedPlan;
import org.opensearch.dataflow.expr.OptimizedMirRelationExpr;
import org.opensearch.dataflow.optimizer.Optimize;
import org.opensearch.dataflow.optimizer.OptimizeStage;
import org.opensearch.dataflow.optimizer.OptimizerConfig;
import org.opensearch.dataflow.optimizer.OptimizerContext;
import org.opensearch.dataflow.optimizer.OptimizerTimer;
import org.opensearch.dataflow.repr.GlobalId;
import org.opensearch.dataflow.transform.TransformContext;

/**
 * Pipeline for {@code SUBSCRIBE}.
 *
 * <pre>
 * SubscribeFrom         --subscribeToGlobal--&gt; GlobalMirPlan
 * GlobalMirPlan         --resolve(asOf, upTo)-&gt; ResolvedGlobalMirPlan
 * ResolvedGlobalMirPlan --resolvedToLir------&gt; GlobalLirPlan
 * </pre>
 */
@Log4j2
public class SubscribeOptimizer {

  private final OptimizerContext context;
  private final DataflowBuilder dataflowBuilder;

  /** Id an ad hoc query is built under. Unused when subscribing to a catalog object. */
  @Getter private final GlobalId viewId;

  @Getter private final GlobalId sinkId;
  private final boolean withSnapshot;
  private final String debugName;
  @Getter private final OptimizerConfig config;
  private final OptimizerTimer timer = new OptimizerTimer();
  private final DataflowMetainfo metainfo = new DataflowMetainfo();

  public SubscribeOptimizer(
      OptimizerContext context,
      ComputeInstanceSnapshot computeInstance,
      GlobalId viewId,
      GlobalId sinkId,
      boolean withSnapshot,
      String debugName,
      OptimizerConfig config) {
    this.context = context;
    this.dataflowBuilder = new DataflowBuilder(context, computeInstance);
    this.viewId = viewId;
    this.sinkId = sinkId;
    this.withSnapshot = withSnapshot;
    this.debugName = debugName;
    this.config = config;
  }

  public Optimize<SubscribeFrom, GlobalMirPlan> subscribeToGlobal() {
    return new SubscribeToGlobal();
  }

  public Optimize<ResolvedGlobalMirPlan, GlobalLirPlan> resolvedToLir() {
    return new ResolvedToLir();
  }

  private class SubscribeToGlobal extends OptimizeStage<SubscribeFrom, GlobalMirPlan> {

    SubscribeToGlobal() {
      super("subscribe_to_global", timer);
    }

    @Override
    protected GlobalMirPlan doOptimize(SubscribeFrom from) {
      DataflowDescription<OptimizedMirRelationExpr> dataflow =
          new DataflowDescription<>(debugName);
      GlobalId fromId;
      if (from.getId().isPresent()) {
        fromId = from.getId().get();
        dataflowBuilder.importIntoDataflow(fromId, dataflow);
      } else {
        OptimizedMirRelationExpr query =
            context
                .getTransformer()
                .optimizeView(from.getQuery().get(), new TransformContext(metainfo));
        fromId = viewId;
        dataflowBuilder.importViewIntoDataflow(fromId, query, dataflow);
      }
      dataflow.exportSink(
          sinkId,
          new DataflowDescription.SinkDesc(
              fromId,
              DataflowDescription.SinkConnection.SUBSCRIBE,
              withSnapshot,
              null,
              List.of()));
      dataflowBuilder.reoptimizeImportedViews(dataflow, config);

      DataflowDescription<OptimizedMirRelationExpr> optimized =
          context.getTransformer().optimizeDataflow(dataflow, new TransformContext(metainfo));
      log.debug("Built subscribe dataflow {} reading {}", debugName, fromId);
      return new GlobalMirPlan(optimized, sinkId);
    }
  }

  private class ResolvedToLir extends OptimizeStage<ResolvedGlobalMirPlan, GlobalLirPlan> {

    ResolvedToLir() {
      super("resolved_to_lir", timer);
    }

    @Override
    protected GlobalLirPlan doOptimize(ResolvedGlobalMirPlan plan) {
      DataflowDescription<StagedPlan> lowered =
          context.getPlanLowering().finalizeDataflow(plan.dataflow(), config.toLoweringFeatures());
      return new GlobalLirPlan(lowered, metainfo, timer, plan.sinkId());
    }
  }
}
