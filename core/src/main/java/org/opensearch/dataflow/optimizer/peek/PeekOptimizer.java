/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.optimizer.peek;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;
import org.opensearch.dataflow.catalog.ComputeInstanceSnapshot;
import org.opensearch.dataflow.coord.DataflowBuilder;
import org.opensearch.dataflow.dataflow.DataflowDescription;
import org.opensearch.dataflow.dataflow.DataflowMetainfo;
import org.opensearch.dataflow.expr.HirRelationExpr;
import org.opensearch.dataflow.expr.MirRelationExpr;
import org.opensearch.dataflow.expr.OptimizedMirRelationExpr;
import org.opensearch.dataflow.expr.RowSetFinishing;
import org.opensearch.dataflow.optimizer.Optimize;
import org.opensearch.dataflow.optimizer.OptimizeStage;
import org.opensearch.dataflow.optimizer.OptimizerConfig;
import org.opensearch.dataflow.optimizer.OptimizerContext;
import org.opensearch.dataflow.optimizer.OptimizerTimer;
import org.opensearch.dataflow.repr.GlobalId;
import org.opensearch.dataflow.transform.TransformContext;

/**
 * Pipeline for one-shot {@code SELECT} statements.
 *
 * <pre>
 * HirRelationExpr          --hirToMir------------&gt; LocalMirPlan
 * OptimizedMirRelationExpr --optimizedToMir------&gt; LocalMirPlan
 * LocalMirPlan             --mirToGlobal---------&gt; GlobalMirPlan
 * GlobalMirPlan            --resolve(timestamp)--&gt; ResolvedGlobalMirPlan
 * ResolvedGlobalMirPlan    --resolvedToLir-------&gt; GlobalLirPlan
 * </pre>
 *
 * <p>The query is built under {@code selectId} and exported as a transient index {@code indexId}
 * over all of its columns, unless a fast path makes the dataflow unnecessary.
 */
@Log4j2
public class PeekOptimizer {

  private final OptimizerContext context;
  private final DataflowBuilder dataflowBuilder;
  @Getter private final RowSetFinishing finishing;
  @Getter private final GlobalId selectId;
  @Getter private final GlobalId indexId;
  @Getter private final OptimizerConfig config;
  private final OptimizerTimer timer = new OptimizerTimer();
  private final DataflowMetainfo metainfo = new DataflowMetainfo();

  public PeekOptimizer(
      OptimizerContext context,
      ComputeInstanceSnapshot computeInstance,
      RowSetFinishing finishing,
      GlobalId selectId,
      GlobalId indexId,
      OptimizerConfig config) {
    this.context = context;
    this.dataflowBuilder = new DataflowBuilder(context, computeInstance);
    this.finishing = finishing;
    this.selectId = selectId;
    this.indexId = indexId;
    this.config = config;
  }

  public Optimize<HirRelationExpr, LocalMirPlan> hirToMir() {
    return new HirToMir();
  }

  public Optimize<OptimizedMirRelationExpr, LocalMirPlan> optimizedToMir() {
    return new OptimizedToMir();
  }

  public Optimize<LocalMirPlan, GlobalMirPlan> mirToGlobal() {
    return new MirToGlobal();
  }

  public Optimize<ResolvedGlobalMirPlan, GlobalLirPlan> resolvedToLir() {
    return new ResolvedToLir();
  }

  private class HirToMir extends OptimizeStage<HirRelationExpr, LocalMirPlan> {

    HirToMir() {
      super("hir_to_mir", timer);
    }

    @Override
    protected LocalMirPlan doOptimize(HirRelationExpr expr) {
      MirRelationExpr lowered = context.getLowering().lower(expr, config.toHirToMirConfig());
      return new LocalMirPlan(
          context.getTransformer().optimizeView(lowered, new TransformContext(metainfo)));
    }
  }

  private class OptimizedToMir extends OptimizeStage<OptimizedMirRelationExpr, LocalMirPlan> {

    OptimizedToMir() {
      super("optimized_to_mir", timer);
    }

    @Override
    protected LocalMirPlan doOptimize(OptimizedMirRelationExpr expr) {
      return new LocalMirPlan(expr);
    }
  }

  private class MirToGlobal extends OptimizeStage<LocalMirPlan, GlobalMirPlan> {

    MirToGlobal() {
      super("mir_to_global", timer);
    }

    @Override
    protected GlobalMirPlan doOptimize(LocalMirPlan plan) {
      OptimizedMirRelationExpr expr = plan.getExpr();
      DataflowDescription<OptimizedMirRelationExpr> dataflow =
          new DataflowDescription<>("oneshot-select-" + selectId);
      dataflowBuilder.importViewIntoDataflow(selectId, expr, dataflow);
      List<Integer> keys =
          IntStream.range(0, expr.arity()).boxed().collect(Collectors.toList());
      dataflow.exportIndex(indexId, new DataflowDescription.IndexDesc(selectId, keys));
      dataflowBuilder.reoptimizeImportedViews(dataflow, config);

      DataflowDescription<OptimizedMirRelationExpr> optimized =
          context.getTransformer().optimizeDataflow(dataflow, new TransformContext(metainfo));
      return new GlobalMirPlan(optimized);
    }
  }

  private class ResolvedToLir extends OptimizeStage<ResolvedGlobalMirPlan, GlobalLirPlan> {

    ResolvedToLir() {
      super("resolved_to_lir", timer);
    }

    @Override
    protected GlobalLirPlan doOptimize(ResolvedGlobalMirPlan plan) {
      DataflowDescription<OptimizedMirRelationExpr> dataflow = plan.dataflow();
      Optional<FastPathPlan> fastPath =
          new FastPathPlanner(config.getPersistFastPathLimit())
              .plan(dataflow, finishing, metainfo);
      if (fastPath.isPresent()) {
        log.debug("Peek {} takes fast path {}", selectId, fastPath.get().getKind());
        return new GlobalLirPlan(
            PeekPlan.fastPath(fastPath.get()), metainfo, timer, dataflow.exportIds(), finishing);
      }
      PeekPlan slow =
          PeekPlan.slowPath(
              context
                  .getPlanLowering()
                  .finalizeDataflow(dataflow, config.toLoweringFeatures()));
      return new GlobalLirPlan(slow, metainfo, timer, dataflow.exportIds(), finishing);
    }
  }
}
