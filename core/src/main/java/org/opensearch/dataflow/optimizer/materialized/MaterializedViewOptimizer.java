/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.optimizer.materialized;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;
import org.opensearch.dataflow.catalog.ComputeInstanceSnapshot;
import org.opensearch.dataflow.common.utils.StringUtils;
import org.opensearch.dataflow.coord.DataflowBuilder;
import org.opensearch.dataflow.dataflow.DataflowDescription;
import org.opensearch.dataflow.dataflow.DataflowMetainfo;
import org.opensearch.dataflow.dataflow.stage.StagedPlan;
import org.opensearch.dataflow.expr.HirRelationExpr;
import org.opensearch.dataflow.expr.MirRelationExpr;
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
 * Pipeline for {@code CREATE MATERIALIZED VIEW}.
 *
 * <pre>
 * HirRelationExpr          --hirToMir------&gt; LocalMirPlan
 * OptimizedMirRelationExpr --optimizedToMir-&gt; LocalMirPlan
 * LocalMirPlan             --mirToGlobal---&gt; GlobalMirPlan
 * GlobalMirPlan            --globalToLir---&gt; GlobalLirPlan
 * </pre>
 *
 * <p>The second entry point takes a plan that was optimized earlier, for example when a catalog
 * is re-planned on startup.
 */
@Log4j2
public class MaterializedViewOptimizer {

  private final OptimizerContext context;
  private final DataflowBuilder dataflowBuilder;

  /** Id of the sink that writes the view's contents. */
  @Getter private final GlobalId sinkId;

  /** Id the view's query is built under inside the dataflow. */
  @Getter private final GlobalId viewId;

  private final List<String> columnNames;
  private final List<Integer> nonNullAssertions;
  private final String debugName;
  @Getter private final OptimizerConfig config;
  private final OptimizerTimer timer = new OptimizerTimer();
  private final DataflowMetainfo metainfo = new DataflowMetainfo();

  public MaterializedViewOptimizer(
      OptimizerContext context,
      ComputeInstanceSnapshot computeInstance,
      GlobalId sinkId,
      GlobalId viewId,
      List<String> columnNames,
      List<Integer> nonNullAssertions,
      String debugName,
      OptimizerConfig config) {
    this.context = context;
    this.dataflowBuilder = new DataflowBuilder(context, computeInstance);
    this.sinkId = sinkId;
    this.viewId = viewId;
    this.columnNames = ImmutableList.copyOf(columnNames);
    this.nonNullAssertions = ImmutableList.copyOf(nonNullAssertions);
    this.debugName = debugName;
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

  public Optimize<GlobalMirPlan, GlobalLirPlan> globalToLir() {
    return new GlobalToLir();
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
      if (expr.arity() != columnNames.size()) {
        throw OptimizerException.internal(
            StringUtils.format(
                "materialized view %s produces %d columns but declares %d",
                debugName, expr.arity(), columnNames.size()));
      }
      for (Integer column : nonNullAssertions) {
        if (column < 0 || column >= expr.arity()) {
          throw OptimizerException.internal(
              StringUtils.format("non-null assertion on unknown column %d", column));
        }
      }

      DataflowDescription<OptimizedMirRelationExpr> dataflow =
          new DataflowDescription<>(debugName);
      dataflowBuilder.importViewIntoDataflow(viewId, expr, dataflow);
      dataflow.exportSink(
          sinkId,
          new DataflowDescription.SinkDesc(
              viewId,
              DataflowDescription.SinkConnection.MATERIALIZED_VIEW,
              true,
              null,
              nonNullAssertions));
      dataflowBuilder.reoptimizeImportedViews(dataflow, config);

      DataflowDescription<OptimizedMirRelationExpr> optimized =
          context.getTransformer().optimizeDataflow(dataflow, new TransformContext(metainfo));
      log.debug("Built materialized view dataflow {} with sink {}", debugName, sinkId);
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
      return new GlobalLirPlan(lowered, metainfo, timer, sinkId);
    }
  }
}
