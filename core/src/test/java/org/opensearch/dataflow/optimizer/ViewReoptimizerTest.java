/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.optimizer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.List;
import org.apache.calcite.rel.RelNode;
import org.apache.calcite.rel.type.RelDataType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.opensearch.dataflow.PlanFixtures;
import org.opensearch.dataflow.catalog.CatalogEntry;
import org.opensearch.dataflow.catalog.CatalogService;
import org.opensearch.dataflow.dataflow.DataflowDescription;
import org.opensearch.dataflow.dataflow.PlanLowering;
import org.opensearch.dataflow.exception.AdapterException;
import org.opensearch.dataflow.expr.HirRelationExpr;
import org.opensearch.dataflow.expr.MirRelationExpr;
import org.opensearch.dataflow.expr.OptimizedMirRelationExpr;
import org.opensearch.dataflow.planner.HirToMirLowering;
import org.opensearch.dataflow.planner.PlanException;
import org.opensearch.dataflow.repr.GlobalId;
import org.opensearch.dataflow.transform.Transformer;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
@ExtendWith(MockitoExtension.class)
class ViewReoptimizerTest {

  private static final GlobalId TABLE = GlobalId.user(1);
  private static final GlobalId A = GlobalId.user(2);
  private static final GlobalId B = GlobalId.user(3);
  private static final GlobalId C = GlobalId.user(4);

  @Mock private CatalogService catalog;
  @Mock private HirToMirLowering lowering;
  @Mock private Transformer transformer;
  @Mock private PlanLowering planLowering;

  private final PlanFixtures plans = new PlanFixtures();
  private ViewReoptimizer reoptimizer;
  private DataflowDescription<OptimizedMirRelationExpr> dataflow;
  private CatalogEntry viewA;
  private CatalogEntry viewB;
  private CatalogEntry viewC;

  private final OptimizerConfig explain =
      OptimizerConfig.builder().mode(OptimizeMode.EXPLAIN).build();

  @BeforeEach
  void setUp() {
    reoptimizer =
        new ViewReoptimizer(
            OptimizerContext.builder()
                .catalog(catalog)
                .lowering(lowering)
                .transformer(transformer)
                .planLowering(planLowering)
                .build());

    RelDataType rowType = plans.rowType("a", "b");
    RelNode table = plans.scan(TABLE, rowType);
    viewA = plans.view(A, "a", plans.filterGreaterThan(table, 0, 1));
    viewB = plans.view(B, "b", plans.filterGreaterThan(plans.scan(viewA), 1, 2));
    viewC = plans.view(C, "c", plans.filterGreaterThan(plans.scan(viewB), 0, 3));

    // C depends on B, which depends on A.
    dataflow = new DataflowDescription<>("chain");
    dataflow.importSource(TABLE);
    dataflow.insertPlan(A, viewA.getOptimizedExpr().get());
    dataflow.insertPlan(B, viewB.getOptimizedExpr().get());
    dataflow.insertPlan(C, viewC.getOptimizedExpr().get());
  }

  @Test
  void should_do_nothing_outside_explain() {
    List<DataflowDescription.BuildDesc<OptimizedMirRelationExpr>> before =
        dataflow.getObjectsToBuild();

    reoptimizer.reoptimize(dataflow, OptimizerConfig.builder().build());

    assertEquals(before, dataflow.getObjectsToBuild());
    verifyNoInteractions(catalog, lowering, transformer);
  }

  @Test
  void should_reoptimize_views_dependencies_first() {
    OptimizedMirRelationExpr freshA = stubView(viewA);
    OptimizedMirRelationExpr freshB = stubView(viewB);
    OptimizedMirRelationExpr freshC = stubView(viewC);

    reoptimizer.reoptimize(dataflow, explain);

    InOrder order = inOrder(lowering);
    order.verify(lowering).lower(eq(raw(viewA)), any());
    order.verify(lowering).lower(eq(raw(viewB)), any());
    order.verify(lowering).lower(eq(raw(viewC)), any());
    List<DataflowDescription.BuildDesc<OptimizedMirRelationExpr>> objects =
        dataflow.getObjectsToBuild();
    assertEquals(List.of(A, B, C), dataflow.objectIds());
    assertSame(freshA, objects.get(0).getPlan());
    assertSame(freshB, objects.get(1).getPlan());
    assertSame(freshC, objects.get(2).getPlan());
  }

  @Test
  void should_leave_dataflow_untouched_when_a_view_fails() {
    stubView(viewA);
    when(catalog.getEntry(B)).thenReturn(viewB);
    when(lowering.lower(eq(raw(viewB)), any())).thenThrow(new PlanException("b is broken"));
    List<DataflowDescription.BuildDesc<OptimizedMirRelationExpr>> before =
        dataflow.getObjectsToBuild();

    OptimizerException e =
        assertThrows(OptimizerException.class, () -> reoptimizer.reoptimize(dataflow, explain));

    assertEquals(OptimizerException.Kind.PLAN, e.getKind());
    assertEquals("b is broken", e.getMessage());
    assertEquals(before, dataflow.getObjectsToBuild());
    verify(catalog, never()).getEntry(C);
  }

  @Test
  void should_skip_synthetic_objects() {
    GlobalId transientId = GlobalId.transientId(1);
    DataflowDescription<OptimizedMirRelationExpr> peek = new DataflowDescription<>("peek");
    peek.importSource(TABLE);
    OptimizedMirRelationExpr plan = plans.optimized(plans.scan(TABLE, plans.rowType("a")));
    peek.insertPlan(transientId, plan);
    peek.insertPlan(GlobalId.EXPLAIN, plan);

    reoptimizer.reoptimize(peek, explain);

    verifyNoInteractions(catalog, lowering, transformer);
    assertSame(plan, peek.getObjectsToBuild().get(0).getPlan());
  }

  @Test
  void should_leave_other_objects_alone() {
    CatalogEntry table = CatalogEntry.table(TABLE, "t", plans.rowType("a", "b"));
    DataflowDescription<OptimizedMirRelationExpr> built = new DataflowDescription<>("built");
    OptimizedMirRelationExpr plan = plans.optimized(plans.scan(table));
    built.insertPlan(TABLE, plan);
    when(catalog.getEntry(TABLE)).thenReturn(table);

    reoptimizer.reoptimize(built, explain);

    assertSame(plan, built.getObjectsToBuild().get(0).getPlan());
    verifyNoInteractions(lowering, transformer);
  }

  @Test
  void should_report_unknown_objects_as_adapter_errors() {
    when(catalog.getEntry(A)).thenThrow(AdapterException.unknownItem(A.toString()));

    OptimizerException e =
        assertThrows(OptimizerException.class, () -> reoptimizer.reoptimize(dataflow, explain));

    assertEquals(OptimizerException.Kind.ADAPTER, e.getKind());
    assertEquals("unknown catalog item 'u2'", e.getMessage());
  }

  private OptimizedMirRelationExpr stubView(CatalogEntry view) {
    MirRelationExpr lowered = plans.mir(raw(view).getRoot());
    OptimizedMirRelationExpr fresh = plans.optimized(raw(view).getRoot());
    when(catalog.getEntry(view.getId())).thenReturn(view);
    when(lowering.lower(eq(raw(view)), any())).thenReturn(lowered);
    when(transformer.optimizeView(eq(lowered), any())).thenReturn(fresh);
    return fresh;
  }

  private static HirRelationExpr raw(CatalogEntry view) {
    return view.getRawExpr().get();
  }
}
