/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.dataflow;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.stream.Collectors;
import org.apache.calcite.rel.RelNode;
import org.apache.calcite.rel.type.RelDataType;
import org.apache.calcite.sql.type.SqlTypeName;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.opensearch.dataflow.PlanFixtures;
import org.opensearch.dataflow.dataflow.stage.ComputeStage;
import org.opensearch.dataflow.dataflow.stage.ExchangeType;
import org.opensearch.dataflow.dataflow.stage.StagedPlan;
import org.opensearch.dataflow.expr.OptimizedMirRelationExpr;
import org.opensearch.dataflow.repr.GlobalId;
import org.opensearch.dataflow.transform.TransformException;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class StagedPlanLoweringTest {

  private static final GlobalId LEFT = GlobalId.user(1);
  private static final GlobalId RIGHT = GlobalId.user(2);
  private static final GlobalId OBJECT = GlobalId.transientId(5);

  private final PlanFixtures plans = new PlanFixtures();
  private final RelDataType rowType = plans.rowType("a", "b");
  private final StagedPlanLowering lowering = new StagedPlanLowering();
  private final LoweringFeatures defaults = new LoweringFeatures(true, false);

  @Test
  void should_split_object_at_its_reads() {
    RelNode join = plans.crossJoin(plans.scan(LEFT, rowType), plans.scan(RIGHT, rowType));

    StagedPlan plan = lowerSingle(join, defaults);

    assertEquals("t5", plan.getPlanId());
    assertEquals(
        List.of("t5-0", "t5-1", "t5-2"),
        plan.getStages().stream().map(ComputeStage::getStageId).collect(Collectors.toList()));
    assertEquals(2, plan.getLeafStages().size());
    assertEquals(
        ExchangeType.GATHER, plan.getStage("t5-0").getOutputPartitioning().getExchangeType());
    ComputeStage root = plan.getRootStage();
    assertEquals(ExchangeType.NONE, root.getOutputPartitioning().getExchangeType());
    assertEquals(List.of("t5-0", "t5-1"), root.getSourceStageIds());
    assertSame(join, root.getPlanFragment());
    assertFalse(root.isConsolidateOutput());
    assertTrue(root.getArrangementTypes().isEmpty());
  }

  @Test
  void constant_object_is_a_single_stage() {
    DataflowDescription<OptimizedMirRelationExpr> dataflow = new DataflowDescription<>("const");
    dataflow.insertPlan(OBJECT, plans.optimized(plans.oneRow()));

    StagedPlan plan =
        lowering.finalizeDataflow(dataflow, defaults).getObjectsToBuild().get(0).getPlan();

    assertEquals(1, plan.getStageCount());
    assertTrue(plan.getRootStage().isLeaf());
  }

  @Test
  void should_mark_consolidation_after_negation_when_enabled() {
    RelNode minus = plans.minus(plans.scan(LEFT, rowType), plans.scan(RIGHT, rowType));

    assertTrue(lowerSingle(minus, defaults).getRootStage().isConsolidateOutput());
    LoweringFeatures disabled = new LoweringFeatures(false, false);
    assertFalse(lowerSingle(minus, disabled).getRootStage().isConsolidateOutput());
  }

  @Test
  void should_record_arrangement_types_when_specialized() {
    StagedPlan plan = lowerSingle(plans.scan(LEFT, rowType), new LoweringFeatures(true, true));

    assertEquals(
        List.of(SqlTypeName.INTEGER, SqlTypeName.INTEGER),
        plan.getRootStage().getArrangementTypes());
    assertEquals(
        List.of(SqlTypeName.INTEGER, SqlTypeName.INTEGER),
        plan.getLeafStages().get(0).getArrangementTypes());
  }

  @Test
  void should_reject_reads_of_unavailable_collections() {
    DataflowDescription<OptimizedMirRelationExpr> dataflow = new DataflowDescription<>("broken");
    dataflow.importSource(LEFT);
    dataflow.insertPlan(OBJECT, plans.optimized(plans.scan(RIGHT, rowType)));

    TransformException e =
        assertThrows(TransformException.class, () -> lowering.finalizeDataflow(dataflow, defaults));
    assertEquals(
        "object t5 of dataflow broken reads u2, which is neither imported nor built before it",
        e.getMessage());
  }

  @Test
  void should_carry_frame_over() {
    DataflowDescription<OptimizedMirRelationExpr> dataflow = dataflow(plans.scan(LEFT, rowType));
    dataflow.exportIndex(
        GlobalId.transientId(6), new DataflowDescription.IndexDesc(OBJECT, List.of(0, 1)));
    dataflow.setAsOf(3L);

    DataflowDescription<StagedPlan> lowered = lowering.finalizeDataflow(dataflow, defaults);

    assertEquals(dataflow.getSourceImports(), lowered.getSourceImports());
    assertEquals(dataflow.getIndexExports(), lowered.getIndexExports());
    assertEquals(dataflow.getAsOf(), lowered.getAsOf());
  }

  @Test
  void lowering_is_deterministic() {
    RelNode join = plans.crossJoin(plans.scan(LEFT, rowType), plans.scan(RIGHT, rowType));

    StagedPlan first = lowerSingle(join, defaults);
    StagedPlan second = lowerSingle(join, defaults);

    assertEquals(first.toString(), second.toString());
    assertEquals(
        first.getStages().stream().map(ComputeStage::toString).collect(Collectors.toList()),
        second.getStages().stream().map(ComputeStage::toString).collect(Collectors.toList()));
  }

  private StagedPlan lowerSingle(RelNode root, LoweringFeatures features) {
    return lowering.finalizeDataflow(dataflow(root), features).getObjectsToBuild().get(0).getPlan();
  }

  private DataflowDescription<OptimizedMirRelationExpr> dataflow(RelNode root) {
    DataflowDescription<OptimizedMirRelationExpr> dataflow = new DataflowDescription<>("test");
    dataflow.importSource(LEFT);
    dataflow.importSource(RIGHT);
    dataflow.insertPlan(OBJECT, plans.optimized(root));
    return dataflow;
  }
}
