/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.planner;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

import java.util.List;
import org.apache.calcite.rel.RelNode;
import org.apache.calcite.rel.core.Filter;
import org.apache.calcite.rel.core.Join;
import org.apache.calcite.rel.type.RelDataType;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.opensearch.dataflow.PlanFixtures;
import org.opensearch.dataflow.expr.MirRelationExpr;
import org.opensearch.dataflow.repr.GlobalId;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class CalciteHirToMirLoweringTest {

  private static final GlobalId LEFT = GlobalId.user(1);
  private static final GlobalId RIGHT = GlobalId.user(2);

  private final PlanFixtures plans = new PlanFixtures();
  private final RelDataType rowType = plans.rowType("a", "b");
  private final CalciteHirToMirLowering lowering = new CalciteHirToMirLowering();

  @Test
  void should_keep_filters_above_joins_by_default() {
    MirRelationExpr lowered = lowering.lower(plans.hir(filteredJoin()), new HirToMirConfig(false));

    Filter filter = assertInstanceOf(Filter.class, lowered.getRoot());
    assertInstanceOf(Join.class, filter.getInput());
  }

  @Test
  void new_outer_join_lowering_pushes_filters_into_joins() {
    MirRelationExpr lowered = lowering.lower(plans.hir(filteredJoin()), new HirToMirConfig(true));

    assertInstanceOf(Join.class, lowered.getRoot());
    assertEquals(List.of(LEFT, RIGHT), List.copyOf(lowered.dependencies()));
  }

  @Test
  void lowering_keeps_row_type() {
    RelNode join = filteredJoin();

    MirRelationExpr lowered = lowering.lower(plans.hir(join), new HirToMirConfig(true));

    assertEquals(join.getRowType().getFieldCount(), lowered.arity());
  }

  private RelNode filteredJoin() {
    return plans.filterGreaterThan(
        plans.crossJoin(plans.scan(LEFT, rowType), plans.scan(RIGHT, rowType)), 0, 5);
  }
}
