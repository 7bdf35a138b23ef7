/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.transform;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.calcite.rel.RelNode;
import org.apache.calcite.rel.core.Filter;
import org.apache.calcite.rel.core.TableScan;
import org.apache.calcite.rel.type.RelDataType;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.opensearch.dataflow.PlanFixtures;
import org.opensearch.dataflow.dataflow.DataflowDescription;
import org.opensearch.dataflow.dataflow.DataflowMetainfo;
import org.opensearch.dataflow.dataflow.IndexUsageType;
import org.opensearch.dataflow.expr.OptimizedMirRelationExpr;
import org.opensearch.dataflow.repr.GlobalId;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class CalciteTransformerTest {

  private static final GlobalId TABLE = GlobalId.user(1);
  private static final GlobalId OTHER = GlobalId.user(2);
  private static final GlobalId INDEX = GlobalId.user(3);

  private final PlanFixtures plans = new PlanFixtures();
  private final RelDataType rowType = plans.rowType("a", "b");
  private final CalciteTransformer transformer = new CalciteTransformer();
  private final DataflowMetainfo metainfo = new DataflowMetainfo();

  @Test
  void should_merge_stacked_filters() {
    RelNode stacked =
        plans.filterGreaterThan(plans.filterGreaterThan(plans.scan(TABLE, rowType), 0, 1), 1, 2);

    OptimizedMirRelationExpr optimized =
        transformer.optimizeView(plans.mir(stacked), new TransformContext(metainfo));

    Filter filter = assertInstanceOf(Filter.class, optimized.getRoot());
    assertInstanceOf(TableScan.class, filter.getInput());
    assertEquals(Set.of(TABLE), optimized.dependencies());
  }

  @Test
  void should_keep_object_ids_when_optimizing_dataflow() {
    DataflowDescription<OptimizedMirRelationExpr> dataflow = new DataflowDescription<>("df");
    dataflow.importSource(TABLE);
    dataflow.insertPlan(
        GlobalId.transientId(1),
        plans.optimized(
            plans.filterGreaterThan(
                plans.filterGreaterThan(plans.scan(TABLE, rowType), 0, 1), 1, 2)));

    DataflowDescription<OptimizedMirRelationExpr> optimized =
        transformer.optimizeDataflow(dataflow, new TransformContext(metainfo));

    assertEquals(List.of(GlobalId.transientId(1)), optimized.objectIds());
    assertEquals(dataflow.getSourceImports(), optimized.getSourceImports());
    Filter filter =
        assertInstanceOf(Filter.class, optimized.getObjectsToBuild().get(0).getPlan().getRoot());
    assertInstanceOf(TableScan.class, filter.getInput());
  }

  @Test
  void should_record_index_usage_and_unused_imports() {
    DataflowDescription<OptimizedMirRelationExpr> dataflow = new DataflowDescription<>("df");
    dataflow.importIndex(INDEX, new DataflowDescription.IndexImport(TABLE, List.of(0)));
    dataflow.importIndex(GlobalId.user(4), new DataflowDescription.IndexImport(OTHER, List.of(0)));
    dataflow.insertPlan(GlobalId.transientId(1), plans.optimized(plans.scan(TABLE, rowType)));

    transformer.optimizeDataflow(dataflow, new TransformContext(metainfo));

    assertEquals(
        Map.of(INDEX, Set.of(IndexUsageType.FULL_SCAN)), metainfo.getIndexUsage());
    assertEquals(List.of("index u4 on u2 is imported but not used"), metainfo.getNotices());
  }

  @Test
  void optimization_is_deterministic() {
    RelNode stacked =
        plans.filterGreaterThan(plans.filterGreaterThan(plans.scan(TABLE, rowType), 0, 1), 1, 2);

    String first =
        transformer.optimizeView(plans.mir(stacked), new TransformContext(metainfo)).explain();
    String second =
        transformer.optimizeView(plans.mir(stacked), new TransformContext(metainfo)).explain();

    assertEquals(first, second);
    assertTrue(first.contains("LogicalTableScan(table=[[u1]])"));
  }
}
