/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.optimizer.materialized;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;
import org.apache.calcite.rel.RelNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.opensearch.dataflow.PlanFixtures;
import org.opensearch.dataflow.catalog.CatalogEntry;
import org.opensearch.dataflow.catalog.ComputeInstanceSnapshot;
import org.opensearch.dataflow.catalog.InMemoryCatalogService;
import org.opensearch.dataflow.dataflow.DataflowDescription;
import org.opensearch.dataflow.dataflow.stage.StagedPlan;
import org.opensearch.dataflow.optimizer.OptimizeMode;
import org.opensearch.dataflow.optimizer.OptimizerConfig;
import org.opensearch.dataflow.optimizer.OptimizerContext;
import org.opensearch.dataflow.optimizer.OptimizerException;
import org.opensearch.dataflow.optimizer.OptimizerOutput;
import org.opensearch.dataflow.repr.GlobalId;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class MaterializedViewOptimizerTest {

  private static final GlobalId ORDERS = GlobalId.user(1);
  private static final GlobalId CUSTOMERS = GlobalId.user(2);
  private static final GlobalId VIEW = GlobalId.user(20);
  private static final GlobalId SINK = GlobalId.user(21);

  private final PlanFixtures plans = new PlanFixtures();
  private final InMemoryCatalogService catalog = new InMemoryCatalogService();
  private final ComputeInstanceSnapshot instance =
      new ComputeInstanceSnapshot("default", Set.of());
  private OptimizerContext context;
  private CatalogEntry orders;
  private CatalogEntry customers;

  @BeforeEach
  void setUp() {
    orders = CatalogEntry.table(ORDERS, "orders", plans.rowType("id", "amount"));
    customers = CatalogEntry.source(CUSTOMERS, "customers", plans.rowType("id"));
    catalog.register(orders);
    catalog.register(customers);
    context = OptimizerContext.withDefaults(catalog);
  }

  @Test
  void should_build_sink_over_view_query() {
    MaterializedViewOptimizer optimizer = optimizer(List.of("id", "amount"), List.of(0));

    RelNode query = plans.filterGreaterThan(plans.scan(orders), 1, 10);

    LocalMirPlan local = optimizer.hirToMir().optimize(plans.hir(query));
    GlobalLirPlan plan = optimizer.globalToLir().optimize(optimizer.mirToGlobal().optimize(local));

    assertEquals(SINK, plan.getSinkId());
    DataflowDescription.SinkDesc sink = plan.getSinkDesc();
    assertEquals(VIEW, sink.getFromId());
    assertEquals(DataflowDescription.SinkConnection.MATERIALIZED_VIEW, sink.getConnection());
    assertTrue(sink.isWithSnapshot());
    assertFalse(sink.upTo().isPresent());
    assertEquals(List.of(0), sink.getNonNullAssertions());

    OptimizerOutput<DataflowDescription<StagedPlan>> output = plan.unapply();
    assertEquals(List.of(VIEW), output.getPlan().objectIds());
    assertEquals(Set.of(ORDERS), output.getPlan().getSourceImports());
    assertEquals(Set.of(SINK), output.getExportIds());
    assertEquals(
        List.of("hir_to_mir", "mir_to_global", "global_to_lir"),
        List.copyOf(output.getStageDurations().keySet()));
  }

  @Test
  void should_accept_already_optimized_query() {
    MaterializedViewOptimizer optimizer = optimizer(List.of("id", "amount", "id0"), List.of());
    RelNode joined = plans.crossJoin(plans.scan(orders), plans.scan(customers));

    GlobalMirPlan global =
        optimizer
            .mirToGlobal()
            .optimize(optimizer.optimizedToMir().optimize(plans.optimized(joined)));

    DataflowDescription<?> dataflow = global.getDataflow();
    assertEquals(Set.of(ORDERS, CUSTOMERS), dataflow.getSourceImports());
    assertEquals(List.of(VIEW), dataflow.objectIds());
  }

  @Test
  void should_reject_column_count_mismatch() {
    MaterializedViewOptimizer optimizer = optimizer(List.of("id"), List.of());
    LocalMirPlan local = optimizer.optimizedToMir().optimize(plans.optimized(plans.scan(orders)));

    OptimizerException e =
        assertThrows(OptimizerException.class, () -> optimizer.mirToGlobal().optimize(local));

    assertEquals(OptimizerException.Kind.INTERNAL, e.getKind());
    assertEquals(
        "internal optimizer error: materialized view big_orders produces 2 columns but declares 1",
        e.getMessage());
  }

  @Test
  void should_reject_non_null_assertion_on_unknown_column() {
    MaterializedViewOptimizer optimizer = optimizer(List.of("id", "amount"), List.of(5));
    LocalMirPlan local = optimizer.optimizedToMir().optimize(plans.optimized(plans.scan(orders)));

    OptimizerException e =
        assertThrows(OptimizerException.class, () -> optimizer.mirToGlobal().optimize(local));

    assertEquals(OptimizerException.Kind.INTERNAL, e.getKind());
  }

  @Test
  void explain_with_transient_ids_does_not_touch_catalog_ids() {
    OptimizerConfig explain =
        OptimizerConfig.builder().mode(OptimizeMode.EXPLAIN).build();
    MaterializedViewOptimizer optimizer =
        new MaterializedViewOptimizer(
            context,
            instance,
            GlobalId.EXPLAIN,
            GlobalId.transientId(1),
            List.of("id", "amount"),
            List.of(),
            "explain",
            explain);

    GlobalMirPlan global =
        optimizer
            .mirToGlobal()
            .optimize(optimizer.hirToMir().optimize(plans.hir(plans.scan(orders))));

    assertEquals(List.of(GlobalId.transientId(1)), global.getDataflow().objectIds());
    assertEquals(Set.of(GlobalId.EXPLAIN), global.getDataflow().exportIds());
  }

  private MaterializedViewOptimizer optimizer(List<String> columns, List<Integer> nonNull) {
    return new MaterializedViewOptimizer(
        context,
        instance,
        SINK,
        VIEW,
        columns,
        nonNull,
        "big_orders",
        OptimizerConfig.builder().build());
  }
}
