/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.expr;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import java.util.Optional;
import lombok.experimental.UtilityClass;
import org.apache.calcite.linq4j.tree.Expression;
import org.apache.calcite.plan.RelOptCluster;
import org.apache.calcite.plan.RelOptTable;
import org.apache.calcite.plan.volcano.VolcanoPlanner;
import org.apache.calcite.prepare.RelOptTableImpl;
import org.apache.calcite.rel.RelNode;
import org.apache.calcite.rel.core.Filter;
import org.apache.calcite.rel.core.Minus;
import org.apache.calcite.rel.core.Project;
import org.apache.calcite.rel.core.TableScan;
import org.apache.calcite.rel.core.Values;
import org.apache.calcite.rel.logical.LogicalTableScan;
import org.apache.calcite.rel.type.RelDataType;
import org.apache.calcite.rel.type.RelDataTypeSystem;
import org.apache.calcite.rex.RexBuilder;
import org.apache.calcite.sql.type.SqlTypeFactoryImpl;
import org.opensearch.dataflow.repr.GlobalId;

/** Helpers for building and inspecting relational trees that reference catalog objects. */
@UtilityClass
public class RelationExprs {

  /** Creates a fresh cluster with its own type factory. Clusters are not shared across threads. */
  public static RelOptCluster newCluster() {
    return RelOptCluster.create(
        new VolcanoPlanner(), new RexBuilder(new SqlTypeFactoryImpl(RelDataTypeSystem.DEFAULT)));
  }

  /** Builds a reference to catalog object {@code id} producing rows of {@code rowType}. */
  public static RelNode get(RelOptCluster cluster, GlobalId id, RelDataType rowType) {
    RelOptTable table =
        RelOptTableImpl.create(null, rowType, ImmutableList.of(id.toString()), (Expression) null);
    return LogicalTableScan.create(cluster, table, ImmutableList.of());
  }

  /** The id a scan refers to. */
  public static GlobalId scannedId(TableScan scan) {
    List<String> names = scan.getTable().getQualifiedName();
    return GlobalId.parse(names.get(names.size() - 1));
  }

  /** All catalog scans in depth-first, left-to-right order. */
  public static List<TableScan> scans(RelNode rel) {
    ImmutableList.Builder<TableScan> builder = ImmutableList.builder();
    collectScans(rel, builder);
    return builder.build();
  }

  private static void collectScans(RelNode rel, ImmutableList.Builder<TableScan> builder) {
    if (rel instanceof TableScan) {
      builder.add((TableScan) rel);
      return;
    }
    for (RelNode input : rel.getInputs()) {
      collectScans(input, builder);
    }
  }

  /** Referenced ids in first-reference order, without duplicates. */
  public static ImmutableSet<GlobalId> dependencies(RelNode rel) {
    ImmutableSet.Builder<GlobalId> builder = ImmutableSet.builder();
    for (TableScan scan : scans(rel)) {
      builder.add(scannedId(scan));
    }
    return builder.build();
  }

  /**
   * Returns the scan at the bottom of a chain made only of filters and projections, or empty if
   * the tree does anything else.
   */
  public static Optional<TableScan> plainRead(RelNode rel) {
    RelNode current = rel;
    while (current instanceof Filter || current instanceof Project) {
      current = current.getInput(0);
    }
    return current instanceof TableScan ? Optional.of((TableScan) current) : Optional.empty();
  }

  /** True if the tree is a literal row set. */
  public static boolean isConstant(RelNode rel) {
    return rel instanceof Values;
  }

  /** True if the tree contains a set difference anywhere. */
  public static boolean containsMinus(RelNode rel) {
    if (rel instanceof Minus) {
      return true;
    }
    for (RelNode input : rel.getInputs()) {
      if (containsMinus(input)) {
        return true;
      }
    }
    return false;
  }
}
