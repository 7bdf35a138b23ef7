/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.catalog;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Optional;
import lombok.Getter;
import lombok.ToString;
import org.apache.calcite.rel.type.RelDataType;
import org.opensearch.dataflow.expr.HirRelationExpr;
import org.opensearch.dataflow.expr.OptimizedMirRelationExpr;
import org.opensearch.dataflow.repr.GlobalId;

/**
 * One catalog item as the optimizer sees it. Views and materialized views carry the raw expression
 * they were defined with and the optimized expression stored when they were created; indexes carry
 * the object they index and their key columns.
 */
@Getter
@ToString(of = {"id", "name", "itemType"})
public final class CatalogEntry {

  private final GlobalId id;
  private final String name;
  private final CatalogItemType itemType;
  private final RelDataType rowType;

  @Getter(lombok.AccessLevel.NONE)
  private final HirRelationExpr rawExpr;

  @Getter(lombok.AccessLevel.NONE)
  private final OptimizedMirRelationExpr optimizedExpr;

  @Getter(lombok.AccessLevel.NONE)
  private final GlobalId indexOn;

  private final List<Integer> indexKeys;

  private CatalogEntry(
      GlobalId id,
      String name,
      CatalogItemType itemType,
      RelDataType rowType,
      HirRelationExpr rawExpr,
      OptimizedMirRelationExpr optimizedExpr,
      GlobalId indexOn,
      List<Integer> indexKeys) {
    this.id = Preconditions.checkNotNull(id, "id");
    this.name = Preconditions.checkNotNull(name, "name");
    this.itemType = itemType;
    this.rowType = Preconditions.checkNotNull(rowType, "rowType");
    this.rawExpr = rawExpr;
    this.optimizedExpr = optimizedExpr;
    this.indexOn = indexOn;
    this.indexKeys = ImmutableList.copyOf(indexKeys);
  }

  public static CatalogEntry table(GlobalId id, String name, RelDataType rowType) {
    return new CatalogEntry(id, name, CatalogItemType.TABLE, rowType, null, null, null, List.of());
  }

  public static CatalogEntry source(GlobalId id, String name, RelDataType rowType) {
    return new CatalogEntry(id, name, CatalogItemType.SOURCE, rowType, null, null, null, List.of());
  }

  public static CatalogEntry view(
      GlobalId id, String name, HirRelationExpr rawExpr, OptimizedMirRelationExpr optimizedExpr) {
    return new CatalogEntry(
        id,
        name,
        CatalogItemType.VIEW,
        rawExpr.getRowType(),
        rawExpr,
        optimizedExpr,
        null,
        List.of());
  }

  public static CatalogEntry materializedView(
      GlobalId id, String name, HirRelationExpr rawExpr, OptimizedMirRelationExpr optimizedExpr) {
    return new CatalogEntry(
        id,
        name,
        CatalogItemType.MATERIALIZED_VIEW,
        rawExpr.getRowType(),
        rawExpr,
        optimizedExpr,
        null,
        List.of());
  }

  /** An index on {@code on}; shares the row type of the indexed object. */
  public static CatalogEntry index(GlobalId id, String name, CatalogEntry on, List<Integer> keys) {
    return new CatalogEntry(
        id, name, CatalogItemType.INDEX, on.getRowType(), null, null, on.getId(), keys);
  }

  /** Raw defining expression of a view or materialized view. */
  public Optional<HirRelationExpr> getRawExpr() {
    return Optional.ofNullable(rawExpr);
  }

  /** Optimized expression stored with a view or materialized view. */
  public Optional<OptimizedMirRelationExpr> getOptimizedExpr() {
    return Optional.ofNullable(optimizedExpr);
  }

  /** The indexed object, for indexes. */
  public Optional<GlobalId> getIndexOn() {
    return Optional.ofNullable(indexOn);
  }

  public int arity() {
    return rowType.getFieldCount();
  }
}
