/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.optimizer;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.opensearch.dataflow.catalog.CatalogEntry;
import org.opensearch.dataflow.catalog.CatalogItemType;
import org.opensearch.dataflow.dataflow.DataflowDescription;
import org.opensearch.dataflow.exception.AdapterException;
import org.opensearch.dataflow.expr.HirRelationExpr;
import org.opensearch.dataflow.expr.OptimizedMirRelationExpr;
import org.opensearch.dataflow.optimizer.view.ViewOptimizer;
import org.opensearch.dataflow.repr.GlobalId;

/**
 * Re-optimizes the views inlined into a dataflow with the configuration of the current statement.
 * Stored view plans were optimized under whatever settings were in effect when the view was
 * created; an explain statement has to show the plan its own overrides produce.
 */
@Log4j2
@RequiredArgsConstructor
public class ViewReoptimizer {

  private final OptimizerContext context;

  /**
   * Replaces the plan of every inlined view with a freshly optimized one. Does nothing outside of
   * explain mode. Either every view is replaced or, on failure, none is.
   *
   * @throws OptimizerException if a view is unknown or cannot be optimized
   */
  public void reoptimize(
      DataflowDescription<OptimizedMirRelationExpr> dataflow, OptimizerConfig config) {
    if (config.getMode() != OptimizeMode.EXPLAIN) {
      return;
    }
    Map<GlobalId, OptimizedMirRelationExpr> fresh = new LinkedHashMap<>();
    for (DataflowDescription.BuildDesc<OptimizedMirRelationExpr> build :
        dataflow.getObjectsToBuild()) {
      GlobalId id = build.getId();
      if (id.isSynthetic()) {
        continue;
      }
      CatalogEntry entry;
      try {
        entry = context.getCatalog().getEntry(id);
      } catch (AdapterException e) {
        throw new OptimizerException(e);
      }
      if (entry.getItemType() != CatalogItemType.VIEW) {
        continue;
      }
      HirRelationExpr raw =
          entry
              .getRawExpr()
              .orElseThrow(
                  () -> OptimizerException.internal("view " + id + " has no defining expression"));
      fresh.put(id, new ViewOptimizer(context, config).optimize(raw));
    }
    fresh.forEach(dataflow::replacePlan);
    log.debug("Re-optimized {} views of dataflow {}", fresh.size(), dataflow.getDebugName());
  }
}
