/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.coord;

import java.util.List;
import java.util.Locale;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;
import org.opensearch.dataflow.catalog.CatalogEntry;
import org.opensearch.dataflow.catalog.ComputeInstanceSnapshot;
import org.opensearch.dataflow.common.utils.StringUtils;
import org.opensearch.dataflow.dataflow.DataflowDescription;
import org.opensearch.dataflow.exception.AdapterException;
import org.opensearch.dataflow.expr.OptimizedMirRelationExpr;
import org.opensearch.dataflow.optimizer.OptimizerConfig;
import org.opensearch.dataflow.optimizer.OptimizerContext;
import org.opensearch.dataflow.optimizer.ViewReoptimizer;
import org.opensearch.dataflow.repr.GlobalId;

/**
 * Assembles MIR dataflows against one compute instance. Each dependency is brought in the
 * cheapest way available: an installed index, a storage collection, or the view's plan inlined
 * into the dataflow.
 */
@Log4j2
public class DataflowBuilder {

  private final OptimizerContext context;
  @Getter private final ComputeInstanceSnapshot computeInstance;

  public DataflowBuilder(OptimizerContext context, ComputeInstanceSnapshot computeInstance) {
    this.context = context;
    this.computeInstance = computeInstance;
  }

  /**
   * Makes {@code id} available inside {@code dataflow}. Views are inlined together with their own
   * dependencies, which are inserted first.
   *
   * @throws AdapterException if {@code id} or one of its dependencies is unknown or cannot be read
   */
  public void importIntoDataflow(
      GlobalId id, DataflowDescription<OptimizedMirRelationExpr> dataflow) {
    if (dataflow.isImported(id)) {
      return;
    }

    List<CatalogEntry> indexes = context.getCatalog().getIndexesOn(id, computeInstance);
    if (!indexes.isEmpty()) {
      for (CatalogEntry index : indexes) {
        dataflow.importIndex(
            index.getId(), new DataflowDescription.IndexImport(id, index.getIndexKeys()));
      }
      log.debug("Imported {} through {} installed indexes", id, indexes.size());
      return;
    }

    CatalogEntry entry = context.getCatalog().getEntry(id);
    switch (entry.getItemType()) {
      case TABLE:
      case SOURCE:
      case MATERIALIZED_VIEW:
        dataflow.importSource(id);
        break;
      case VIEW:
        OptimizedMirRelationExpr plan =
            entry
                .getOptimizedExpr()
                .orElseThrow(
                    () ->
                        AdapterException.invalidObject(
                            StringUtils.format("view %s has no stored plan", id)));
        importViewIntoDataflow(id, plan, dataflow);
        break;
      default:
        throw AdapterException.invalidObject(
            StringUtils.format(
                "cannot read from %s %s", entry.getItemType().name().toLowerCase(Locale.ROOT), id));
    }
  }

  /** Imports the dependencies of {@code view} and then adds it as an object to build. */
  public void importViewIntoDataflow(
      GlobalId viewId,
      OptimizedMirRelationExpr view,
      DataflowDescription<OptimizedMirRelationExpr> dataflow) {
    for (GlobalId dependency : view.dependencies()) {
      importIntoDataflow(dependency, dataflow);
    }
    dataflow.insertPlan(viewId, view);
  }

  /** Re-optimizes the inlined views when the statement is an explain. */
  public void reoptimizeImportedViews(
      DataflowDescription<OptimizedMirRelationExpr> dataflow, OptimizerConfig config) {
    new ViewReoptimizer(context).reoptimize(dataflow, config);
  }
}
