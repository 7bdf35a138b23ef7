/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.optimizer;

import lombok.Builder;
import lombok.Getter;
import org.opensearch.dataflow.catalog.CatalogService;
import org.opensearch.dataflow.dataflow.PlanLowering;
import org.opensearch.dataflow.dataflow.StagedPlanLowering;
import org.opensearch.dataflow.planner.CalciteHirToMirLowering;
import org.opensearch.dataflow.planner.HirToMirLowering;
import org.opensearch.dataflow.transform.CalciteTransformer;
import org.opensearch.dataflow.transform.Transformer;

/** The collaborators every pipeline needs. Shared across pipelines; holds no per-run state. */
@Getter
@Builder
public class OptimizerContext {

  private final CatalogService catalog;

  @Builder.Default private final HirToMirLowering lowering = new CalciteHirToMirLowering();

  @Builder.Default private final Transformer transformer = new CalciteTransformer();

  @Builder.Default private final PlanLowering planLowering = new StagedPlanLowering();

  /** Context with the Calcite based collaborators. */
  public static OptimizerContext withDefaults(CatalogService catalog) {
    return OptimizerContext.builder().catalog(catalog).build();
  }
}
