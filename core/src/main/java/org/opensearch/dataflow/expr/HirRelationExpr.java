/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.expr;

import org.apache.calcite.rel.RelNode;

/** A raw relational expression as produced by SQL planning, before any lowering. */
public final class HirRelationExpr extends RelationExpr {

  public HirRelationExpr(RelNode root) {
    super(root);
  }
}
