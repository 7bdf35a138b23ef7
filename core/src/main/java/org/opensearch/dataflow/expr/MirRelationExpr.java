/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.expr;

import org.apache.calcite.rel.RelNode;

/** A mid-level relational expression: subqueries decorrelated, ready for logical rewrites. */
public final class MirRelationExpr extends RelationExpr {

  public MirRelationExpr(RelNode root) {
    super(root);
  }
}
