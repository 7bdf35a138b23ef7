/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.expr;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import lombok.Getter;
import org.apache.calcite.plan.RelOptUtil;
import org.apache.calcite.rel.RelNode;
import org.apache.calcite.rel.type.RelDataType;
import org.opensearch.dataflow.optimizer.Transferable;
import org.opensearch.dataflow.repr.GlobalId;

/**
 * A relational expression at one IR level. The wrapped Calcite tree is never mutated; every
 * rewrite produces a new tree and a new wrapper.
 */
public abstract class RelationExpr implements Transferable {

  @Getter private final RelNode root;

  protected RelationExpr(RelNode root) {
    this.root = Preconditions.checkNotNull(root, "relation expression root");
  }

  public RelDataType getRowType() {
    return root.getRowType();
  }

  /** Number of output columns. */
  public int arity() {
    return root.getRowType().getFieldCount();
  }

  /** Catalog objects referenced by this expression, in first-reference order. */
  public ImmutableSet<GlobalId> dependencies() {
    return RelationExprs.dependencies(root);
  }

  /** Multi-line textual plan, stable across runs for structurally identical trees. */
  public String explain() {
    return RelOptUtil.toString(root);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{" + root.getRelTypeName() + ", arity=" + arity() + "}";
  }
}
