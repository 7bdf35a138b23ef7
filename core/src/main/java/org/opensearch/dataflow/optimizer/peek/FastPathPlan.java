/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.optimizer.peek;

import java.util.Optional;
import lombok.Getter;
import lombok.ToString;
import org.apache.calcite.rel.RelNode;
import org.opensearch.dataflow.repr.GlobalId;

/** A peek that can be answered without installing a dataflow. */
@Getter
@ToString(of = {"kind", "collectionId", "indexId"})
public final class FastPathPlan {

  public enum Kind {
    /** The result is a literal row set. */
    CONSTANT,

    /** Read from an index that is already installed. */
    PEEK_EXISTING,

    /** Read a bounded number of rows directly from storage. */
    PEEK_PERSIST
  }

  private final Kind kind;

  /** Rows of a constant, or the filters and projections to apply over the read collection. */
  private final RelNode plan;

  @Getter(lombok.AccessLevel.NONE)
  private final GlobalId collectionId;

  @Getter(lombok.AccessLevel.NONE)
  private final GlobalId indexId;

  private FastPathPlan(Kind kind, RelNode plan, GlobalId collectionId, GlobalId indexId) {
    this.kind = kind;
    this.plan = plan;
    this.collectionId = collectionId;
    this.indexId = indexId;
  }

  static FastPathPlan constant(RelNode values) {
    return new FastPathPlan(Kind.CONSTANT, values, null, null);
  }

  static FastPathPlan peekExisting(GlobalId collectionId, GlobalId indexId, RelNode plan) {
    return new FastPathPlan(Kind.PEEK_EXISTING, plan, collectionId, indexId);
  }

  static FastPathPlan peekPersist(GlobalId collectionId, RelNode plan) {
    return new FastPathPlan(Kind.PEEK_PERSIST, plan, collectionId, null);
  }

  public Optional<GlobalId> getCollectionId() {
    return Optional.ofNullable(collectionId);
  }

  public Optional<GlobalId> getIndexId() {
    return Optional.ofNullable(indexId);
  }
}
