/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.expr;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Optional;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.opensearch.dataflow.optimizer.Transferable;

/** Ordering, offset and limit applied to a peek result after the dataflow produced it. */
@Getter
@EqualsAndHashCode
@ToString
public final class RowSetFinishing implements Transferable {

  private final List<Integer> orderBy;
  private final Long limit;
  private final long offset;

  public RowSetFinishing(List<Integer> orderBy, Long limit, long offset) {
    Preconditions.checkArgument(limit == null || limit >= 0, "limit must not be negative");
    Preconditions.checkArgument(offset >= 0, "offset must not be negative");
    this.orderBy = ImmutableList.copyOf(orderBy);
    this.limit = limit;
    this.offset = offset;
  }

  /** No ordering, no limit, no offset. */
  public static RowSetFinishing trivial() {
    return new RowSetFinishing(ImmutableList.of(), null, 0L);
  }

  public Optional<Long> limit() {
    return Optional.ofNullable(limit);
  }

  public boolean isTrivial() {
    return orderBy.isEmpty() && limit == null && offset == 0;
  }
}
