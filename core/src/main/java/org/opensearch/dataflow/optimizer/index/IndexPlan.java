/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.optimizer.index;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.opensearch.dataflow.optimizer.Transferable;
import org.opensearch.dataflow.repr.GlobalId;

/** A {@code CREATE INDEX} statement: the object to index and the key columns. */
@Getter
@EqualsAndHashCode
@ToString
public final class IndexPlan implements Transferable {

  private final String name;
  private final GlobalId on;
  private final List<Integer> keys;

  public IndexPlan(String name, GlobalId on, List<Integer> keys) {
    this.name = name;
    this.on = on;
    this.keys = ImmutableList.copyOf(keys);
  }
}
