/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.catalog;

import com.google.common.collect.ImmutableSet;
import java.util.Set;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.opensearch.dataflow.repr.GlobalId;

/** The collections installed on one compute instance at the time a pipeline was assembled. */
@Getter
@EqualsAndHashCode
@ToString
public final class ComputeInstanceSnapshot {

  private final String instanceId;
  private final Set<GlobalId> collections;

  public ComputeInstanceSnapshot(String instanceId, Set<GlobalId> collections) {
    this.instanceId = instanceId;
    this.collections = ImmutableSet.copyOf(collections);
  }

  public boolean containsCollection(GlobalId id) {
    return collections.contains(id);
  }
}
