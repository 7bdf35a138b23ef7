/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.dataflow;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import org.opensearch.dataflow.optimizer.Transferable;
import org.opensearch.dataflow.repr.GlobalId;

/** Information gathered while optimizing a dataflow that is not part of the plan itself. */
@EqualsAndHashCode
@ToString
public final class DataflowMetainfo implements Transferable {

  private final List<String> notices = new ArrayList<>();
  private final Map<GlobalId, Set<IndexUsageType>> indexUsage = new LinkedHashMap<>();

  public void addNotice(String notice) {
    notices.add(notice);
  }

  public void recordIndexUsage(GlobalId indexId, IndexUsageType usage) {
    indexUsage.computeIfAbsent(indexId, id -> EnumSet.noneOf(IndexUsageType.class)).add(usage);
  }

  public ImmutableList<String> getNotices() {
    return ImmutableList.copyOf(notices);
  }

  public ImmutableMap<GlobalId, Set<IndexUsageType>> getIndexUsage() {
    ImmutableMap.Builder<GlobalId, Set<IndexUsageType>> builder = ImmutableMap.builder();
    indexUsage.forEach((id, usage) -> builder.put(id, EnumSet.copyOf(usage)));
    return builder.build();
  }

  public DataflowMetainfo copy() {
    DataflowMetainfo copy = new DataflowMetainfo();
    copy.notices.addAll(notices);
    indexUsage.forEach((id, usage) -> copy.indexUsage.put(id, EnumSet.copyOf(usage)));
    return copy;
  }
}
