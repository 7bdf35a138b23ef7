/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.dataflow;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Function;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import org.opensearch.dataflow.common.utils.StringUtils;
import org.opensearch.dataflow.optimizer.Transferable;
import org.opensearch.dataflow.repr.GlobalId;

/**
 * Everything needed to install one dataflow: what it imports, which objects it builds and in what
 * order, and what it exports. The plan type changes as the dataflow moves down the IR levels; the
 * set of imported, built and exported ids does not.
 *
 * @param <P> plan type of the objects to build
 */
@EqualsAndHashCode
@ToString
public final class DataflowDescription<P> implements Transferable {

  /** An imported index: the indexed object and its key columns. */
  @Getter
  @EqualsAndHashCode
  @ToString
  @RequiredArgsConstructor
  public static final class IndexImport {
    private final GlobalId onId;
    private final List<Integer> keys;
  }

  /** An exported index. */
  @Getter
  @EqualsAndHashCode
  @ToString
  @RequiredArgsConstructor
  public static final class IndexDesc {
    private final GlobalId onId;
    private final List<Integer> keys;
  }

  /** One object built inside the dataflow. */
  @Getter
  @EqualsAndHashCode
  @ToString
  @RequiredArgsConstructor
  public static final class BuildDesc<P> {
    private final GlobalId id;
    private final P plan;
  }

  public enum SinkConnection {
    MATERIALIZED_VIEW,
    SUBSCRIBE
  }

  /** An exported sink that writes the contents of {@code fromId} somewhere outside the dataflow. */
  @Getter
  @EqualsAndHashCode
  @ToString
  public static final class SinkDesc {
    private final GlobalId fromId;
    private final SinkConnection connection;
    private final boolean withSnapshot;
    private final Long upTo;
    private final List<Integer> nonNullAssertions;

    public SinkDesc(
        GlobalId fromId,
        SinkConnection connection,
        boolean withSnapshot,
        Long upTo,
        List<Integer> nonNullAssertions) {
      this.fromId = fromId;
      this.connection = connection;
      this.withSnapshot = withSnapshot;
      this.upTo = upTo;
      this.nonNullAssertions = ImmutableList.copyOf(nonNullAssertions);
    }

    public Optional<Long> upTo() {
      return Optional.ofNullable(upTo);
    }

    public SinkDesc withUpTo(Long upTo) {
      return new SinkDesc(fromId, connection, withSnapshot, upTo, nonNullAssertions);
    }
  }

  @Getter private final String debugName;
  private final Set<GlobalId> sourceImports = new LinkedHashSet<>();
  private final Map<GlobalId, IndexImport> indexImports = new LinkedHashMap<>();
  private final List<BuildDesc<P>> objectsToBuild = new ArrayList<>();
  private final Map<GlobalId, IndexDesc> indexExports = new LinkedHashMap<>();
  private final Map<GlobalId, SinkDesc> sinkExports = new LinkedHashMap<>();
  private Long asOf;
  private Long until;

  public DataflowDescription(String debugName) {
    this.debugName = debugName;
  }

  public void importSource(GlobalId id) {
    sourceImports.add(id);
  }

  public void importIndex(GlobalId indexId, IndexImport desc) {
    indexImports.put(indexId, desc);
  }

  /** Appends an object to build. Objects must be inserted after the objects they depend on. */
  public void insertPlan(GlobalId id, P plan) {
    Preconditions.checkArgument(
        !isBuilt(id),
        StringUtils.format("object %s is already built by dataflow %s", id, debugName));
    objectsToBuild.add(new BuildDesc<>(id, plan));
  }

  /** Replaces the plan of an object that is already being built, keeping its position. */
  public void replacePlan(GlobalId id, P plan) {
    for (int i = 0; i < objectsToBuild.size(); i++) {
      if (objectsToBuild.get(i).getId().equals(id)) {
        objectsToBuild.set(i, new BuildDesc<>(id, plan));
        return;
      }
    }
    throw new IllegalArgumentException(
        StringUtils.format("object %s is not built by dataflow %s", id, debugName));
  }

  public void exportIndex(GlobalId indexId, IndexDesc desc) {
    indexExports.put(indexId, desc);
  }

  public void exportSink(GlobalId sinkId, SinkDesc desc) {
    sinkExports.put(sinkId, desc);
  }

  public void setAsOf(Long asOf) {
    this.asOf = asOf;
  }

  public void setUntil(Long until) {
    this.until = until;
  }

  public Optional<Long> getAsOf() {
    return Optional.ofNullable(asOf);
  }

  public Optional<Long> getUntil() {
    return Optional.ofNullable(until);
  }

  public ImmutableSet<GlobalId> getSourceImports() {
    return ImmutableSet.copyOf(sourceImports);
  }

  public ImmutableMap<GlobalId, IndexImport> getIndexImports() {
    return ImmutableMap.copyOf(indexImports);
  }

  public ImmutableList<BuildDesc<P>> getObjectsToBuild() {
    return ImmutableList.copyOf(objectsToBuild);
  }

  public ImmutableMap<GlobalId, IndexDesc> getIndexExports() {
    return ImmutableMap.copyOf(indexExports);
  }

  public ImmutableMap<GlobalId, SinkDesc> getSinkExports() {
    return ImmutableMap.copyOf(sinkExports);
  }

  /** True if {@code id} is already available to the dataflow, imported or built. */
  public boolean isImported(GlobalId id) {
    return sourceImports.contains(id)
        || isBuilt(id)
        || indexImports.values().stream().anyMatch(index -> index.getOnId().equals(id));
  }

  private boolean isBuilt(GlobalId id) {
    return objectsToBuild.stream().anyMatch(build -> build.getId().equals(id));
  }

  /** Index imports whose indexed object is {@code onId}. */
  public ImmutableList<GlobalId> indexImportsOn(GlobalId onId) {
    return indexImports.entrySet().stream()
        .filter(entry -> entry.getValue().getOnId().equals(onId))
        .map(Map.Entry::getKey)
        .collect(ImmutableList.toImmutableList());
  }

  /** Ids of the exported indexes and sinks. */
  public ImmutableSet<GlobalId> exportIds() {
    return ImmutableSet.<GlobalId>builder()
        .addAll(indexExports.keySet())
        .addAll(sinkExports.keySet())
        .build();
  }

  /** Ids of the built objects, in build order. */
  public ImmutableList<GlobalId> objectIds() {
    return objectsToBuild.stream().map(BuildDesc::getId).collect(ImmutableList.toImmutableList());
  }

  /** Same dataflow with every plan converted by {@code fn}, in build order. */
  public <Q> DataflowDescription<Q> mapPlans(Function<? super P, ? extends Q> fn) {
    return mapBuilds((id, plan) -> fn.apply(plan));
  }

  /** Same dataflow with every plan converted by {@code fn}, which also sees the object id. */
  public <Q> DataflowDescription<Q> mapBuilds(BiFunction<GlobalId, ? super P, ? extends Q> fn) {
    DataflowDescription<Q> mapped = new DataflowDescription<>(debugName);
    copyFrameInto(mapped);
    for (BuildDesc<P> build : objectsToBuild) {
      mapped.objectsToBuild.add(
          new BuildDesc<>(build.getId(), fn.apply(build.getId(), build.getPlan())));
    }
    return mapped;
  }

  /** Shallow copy: plans are shared, containers are not. */
  public DataflowDescription<P> copy() {
    DataflowDescription<P> copy = new DataflowDescription<>(debugName);
    copyFrameInto(copy);
    copy.objectsToBuild.addAll(objectsToBuild);
    return copy;
  }

  private void copyFrameInto(DataflowDescription<?> target) {
    target.sourceImports.addAll(sourceImports);
    target.indexImports.putAll(indexImports);
    target.indexExports.putAll(indexExports);
    target.sinkExports.putAll(sinkExports);
    target.asOf = asOf;
    target.until = until;
  }
}
