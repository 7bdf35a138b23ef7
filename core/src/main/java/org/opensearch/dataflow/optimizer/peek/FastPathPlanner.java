/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.optimizer.peek;

import com.google.common.math.LongMath;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.apache.calcite.rel.RelNode;
import org.apache.calcite.rel.core.TableScan;
import org.opensearch.dataflow.dataflow.DataflowDescription;
import org.opensearch.dataflow.dataflow.DataflowMetainfo;
import org.opensearch.dataflow.dataflow.IndexUsageType;
import org.opensearch.dataflow.expr.OptimizedMirRelationExpr;
import org.opensearch.dataflow.expr.RelationExprs;
import org.opensearch.dataflow.expr.RowSetFinishing;
import org.opensearch.dataflow.repr.GlobalId;

/** Decides whether a peek can skip building a dataflow. */
@Log4j2
@RequiredArgsConstructor
class FastPathPlanner {

  private final int persistFastPathLimit;

  Optional<FastPathPlan> plan(
      DataflowDescription<OptimizedMirRelationExpr> dataflow,
      RowSetFinishing finishing,
      DataflowMetainfo metainfo) {
    List<DataflowDescription.BuildDesc<OptimizedMirRelationExpr>> objects =
        dataflow.getObjectsToBuild();
    if (objects.size() != 1) {
      return Optional.empty();
    }
    RelNode root = objects.get(0).getPlan().getRoot();

    if (RelationExprs.isConstant(root)) {
      log.debug("Peek of {} is a constant", dataflow.getDebugName());
      return Optional.of(FastPathPlan.constant(root));
    }

    Optional<TableScan> read = RelationExprs.plainRead(root);
    if (read.isEmpty()) {
      return Optional.empty();
    }
    GlobalId collectionId = RelationExprs.scannedId(read.get());

    List<GlobalId> indexes = dataflow.indexImportsOn(collectionId);
    if (!indexes.isEmpty()) {
      GlobalId indexId = indexes.get(0);
      metainfo.recordIndexUsage(indexId, IndexUsageType.PEEK);
      log.debug("Peek of {} reads existing index {}", dataflow.getDebugName(), indexId);
      return Optional.of(FastPathPlan.peekExisting(collectionId, indexId, root));
    }

    if (dataflow.getSourceImports().contains(collectionId)
        && finishing.getOrderBy().isEmpty()
        && finishing.limit().isPresent()
        && LongMath.saturatedAdd(finishing.limit().get(), finishing.getOffset())
            < persistFastPathLimit) {
      log.debug("Peek of {} reads {} from storage", dataflow.getDebugName(), collectionId);
      return Optional.of(FastPathPlan.peekPersist(collectionId, root));
    }
    return Optional.empty();
  }
}
