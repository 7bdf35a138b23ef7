/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.optimizer.subscribe;

import java.util.Optional;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import org.opensearch.dataflow.expr.MirRelationExpr;
import org.opensearch.dataflow.optimizer.Transferable;
import org.opensearch.dataflow.repr.GlobalId;

/** What a subscription reads: an existing catalog object, or an ad hoc query. */
@EqualsAndHashCode
@ToString
public final class SubscribeFrom implements Transferable {

  private final GlobalId id;
  private final MirRelationExpr query;

  private SubscribeFrom(GlobalId id, MirRelationExpr query) {
    this.id = id;
    this.query = query;
  }

  public static SubscribeFrom ofId(GlobalId id) {
    return new SubscribeFrom(id, null);
  }

  public static SubscribeFrom ofQuery(MirRelationExpr query) {
    return new SubscribeFrom(null, query);
  }

  public Optional<GlobalId> getId() {
    return Optional.ofNullable(id);
  }

  public Optional<MirRelationExpr> getQuery() {
    return Optional.ofNullable(query);
  }
}
