/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.optimizer.peek;

import java.util.Optional;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import org.opensearch.dataflow.optimizer.Transferable;

/** The time a peek reads at, as decided by timestamp selection. */
@EqualsAndHashCode
@ToString
public final class TimestampContext implements Transferable {

  private static final TimestampContext NO_TIMESTAMP = new TimestampContext(null);

  private final Long timestamp;

  private TimestampContext(Long timestamp) {
    this.timestamp = timestamp;
  }

  /** Read at {@code timestamp} on the statement's timeline. */
  public static TimestampContext timeline(long timestamp) {
    return new TimestampContext(timestamp);
  }

  /** The peek reads no collection, so no timestamp is needed. */
  public static TimestampContext noTimestamp() {
    return NO_TIMESTAMP;
  }

  public Optional<Long> getTimestamp() {
    return Optional.ofNullable(timestamp);
  }
}
