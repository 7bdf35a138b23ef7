/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.dataflow.stage;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** Describes how a stage's output reaches its consumer. */
@Getter
@EqualsAndHashCode
@ToString
public final class PartitioningScheme {

  private final ExchangeType exchangeType;

  private PartitioningScheme(ExchangeType exchangeType) {
    this.exchangeType = exchangeType;
  }

  /** Leaf output collected by the object's root stage. */
  public static PartitioningScheme gather() {
    return new PartitioningScheme(ExchangeType.GATHER);
  }

  /** Root output, which is the built object. */
  public static PartitioningScheme none() {
    return new PartitioningScheme(ExchangeType.NONE);
  }
}
