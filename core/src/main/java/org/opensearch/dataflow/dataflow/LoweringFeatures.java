/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.dataflow;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/** Options that influence MIR to LIR lowering. */
@Getter
@EqualsAndHashCode
@ToString
@RequiredArgsConstructor
public final class LoweringFeatures {

  /** Mark stages whose output needs consolidation after a union with a negated input. */
  private final boolean enableConsolidateAfterUnionNegate;

  /** Record column types of each stage so arrangements can be specialized. */
  private final boolean enableSpecializedArrangements;
}
