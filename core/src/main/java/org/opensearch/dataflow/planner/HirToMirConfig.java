/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.planner;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/** Options that influence how raw expressions are lowered. */
@Getter
@EqualsAndHashCode
@ToString
@RequiredArgsConstructor
public final class HirToMirConfig {

  private final boolean enableNewOuterJoinLowering;
}
