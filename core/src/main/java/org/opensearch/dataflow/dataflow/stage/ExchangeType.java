/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.dataflow.stage;

/** How rows move from one compute stage to the next. */
public enum ExchangeType {
  /** All rows flow to a single worker. */
  GATHER,

  /** No exchange. The stage output is the object itself. */
  NONE
}
