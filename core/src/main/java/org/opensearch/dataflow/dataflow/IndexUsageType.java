/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.dataflow;

/** How a dataflow uses one of its imported indexes. */
public enum IndexUsageType {
  /** The whole index is read. */
  FULL_SCAN,

  /** A peek is answered directly from the existing index. */
  PEEK
}
