/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.optimizer;

/** Whether the pipeline output will be executed or only explained. */
public enum OptimizeMode {
  EXECUTE,
  EXPLAIN
}
