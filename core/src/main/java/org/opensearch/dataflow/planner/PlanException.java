/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.planner;

import org.opensearch.dataflow.exception.QueryEngineException;

/** Error raised while turning a statement into a relational plan. */
public class PlanException extends QueryEngineException {

  public PlanException(String message) {
    super(message);
  }

  public PlanException(String message, Throwable cause) {
    super(message, cause);
  }
}
