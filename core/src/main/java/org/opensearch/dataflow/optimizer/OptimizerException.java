/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.optimizer;

import lombok.Getter;
import org.opensearch.dataflow.exception.AdapterException;
import org.opensearch.dataflow.exception.QueryEngineException;
import org.opensearch.dataflow.planner.PlanException;
import org.opensearch.dataflow.transform.TransformException;

/**
 * The single failure type of every optimization stage. Failures of the collaborators keep their
 * message and travel as the cause; optimizer invariant violations are reported as {@link
 * Kind#INTERNAL}.
 */
public class OptimizerException extends QueryEngineException {

  public enum Kind {
    ADAPTER,
    PLAN,
    TRANSFORM,
    INTERNAL
  }

  @Getter private final Kind kind;

  public OptimizerException(AdapterException cause) {
    super(cause.getMessage(), cause);
    this.kind = Kind.ADAPTER;
  }

  public OptimizerException(PlanException cause) {
    super(cause.getMessage(), cause);
    this.kind = Kind.PLAN;
  }

  public OptimizerException(TransformException cause) {
    super(cause.getMessage(), cause);
    this.kind = Kind.TRANSFORM;
  }

  private OptimizerException(String message) {
    super(message);
    this.kind = Kind.INTERNAL;
  }

  public static OptimizerException internal(String message) {
    return new OptimizerException("internal optimizer error: " + message);
  }

  /**
   * Converts back into the session layer's error type. Adapter failures come back as the exact
   * instance that was wrapped.
   */
  public AdapterException toAdapterException() {
    if (kind == Kind.ADAPTER) {
      return (AdapterException) getCause();
    }
    return AdapterException.internal(getMessage());
  }
}
