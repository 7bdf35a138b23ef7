/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.optimizer;

import com.google.common.base.VerifyException;

/**
 * One step of an optimization pipeline: consumes a plan of type {@code F} and produces a plan of
 * type {@code T}. Each pipeline exposes one stage object per adjacent pair of IR levels, so a
 * stage can only be fed the output of the step before it.
 *
 * <p>Stage objects are single-use. Invoking {@link #optimize} or {@link #mustOptimize} a second
 * time on the same instance raises {@link IllegalStateException}.
 *
 * @param <F> input plan
 * @param <T> output plan
 */
public interface Optimize<F extends Transferable, T extends Transferable> extends Transferable {

  /**
   * Runs the transformation.
   *
   * @param plan input plan
   * @return the transformed plan
   * @throws OptimizerException if any collaborator fails or an optimizer invariant is violated
   */
  T optimize(F plan);

  /**
   * Runs the transformation at a call site where success has already been established. A failure
   * here is a programming error and surfaces as {@link VerifyException}.
   *
   * @param plan input plan
   * @return the transformed plan
   */
  default T mustOptimize(F plan) {
    try {
      return optimize(plan);
    } catch (OptimizerException e) {
      throw new VerifyException("mustOptimize call failed: " + e.getMessage(), e);
    }
  }
}
