/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.optimizer;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;
import org.opensearch.dataflow.exception.AdapterException;
import org.opensearch.dataflow.planner.PlanException;
import org.opensearch.dataflow.transform.TransformException;

/**
 * Base class of all pipeline stages. Enforces single use, wraps collaborator failures into {@link
 * OptimizerException} and records the elapsed time of the stage on the pipeline's timer.
 *
 * @param <F> input plan
 * @param <T> output plan
 */
@Log4j2
public abstract class OptimizeStage<F extends Transferable, T extends Transferable>
    implements Optimize<F, T> {

  @Getter private final String name;
  private final OptimizerTimer timer;
  private final OnceGuard guard;

  protected OptimizeStage(String name, OptimizerTimer timer) {
    this.name = name;
    this.timer = timer;
    this.guard = new OnceGuard("optimizer stage " + name);
  }

  @Override
  public final T optimize(F plan) {
    Preconditions.checkNotNull(plan, "input plan of stage %s", name);
    guard.consume();
    log.debug("Running optimizer stage {}", name);
    Stopwatch stopwatch = Stopwatch.createStarted();
    try {
      T result = doOptimize(plan);
      log.debug("Optimizer stage {} finished in {}", name, stopwatch);
      return result;
    } catch (OptimizerException e) {
      log.warn("Optimizer stage {} failed: {}", name, e.getMessage());
      throw e;
    } catch (AdapterException e) {
      log.warn("Optimizer stage {} failed on catalog access: {}", name, e.getMessage());
      throw new OptimizerException(e);
    } catch (PlanException e) {
      log.warn("Optimizer stage {} failed during planning: {}", name, e.getMessage());
      throw new OptimizerException(e);
    } catch (TransformException e) {
      log.warn("Optimizer stage {} failed during transformation: {}", name, e.getMessage());
      throw new OptimizerException(e);
    } finally {
      timer.record(name, stopwatch.elapsed());
    }
  }

  /** Performs the transformation. Collaborator exceptions may propagate unwrapped. */
  protected abstract T doOptimize(F plan);
}
