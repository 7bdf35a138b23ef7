/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.optimizer;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.opensearch.dataflow.common.response.ResponseListener;

/**
 * Runs optimization stages on a dedicated worker so the caller's thread is never blocked by
 * planning. Results and failures are delivered to a {@link ResponseListener} on the worker thread.
 */
@Log4j2
@RequiredArgsConstructor
public class OffThreadOptimizer implements AutoCloseable {

  private final ExecutorService executor;

  /** Creates an optimizer backed by a single daemon thread named after {@code name}. */
  public static OffThreadOptimizer create(String name) {
    return new OffThreadOptimizer(
        Executors.newSingleThreadExecutor(
            new ThreadFactoryBuilder().setNameFormat(name + "-%d").setDaemon(true).build()));
  }

  /**
   * Schedules {@code stage} on the worker.
   *
   * @param stage stage to run; consumed by the call
   * @param plan stage input
   * @param listener receives the stage output, or any exception the stage raised. An {@link
   *     Error} is delivered wrapped in an {@link ExecutionException}.
   * @return handle that completes once the listener has been called, and fails if the listener
   *     throws
   */
  public <F extends Transferable, T extends Transferable> Future<?> submit(
      Optimize<F, T> stage, F plan, ResponseListener<T> listener) {
    return executor.submit(
        () -> {
          T result;
          try {
            result = stage.optimize(plan);
          } catch (Exception e) {
            log.warn("Off-thread optimization failed: {}", e.getMessage());
            listener.onFailure(e);
            return;
          } catch (Error e) {
            log.error("Off-thread optimization raised an error", e);
            listener.onFailure(new ExecutionException(e));
            return;
          }
          try {
            listener.onResponse(result);
          } catch (RuntimeException e) {
            log.error("Listener failed to handle the optimization result", e);
            throw e;
          }
        });
  }

  @Override
  public void close() {
    executor.shutdown();
  }
}
