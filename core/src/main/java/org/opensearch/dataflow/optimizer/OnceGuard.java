/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.optimizer;

import java.util.concurrent.atomic.AtomicBoolean;

/** Trips on first use; any later use is rejected. */
public final class OnceGuard {

  private final String what;
  private final AtomicBoolean consumed = new AtomicBoolean(false);

  public OnceGuard(String what) {
    this.what = what;
  }

  /**
   * Marks the guarded value as consumed.
   *
   * @throws IllegalStateException if it already was
   */
  public void consume() {
    if (!consumed.compareAndSet(false, true)) {
      throw new IllegalStateException(what + " has already been consumed");
    }
  }

  public boolean isConsumed() {
    return consumed.get();
  }
}
