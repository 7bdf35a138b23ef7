/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.optimizer;

/**
 * Marker for types that may be handed from the caller's thread to an optimization worker.
 *
 * <p>Implementations hold no thread-affine resources (open connections, thread locals, locks held
 * across calls) and are not mutated by the caller once handed off. Optimization stages, their
 * inputs and their outputs are all bound to this type so that a whole pipeline can be dispatched
 * through {@link OffThreadOptimizer}.
 */
public interface Transferable {
}
