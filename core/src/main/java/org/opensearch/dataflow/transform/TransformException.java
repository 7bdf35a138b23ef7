/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.transform;

import org.opensearch.dataflow.exception.QueryEngineException;

/** Error raised by a rewrite or lowering transformation. */
public class TransformException extends QueryEngineException {

  public TransformException(String message) {
    super(message);
  }

  public TransformException(String message, Throwable cause) {
    super(message, cause);
  }
}
