/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.exception;

import lombok.Getter;
import org.opensearch.dataflow.common.utils.StringUtils;

/**
 * Top-level error of the session/catalog layer. Errors raised by the optimizer are converted back
 * into this type before they are reported to a client.
 */
public class AdapterException extends QueryEngineException {

  public enum Kind {
    UNKNOWN_ITEM,
    INVALID_OBJECT,
    INTERNAL
  }

  @Getter private final Kind kind;

  public AdapterException(Kind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public static AdapterException unknownItem(String name) {
    return new AdapterException(
        Kind.UNKNOWN_ITEM, StringUtils.format("unknown catalog item '%s'", name));
  }

  public static AdapterException invalidObject(String message) {
    return new AdapterException(Kind.INVALID_OBJECT, message);
  }

  public static AdapterException internal(String message) {
    return new AdapterException(Kind.INTERNAL, "internal error: " + message);
  }
}
