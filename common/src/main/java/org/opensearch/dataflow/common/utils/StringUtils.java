/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.common.utils;

import java.util.Locale;
import lombok.experimental.UtilityClass;

@UtilityClass
public class StringUtils {

  /**
   * Format a message with {@link Locale#ROOT} so output does not depend on the JVM locale.
   *
   * @param format format string
   * @param args arguments
   * @return formatted message
   */
  public static String format(final String format, Object... args) {
    return String.format(Locale.ROOT, format, args);
  }

  /**
   * Returns true if the string is null or contains only whitespace.
   */
  public static boolean isBlank(String value) {
    return value == null || value.trim().isEmpty();
  }
}
