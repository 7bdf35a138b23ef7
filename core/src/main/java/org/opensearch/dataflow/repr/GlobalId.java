/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.repr;

import com.google.common.base.Preconditions;
import java.util.Comparator;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.opensearch.dataflow.common.utils.StringUtils;

/**
 * Identifies a catalog object or a pseudo-object that only lives for the duration of a single
 * statement.
 *
 * <p>The string form is a one-letter prefix followed by the numeric value: {@code s1} (system),
 * {@code u1} (user), {@code t1} (transient). The explain pseudo-object has no value and renders as
 * {@code e}.
 */
@Getter
@EqualsAndHashCode
public final class GlobalId implements Comparable<GlobalId> {

  public enum Kind {
    SYSTEM('s'),
    USER('u'),
    TRANSIENT('t'),
    EXPLAIN('e');

    private final char prefix;

    Kind(char prefix) {
      this.prefix = prefix;
    }
  }

  public static final GlobalId EXPLAIN = new GlobalId(Kind.EXPLAIN, 0L);

  private static final Comparator<GlobalId> ORDER =
      Comparator.comparing(GlobalId::getKind).thenComparingLong(GlobalId::getValue);

  private final Kind kind;
  private final long value;

  private GlobalId(Kind kind, long value) {
    this.kind = kind;
    this.value = value;
  }

  public static GlobalId system(long value) {
    return of(Kind.SYSTEM, value);
  }

  public static GlobalId user(long value) {
    return of(Kind.USER, value);
  }

  public static GlobalId transientId(long value) {
    return of(Kind.TRANSIENT, value);
  }

  private static GlobalId of(Kind kind, long value) {
    Preconditions.checkArgument(value >= 0, "GlobalId value must not be negative: %s", value);
    return new GlobalId(kind, value);
  }

  /**
   * Parses the string form produced by {@link #toString()}.
   *
   * @param text id text such as {@code u42}
   * @return the parsed id
   * @throws IllegalArgumentException if the text is not a valid id
   */
  public static GlobalId parse(String text) {
    Preconditions.checkArgument(text != null && !text.isEmpty(), "GlobalId text is empty");
    if (text.equals("e")) {
      return EXPLAIN;
    }
    char prefix = text.charAt(0);
    for (Kind kind : Kind.values()) {
      if (kind != Kind.EXPLAIN && kind.prefix == prefix) {
        try {
          return of(kind, Long.parseLong(text.substring(1)));
        } catch (NumberFormatException e) {
          throw new IllegalArgumentException(StringUtils.format("couldn't parse id %s", text), e);
        }
      }
    }
    throw new IllegalArgumentException(StringUtils.format("couldn't parse id %s", text));
  }

  /** True for ids that name statement-local objects with no stable catalog definition. */
  public boolean isSynthetic() {
    return kind == Kind.TRANSIENT || kind == Kind.EXPLAIN;
  }

  public boolean isUser() {
    return kind == Kind.USER;
  }

  public boolean isSystem() {
    return kind == Kind.SYSTEM;
  }

  @Override
  public int compareTo(GlobalId other) {
    return ORDER.compare(this, other);
  }

  @Override
  public String toString() {
    return kind == Kind.EXPLAIN ? "e" : String.valueOf(kind.prefix) + value;
  }
}
