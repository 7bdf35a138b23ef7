/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataflow.optimizer;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.opensearch.dataflow.planner.PlanException;

/**
 * Options of an {@code EXPLAIN ... WITH (...)} statement. The rendering flags only affect how the
 * plan is printed; {@link #getEnableNewOuterJoinLowering()} is an optimizer override that is only
 * applied when set.
 */
@Getter
@Builder(toBuilder = true)
@EqualsAndHashCode
@ToString
public final class ExplainConfig {

  private final boolean arity;
  private final boolean joinImpls;
  private final boolean keys;
  private final boolean linearChains;
  private final boolean nonNegative;
  private final boolean rawPlans;
  private final boolean rawSyntax;
  private final boolean redacted;
  private final boolean subtreeSize;
  private final boolean timing;
  private final boolean types;

  @Getter(lombok.AccessLevel.NONE)
  private final Boolean enableNewOuterJoinLowering;

  public static ExplainConfig defaults() {
    return ExplainConfig.builder().build();
  }

  /** Override of the outer join lowering flag, if the statement names one. */
  public Optional<Boolean> getEnableNewOuterJoinLowering() {
    return Optional.ofNullable(enableNewOuterJoinLowering);
  }

  /**
   * Parses the flag names of an explain statement, case-insensitively.
   *
   * @param flags flag names
   * @return parsed options
   * @throws PlanException on an unknown flag, or when a flag is both enabled and disabled
   */
  public static ExplainConfig fromFlags(Set<String> flags) {
    ExplainConfigBuilder builder = ExplainConfig.builder();
    boolean enableOuterJoin = false;
    boolean disableOuterJoin = false;
    for (String flag : flags) {
      switch (flag.toLowerCase(Locale.ROOT)) {
        case "arity" -> builder.arity(true);
        case "join_impls" -> builder.joinImpls(true);
        case "keys" -> builder.keys(true);
        case "linear_chains" -> builder.linearChains(true);
        case "non_negative" -> builder.nonNegative(true);
        case "raw_plans" -> builder.rawPlans(true);
        case "raw_syntax" -> builder.rawSyntax(true);
        case "redacted" -> builder.redacted(true);
        case "subtree_size" -> builder.subtreeSize(true);
        case "timing" -> builder.timing(true);
        case "types" -> builder.types(true);
        case "enable_new_outer_join_lowering" -> enableOuterJoin = true;
        case "disable_new_outer_join_lowering" -> disableOuterJoin = true;
        default -> throw new PlanException("unrecognized EXPLAIN option: " + flag);
      }
    }
    if (enableOuterJoin && disableOuterJoin) {
      throw new PlanException(
          "EXPLAIN options enable_new_outer_join_lowering and disable_new_outer_join_lowering"
              + " conflict");
    }
    if (enableOuterJoin) {
      builder.enableNewOuterJoinLowering(true);
    } else if (disableOuterJoin) {
      builder.enableNewOuterJoinLowering(false);
    }
    return builder.build();
  }
}
