package com.mk.fx.qa.stress.execution.model;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/** Order in which a core cycles through its workloads. */
public enum SchedulingPolicy {
  /** Every cycle of workload i before workload i+1. */
  SEQUENTIAL("seq", "sequential", "1"),
  /** One cycle of every remaining workload per round. */
  ROUND_ROBIN("round", "rr", "round_robin", "2"),
  /** Uniform pick among workloads with cycles left. */
  RANDOM("rand", "random", "3");

  private final List<String> aliases;

  SchedulingPolicy(String... aliases) {
    this.aliases = List.of(aliases);
  }

  /**
   * Resolves a policy from its name or one of its short aliases, case-insensitively. A blank value
   * selects {@link #SEQUENTIAL}.
   *
   * @throws IllegalArgumentException if the value matches no policy
   */
  public static SchedulingPolicy fromValue(String value) {
    if (value == null || value.isBlank()) {
      return SEQUENTIAL;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
    return Arrays.stream(values())
        .filter(p -> p.name().equalsIgnoreCase(normalized) || p.aliases.contains(normalized))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unsupported scheduling mode: " + value));
  }
}
