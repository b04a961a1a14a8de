package com.mk.fx.qa.stress.execution.utils;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public final class StressUtils {

    private static final Pattern SEPARATORS = Pattern.compile("[,\\s]+");

    private StressUtils() {
        // Utility class, no instantiation
    }

    public static int availableCores() {
        return Runtime.getRuntime().availableProcessors();
    }

    /**
     * Parses a core selection: {@code all}, {@code even}, {@code odd}, or a comma/space separated
     * list of indices and inclusive ranges such as {@code 0-3,6,8-10}. Reversed ranges are
     * accepted, indices outside {@code [0, processorCount)} and unparsable tokens are dropped.
     *
     * @return distinct indices in ascending order, empty when nothing usable was given
     */
    public static List<Integer> parseCoreIndices(String input, int processorCount) {
        if (input == null || input.isBlank()) {
            return List.of();
        }
        String normalized = input.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "all":
                return stepped(0, processorCount, 1);
            case "even":
                return stepped(0, processorCount, 2);
            case "odd":
                return stepped(1, processorCount, 2);
            default:
                break;
        }

        TreeSet<Integer> cores = new TreeSet<>();
        for (String token : SEPARATORS.split(normalized)) {
            if (token.isEmpty()) {
                continue;
            }
            try {
                int dash = token.indexOf('-', 1);
                if (dash > 0) {
                    int a = Integer.parseInt(token.substring(0, dash));
                    int b = Integer.parseInt(token.substring(dash + 1));
                    int from = Math.max(0, Math.min(a, b));
                    int to = Math.min(processorCount - 1, Math.max(a, b));
                    for (int i = from; i <= to; i++) {
                        cores.add(i);
                    }
                } else {
                    addIfInRange(cores, Integer.parseInt(token), processorCount);
                }
            } catch (NumberFormatException e) {
                log.warn("Ignoring unparsable core token '{}'", token);
            }
        }
        return List.copyOf(cores);
    }

    /**
     * Parses cycle counts, one per workload, e.g. {@code "100, 200, 0"}. Negative or unparsable
     * tokens are skipped with a warning.
     */
    public static int[] parseCycles(String input) {
        if (input == null || input.isBlank()) {
            return new int[0];
        }
        List<Integer> cycles = new ArrayList<>();
        for (String token : SEPARATORS.split(input.trim())) {
            if (token.isEmpty()) {
                continue;
            }
            try {
                int value = Integer.parseInt(token);
                if (value >= 0) {
                    cycles.add(value);
                } else {
                    log.warn("Ignoring negative cycle count {}", value);
                }
            } catch (NumberFormatException e) {
                log.warn("Ignoring unparsable cycle count '{}'", token);
            }
        }
        return cycles.stream().mapToInt(Integer::intValue).toArray();
    }

    private static List<Integer> stepped(int from, int toExclusive, int step) {
        List<Integer> cores = new ArrayList<>();
        for (int i = from; i < toExclusive; i += step) {
            cores.add(i);
        }
        return List.copyOf(cores);
    }

    private static void addIfInRange(TreeSet<Integer> cores, int index, int processorCount) {
        if (index >= 0 && index < processorCount) {
            cores.add(index);
        }
    }
}
