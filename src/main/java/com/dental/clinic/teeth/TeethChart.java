package com.dental.clinic.teeth;

import org.apache.commons.lang3.StringUtils;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Teeth selection as stored on a patient: a set of tooth ids such as {@code UL3} kept as one
 * comma separated string. All operations are pure and return new sets.
 */
public final class TeethChart {

    public static final String SEPARATOR = ", ";

    private static final Pattern TOOTH_ID = Pattern.compile("^(UL|UR|LL|LR)[1-8]$");

    private TeethChart() {
    }

    /**
     * Splits on commas, trims, and drops empty tokens. Token shape is not checked.
     */
    public static SortedSet<String> parse(String serialized) {
        SortedSet<String> teeth = new TreeSet<>();
        if (StringUtils.isBlank(serialized)) {
            return Collections.unmodifiableSortedSet(teeth);
        }
        for (String token : serialized.split(",")) {
            String trimmed = token.trim();
            if (!trimmed.isEmpty()) {
                teeth.add(trimmed);
            }
        }
        return Collections.unmodifiableSortedSet(teeth);
    }

    public static SortedSet<String> toggle(Collection<String> selection, String toothId) {
        SortedSet<String> next = new TreeSet<>(selection);
        if (!next.remove(toothId)) {
            next.add(toothId);
        }
        return Collections.unmodifiableSortedSet(next);
    }

    public static String serialize(Collection<String> selection) {
        return new TreeSet<>(selection).stream().collect(Collectors.joining(SEPARATOR));
    }

    public static boolean isToothId(String token) {
        return token != null && TOOTH_ID.matcher(token).matches();
    }

    /** Tokens that a chart could never have produced, in sorted order. */
    public static List<String> unrecognized(Collection<String> selection) {
        return selection.stream()
                .filter(t -> !isToothId(t))
                .sorted()
                .collect(Collectors.toList());
    }
}
