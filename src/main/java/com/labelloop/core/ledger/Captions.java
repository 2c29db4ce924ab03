package com.labelloop.core.ledger;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Caption comparison helpers.
 */
public final class Captions {

    private Captions() {}

    /** Trimmed, lower-cased, with runs of whitespace collapsed to one space. */
    public static String normalize(String caption) {
        if (caption == null) {
            return "";
        }
        return caption.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    public static boolean sameCaption(String a, String b) {
        return normalize(a).equals(normalize(b));
    }

    /**
     * Jaccard overlap of the two captions' word sets, in [0, 1]. Two empty captions score 0.
     */
    public static double tokenOverlap(String a, String b) {
        Set<String> left = tokens(a);
        Set<String> right = tokens(b);
        if (left.isEmpty() && right.isEmpty()) {
            return 0.0;
        }
        var union = new HashSet<>(left);
        union.addAll(right);
        var intersection = new HashSet<>(left);
        intersection.retainAll(right);
        return (double) intersection.size() / union.size();
    }

    private static Set<String> tokens(String caption) {
        String normalized = normalize(caption);
        if (normalized.isEmpty()) {
            return Set.of();
        }
        return Arrays.stream(normalized.split(" ")).collect(Collectors.toSet());
    }
}
