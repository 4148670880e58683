package com.prettydoc.core.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Utility for measuring text in user-perceived characters (extended grapheme clusters).
 */
public final class Graphemes {

    private static final Pattern GRAPHEME_CLUSTER = Pattern.compile("\\X");

    private Graphemes() {
        // Utility class
    }

    /**
     * Counts the grapheme clusters in the given text.
     *
     * <p>A base character followed by combining marks, or an emoji sequence joined by
     * zero-width joiners, counts as one.
     *
     * @param text text to measure
     * @return number of grapheme clusters
     */
    public static int count(String text) {
        Objects.requireNonNull(text, "text must not be null");
        if (text.isEmpty()) {
            return 0;
        }

        Matcher matcher = GRAPHEME_CLUSTER.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    /**
     * Splits text into its grapheme clusters.
     *
     * @param text text to split
     * @return clusters in order, one per display column
     */
    public static List<String> split(String text) {
        Objects.requireNonNull(text, "text must not be null");

        List<String> clusters = new ArrayList<>();
        Matcher matcher = GRAPHEME_CLUSTER.matcher(text);
        while (matcher.find()) {
            clusters.add(matcher.group());
        }
        return clusters;
    }
}
