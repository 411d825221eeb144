package com.raditha.competitors.review;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads a 1-10 rating out of a free-text answer.
 * The first standalone number from 1 to 10 wins; otherwise the wording decides,
 * and an answer with neither gets the neutral 5.
 */
public final class ScoreExtractor {

    public static final double NEUTRAL = 5.0;

    private static final Pattern RATING = Pattern.compile("\\b([1-9]|10)\\b");

    private ScoreExtractor() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static double extract(String text) {
        if (text == null || text.isBlank()) {
            return NEUTRAL;
        }
        Matcher matcher = RATING.matcher(text);
        if (matcher.find()) {
            return Double.parseDouble(matcher.group(1));
        }

        String lower = text.toLowerCase(Locale.ROOT);
        if (containsAny(lower, "excellent", "perfect", "nine")) {
            return 9.0;
        } else if (containsAny(lower, "very good", "great", "eight")) {
            return 8.0;
        } else if (containsAny(lower, "good", "seven")) {
            return 7.0;
        } else if (containsAny(lower, "fair", "moderate", "six", "five")) {
            return 6.0;
        } else if (containsAny(lower, "weak", "poor", "four", "three")) {
            return 4.0;
        } else if (containsAny(lower, "bad", "terrible", "two", "one")) {
            return 2.0;
        }
        return NEUTRAL;
    }

    private static boolean containsAny(String text, String... words) {
        for (String word : words) {
            if (text.contains(word)) {
                return true;
            }
        }
        return false;
    }
}
