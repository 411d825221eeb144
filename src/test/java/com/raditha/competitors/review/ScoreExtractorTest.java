package com.raditha.competitors.review;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ScoreExtractorTest {

    @Test
    void testFirstStandaloneNumberWins() {
        assertEquals(8.0, ScoreExtractor.extract("Rating: 8/10. The companies share customers."));
        assertEquals(10.0, ScoreExtractor.extract("10 - direct competitors"));
    }

    @Test
    void testOutOfRangeNumbersIgnored() {
        assertEquals(7.0, ScoreExtractor.extract("Across 25 companies I would give 7"));
    }

    @Test
    void testKeywordFallback() {
        assertEquals(9.0, ScoreExtractor.extract("An excellent grouping"));
        assertEquals(8.0, ScoreExtractor.extract("Very good overlap"));
        assertEquals(7.0, ScoreExtractor.extract("A good cluster"));
        assertEquals(6.0, ScoreExtractor.extract("Moderate overlap"));
        assertEquals(4.0, ScoreExtractor.extract("Weak relationship"));
        assertEquals(2.0, ScoreExtractor.extract("Terrible"));
    }

    @Test
    void testNeutralWhenNothingMatches() {
        assertEquals(ScoreExtractor.NEUTRAL, ScoreExtractor.extract("Hard to say."));
        assertEquals(ScoreExtractor.NEUTRAL, ScoreExtractor.extract(""));
        assertEquals(ScoreExtractor.NEUTRAL, ScoreExtractor.extract(null));
    }
}
