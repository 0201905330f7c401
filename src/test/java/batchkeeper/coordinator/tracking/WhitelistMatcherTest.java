package batchkeeper.coordinator.tracking;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class WhitelistMatcherTest {

    private static final String LINE = "FutureWarning: x is deprecated";

    @Test
    void singleSharedWordIsBelowThreshold() {
        WhitelistMatcher matcher = new WhitelistMatcher(List.of("FutureWarning"), 3, false);

        assertFalse(matcher.matches(LINE));
    }

    @Test
    void enoughSharedWordsWhitelistTheLine() {
        WhitelistMatcher matcher = new WhitelistMatcher(List.of("FutureWarning x is deprecated"), 3, false);

        assertTrue(matcher.matches(LINE));
    }

    @Test
    void toleratesCosmeticVariation() {
        WhitelistMatcher matcher = new WhitelistMatcher(
                List.of("UserWarning: numpy 1.24 deprecated API"), 3, false);

        assertTrue(matcher.matches("userwarning (numpy 1.26): deprecated API call in solver.py:88"));
        assertFalse(matcher.matches("ERROR: solver diverged"));
    }

    @Test
    void anyEntryMaySuppress() {
        WhitelistMatcher matcher = new WhitelistMatcher(
                List.of("libibverbs could not find device", "FutureWarning x is deprecated"), 3, false);

        assertTrue(matcher.matches("libibverbs: Warning: couldn't load driver, could not find any device"));
        assertTrue(matcher.matches(LINE));
    }

    @Test
    void caseSensitiveComparison() {
        WhitelistMatcher matcher = new WhitelistMatcher(List.of("futurewarning x is deprecated"), 3, true);

        assertFalse(matcher.matches("FutureWarning: X Is deprecated"));
        assertTrue(matcher.matches("futurewarning: x is deprecated"));
    }

    @Test
    void emptyWhitelistMatchesNothing() {
        WhitelistMatcher matcher = new WhitelistMatcher(List.of("", "  "), 1, false);

        assertFalse(matcher.matches(LINE));
    }

    @Test
    void thresholdMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new WhitelistMatcher(List.of(), 0, false));
    }

    @Test
    void wordsAreDistinctAndLowerCased() {
        assertEquals(Set.of("error", "at", "step_3", "again"),
                WhitelistMatcher.words("ERROR at step_3... error again!", false));
    }
}
