package net.grammex.api.match;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MatchResultTest {

    @Test
    void shouldRewindFailedResultsToStart() {
        MatchResult r = MatchResult.of(false, 7, 3);
        assertFalse(r.isMatched());
        assertEquals(3, r.getPosition());
        assertEquals(3, r.getStart());
        assertEquals(0, r.length());
    }

    @Test
    void shouldKeepSpanOfSuccessfulResults() {
        MatchResult r = MatchResult.of(true, 7, 3);
        assertTrue(r.isMatched());
        assertEquals(7, r.getPosition());
        assertEquals(3, r.getStart());
        assertEquals(4, r.length());
        assertEquals(r, MatchResult.success(7, 3));
        assertNotEquals(r, MatchResult.failure(3));
    }

    @Test
    void shouldUseEmptySpanForSinglePositionResults() {
        MatchResult r = MatchResult.of(true, 5);
        assertEquals(5, r.getPosition());
        assertEquals(5, r.getStart());
        assertEquals("MatchResult[matched 5..5]", r.toString());
        assertEquals("MatchResult[failed at 2]",
                     MatchResult.failure(2).toString());
    }

}
