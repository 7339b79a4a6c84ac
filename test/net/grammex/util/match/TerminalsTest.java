package net.grammex.util.match;

import java.util.Arrays;
import java.util.concurrent.atomic.AtomicInteger;
import net.grammex.api.match.Decision;
import net.grammex.api.match.Input;
import net.grammex.api.match.MatchResult;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TerminalsTest {

    private static MatchResult match(AbstractRule<Character> rule,
                                     String text) {
        Input<Character> input = Inputs.of(text);
        return rule.match(input, 0, input.length());
    }

    @Test
    void shouldMatchEmptyWithoutConsuming() {
        Input<Character> input = Inputs.of("abc");
        MatchResult r = Rules.<Character>empty().match(input, 1, 3);
        assertTrue(r.isMatched());
        assertEquals(1, r.getPosition());
    }

    @Test
    void shouldInjectBooleans() {
        assertTrue(match(Rules.<Character>bool(true), "x").isMatched());
        assertFalse(match(Rules.<Character>bool(false), "x").isMatched());

        final AtomicInteger calls = new AtomicInteger();
        AbstractRule<Character> rule = Rules.bool(new Decision() {
            public boolean decide() {
                return calls.incrementAndGet() % 2 == 1;
            }
        });
        MatchResult first = match(rule, "x");
        assertTrue(first.isMatched());
        assertEquals(0, first.getPosition());
        assertFalse(match(rule, "x").isMatched());
        assertEquals(2, calls.get());
    }

    @Test
    void shouldMatchSingleCharacter() {
        MatchResult r = match(Rules.ch('a'), "ab");
        assertTrue(r.isMatched());
        assertEquals(1, r.getPosition());
        assertEquals(0, r.getStart());

        assertFalse(match(Rules.ch('a'), "").isMatched());
        MatchResult miss = match(Rules.ch('a'), "b");
        assertFalse(miss.isMatched());
        assertEquals(0, miss.getPosition());
    }

    @Test
    void shouldMatchTokensOfAnyElementType() {
        Input<String> input = Inputs.ofElements("let", "x", "=", "1");
        MatchResult r = Rules.token("let").match(input, 0, 4);
        assertTrue(r.isMatched());
        assertEquals(1, r.getPosition());

        MatchResult seq = Rules.tokens(Arrays.asList("x", "="))
            .match(input, 1, 4);
        assertTrue(seq.isMatched());
        assertEquals(3, seq.getPosition());
        assertFalse(Rules.tokens(Arrays.asList("x", "+"))
                    .match(input, 1, 4).isMatched());
    }

    @Test
    void shouldMatchAnyElementUnlessAtEnd() {
        assertTrue(match(Rules.<Character>any(), "z").isMatched());
        assertFalse(match(Rules.<Character>any(), "").isMatched());
    }

    @Test
    void shouldMatchBinaryPatterns() {
        Input<Byte> input = Inputs.of(new byte[] { 1, 2, 3, 4, 5 });
        MatchResult r = Rules.bin((byte) 1, (byte) 2).match(input, 0, 5);
        assertTrue(r.isMatched());
        assertEquals(2, r.getPosition());

        MatchResult word = Rules.bin(0x01020304, Layouts.INT32_BE)
            .match(input, 0, 5);
        assertTrue(word.isMatched());
        assertEquals(4, word.getPosition());

        assertFalse(Rules.bin((byte) 1, (byte) 9).match(input, 0, 5)
                    .isMatched());
    }

    @Test
    void shouldFailBinaryPatternOnShortInputWithoutConsuming() {
        Input<Byte> input = Inputs.of(new byte[] { 1, 2, 3 });
        MatchResult r = Rules.bin(0x01020304, Layouts.INT32_BE)
            .match(input, 0, 3);
        assertFalse(r.isMatched());
        assertEquals(0, r.getPosition());
        assertEquals(0, r.length());
    }

    @Test
    void shouldMatchEmptyStringTriviallyAnywhere() {
        Input<Character> input = Inputs.of("xyz");
        for (int i = 0; i <= 3; i++) {
            MatchResult r = Rules.str("").match(input, i, 3);
            assertTrue(r.isMatched());
            assertEquals(i, r.getPosition());
            assertEquals(0, r.length());
        }
    }

    @Test
    void shouldMatchStringsExactly() {
        assertEquals(3, match(Rules.str("abc"), "abcd").getPosition());
        assertFalse(match(Rules.str("abc"), "abd").isMatched());
        assertFalse(match(Rules.str("abc"), "ab").isMatched());
    }

    @Test
    void shouldReadReferencedStringsAtMatchTime() {
        StringBuilder pattern = new StringBuilder("if");
        AbstractRule<Character> byRef = Rules.strRef(pattern);
        AbstractRule<Character> byValue = Rules.str(pattern.toString());
        assertTrue(match(byRef, "if").isMatched());

        pattern.setLength(0);
        pattern.append("else");
        assertTrue(match(byRef, "else").isMatched());
        assertFalse(match(byRef, "if").isMatched());
        assertTrue(match(byValue, "if").isMatched());
    }

    @Test
    void shouldMatchSinglePredicateElement() {
        MatchResult r = match(Rules.is(Predicates.digit()), "7a");
        assertTrue(r.isMatched());
        assertEquals(1, r.getPosition());
        assertFalse(match(Rules.is(Predicates.digit()), "a7").isMatched());
    }

    @Test
    void shouldMatchUnboundedRunsEvenWhenEmpty() {
        MatchResult none = match(Rules.run(Predicates.alpha()), "123");
        assertTrue(none.isMatched());
        assertEquals(0, none.getPosition());

        MatchResult some = match(Rules.run(Predicates.alpha()), "abc1");
        assertEquals(3, some.getPosition());
    }

    @Test
    void shouldHonorRunBounds() {
        AbstractRule<Character> rule = Rules.run(Predicates.digit(), 2, 3);
        MatchResult capped = match(rule, "12345");
        assertTrue(capped.isMatched());
        assertEquals(3, capped.getPosition());

        MatchResult tooShort = match(rule, "1a");
        assertFalse(tooShort.isMatched());
        assertEquals(0, tooShort.getPosition());
    }

    @Test
    void shouldMatchIdentifierUpToSpace() {
        Input<Character> input = Inputs.of("x1y2 ");
        MatchResult r = Rules.identifier().match(input, 0, input.length());
        assertTrue(r.isMatched());
        assertEquals(4, r.getPosition());
        assertEquals("x1y2",
            Inputs.text(input, r.getStart(), r.getPosition()).toString());

        assertEquals(1, match(Rules.identifier(), "x").getPosition());
        assertFalse(match(Rules.identifier(), "1x").isMatched());
        assertFalse(match(Rules.identifier(), "").isMatched());
    }

    @Test
    void shouldMatchEndOnlyAtEnd() {
        Input<Character> input = Inputs.of("ab");
        assertTrue(Rules.<Character>end().match(input, 2, 2).isMatched());
        assertFalse(Rules.<Character>end().match(input, 1, 2).isMatched());
        assertTrue(Rules.<Character>end().match(input, 1, 1).isMatched());
    }

    @Test
    void shouldAdvanceByOffsetIfPossible() {
        MatchResult r = match(Rules.<Character>advance(3), "abcd");
        assertTrue(r.isMatched());
        assertEquals(3, r.getPosition());

        MatchResult miss = match(Rules.<Character>advance(5), "abcd");
        assertFalse(miss.isMatched());
        assertEquals(0, miss.getPosition());
        assertTrue(match(Rules.<Character>advance(0), "").isMatched());
    }

    @Test
    void shouldRejectInvalidConstruction() {
        assertThrows(IllegalArgumentException.class,
                     () -> Rules.<Character>advance(-1));
        assertThrows(IllegalArgumentException.class,
                     () -> Rules.run(Predicates.digit(), 3, 2));
        assertThrows(IllegalArgumentException.class,
                     () -> Rules.bin(new byte[0]));
        assertThrows(NullPointerException.class,
                     () -> Rules.str(null));
        assertThrows(NullPointerException.class,
                     () -> Rules.token(null));
    }

    @Test
    void shouldMatchNumbers() {
        assertEquals(3, match(Rules.digits(), "123x").getPosition());
        assertFalse(match(Rules.digits(), "x").isMatched());
        assertEquals(4, match(Rules.decimal(), "-123").getPosition());
        assertEquals(6, match(Rules.floatingPoint(), "-1.5e3").getPosition());
        assertEquals(2, match(Rules.floatingPoint(), "2.").getPosition());
        assertEquals(3, match(Rules.floatingPoint(), ".25").getPosition());
        assertEquals(1, match(Rules.floatingPoint(), "1e").getPosition());
        assertFalse(match(Rules.floatingPoint(), ".").isMatched());
    }

}
