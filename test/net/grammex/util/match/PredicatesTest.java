package net.grammex.util.match;

import net.grammex.api.match.ElementPredicate;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PredicatesTest {

    @Test
    void shouldClassifyCharacters() {
        assertTrue(Predicates.alpha().test('q'));
        assertFalse(Predicates.alpha().test('1'));
        assertTrue(Predicates.alnum().test('7'));
        assertTrue(Predicates.digit().test('0'));
        assertFalse(Predicates.digit().test('a'));
        assertTrue(Predicates.xdigit().test('F'));
        assertFalse(Predicates.xdigit().test('g'));
        assertTrue(Predicates.octal().test('7'));
        assertFalse(Predicates.octal().test('8'));
        assertTrue(Predicates.space().test('\t'));
        assertTrue(Predicates.lower().test('a'));
        assertTrue(Predicates.upper().test('A'));
        assertTrue(Predicates.punct().test('!'));
        assertFalse(Predicates.punct().test(' '));
    }

    @Test
    void shouldCombinePredicates() {
        ElementPredicate<Character> hexLetter = Predicates.and(
            Predicates.xdigit(), Predicates.not(Predicates.digit()));
        assertTrue(hexLetter.test('c'));
        assertFalse(hexLetter.test('5'));

        ElementPredicate<Character> sign = Predicates.or(
            Predicates.equalTo('+'), Predicates.equalTo('-'));
        assertTrue(sign.test('-'));
        assertFalse(sign.test('*'));

        assertTrue(Predicates.<Character>anything().test('x'));
        assertFalse(Predicates.<Character>nothing().test('x'));
    }

    @Test
    void shouldMatchRangesAndSets() {
        assertTrue(Predicates.range('a', 'f').test('f'));
        assertFalse(Predicates.range('a', 'f').test('g'));
        assertTrue(Predicates.oneOf("xyz").test('y'));
        assertFalse(Predicates.oneOf("").test('y'));
        assertThrows(IllegalArgumentException.class,
                     () -> Predicates.range('z', 'a'));
    }

    @Test
    void shouldDescribePredicates() {
        assertEquals("(alpha || digit)", Predicates.or(Predicates.alpha(),
            Predicates.digit()).toString());
        assertEquals("range('0'..'9')",
                     Predicates.range('0', '9').toString());
        assertEquals("!space", Predicates.not(Predicates.space())
                     .toString());
    }

}
