package net.grammex.util.match;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import net.grammex.api.match.InvalidGrammarException;
import net.grammex.api.match.MatchResult;
import net.grammex.util.Logging;
import org.junit.jupiter.api.Test;

import static net.grammex.util.match.Rules.ch;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GrammarTest {

    private static Grammar<Character> arithmetic(MatchSettings settings,
                                                 List<String> numbers) {
        Grammar<Character> g = new Grammar<Character>(settings);
        g.define("expr", g.ref("term")
            .and(Rules.anyOf("+-").and(g.ref("term")).zeroOrMore()));
        g.define("term", g.ref("factor")
            .and(Rules.anyOf("*/").and(g.ref("factor")).zeroOrMore()));
        g.define("factor", Rules.unsignedDecimal()
            .onMatch(Captures.append(numbers))
            .or(ch('(').and(g.ref("expr")).and(ch(')'))));
        return g;
    }

    @Test
    void shouldMatchRecursiveArithmetic() throws InvalidGrammarException {
        List<String> numbers = new ArrayList<String>();
        RuleMatcher<Character> m = arithmetic(MatchSettings.DEFAULTS,
                                              numbers).compile("expr");

        assertTrue(m.matches(Inputs.of("1+2*(30-4)/((5))")));
        assertEquals(Arrays.asList("1", "2", "30", "4", "5"), numbers);

        assertFalse(m.matches(Inputs.of("1+")));
        MatchResult partial = m.match(Inputs.of("1+"));
        assertTrue(partial.isMatched());
        assertEquals(1, partial.getPosition());
        assertFalse(m.matches(Inputs.of("(1")));
    }

    @Test
    void shouldListRuleNames() {
        Grammar<Character> g = arithmetic(MatchSettings.DEFAULTS,
                                          new ArrayList<String>());
        assertEquals(new HashSet<String>(Arrays.asList("expr", "term",
                                                       "factor")),
                     g.getRuleNames());
        assertTrue(g.isDefined("term"));
        assertFalse(g.isDefined("nope"));
        assertNull(g.get("nope"));
        assertTrue(g.ref("term") == g.get("term"));
    }

    @Test
    void shouldRejectUndefinedReferences() {
        Grammar<Character> g = new Grammar<Character>();
        g.define("list", g.ref("item").separatedBy(ch(',')));
        InvalidGrammarException exc = assertThrows(
            InvalidGrammarException.class, () -> g.validate());
        assertEquals("Rule item is referenced but never defined",
                     exc.getMessage());
    }

    @Test
    void shouldRejectMalformedNames() {
        Grammar<Character> g = new Grammar<Character>();
        g.define("1st", ch('x'));
        assertThrows(InvalidGrammarException.class, () -> g.validate());
    }

    @Test
    void shouldRequireStartRule() {
        Grammar<Character> g = new Grammar<Character>();
        g.define("a", ch('a'));
        InvalidGrammarException exc = assertThrows(
            InvalidGrammarException.class, () -> g.compile("b"));
        assertEquals("Missing start rule b", exc.getMessage());
    }

    @Test
    void shouldRejectDuplicateDefinitions() {
        Grammar<Character> g = new Grammar<Character>();
        g.define("a", ch('a'));
        assertThrows(IllegalArgumentException.class,
                     () -> g.define("a", ch('b')));
        assertThrows(NullPointerException.class,
                     () -> g.define("b", null));
    }

    @Test
    void shouldTraceDefinedRules() throws InvalidGrammarException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        Logging.enableTracing(out);
        try {
            Grammar<Character> g = new Grammar<Character>(
                MatchSettings.DEFAULTS.withTracing(true));
            g.define("number", Rules.digits());
            RuleMatcher<Character> m = g.compile("number");

            assertTrue(m.matches(Inputs.of("42")));
            assertFalse(m.match(Inputs.of("x")).isMatched());
        } finally {
            Logging.disableTracing();
        }
        List<String> messages = new ArrayList<String>();
        String text = new String(out.toByteArray(), StandardCharsets.UTF_8);
        for (String line : text.split("\\R")) {
            /* Drop the date and time. */
            messages.add(line.substring(line.indexOf(' ',
                line.indexOf(' ') + 1) + 1));
        }
        assertEquals(Arrays.asList("FINER TraceRule] Trying number at 0",
                                   "FINE TraceRule] number matched 0..2",
                                   "FINER TraceRule] Trying number at 0",
                                   "FINE TraceRule] number failed at 0"),
                     messages);
    }

    @Test
    void shouldEnableTracingFromSettings() {
        Logging.disableTracing();
        try {
            new Grammar<Character>(MatchSettings.DEFAULTS);
            assertFalse(Logging.isTracing());
            new Grammar<Character>(MatchSettings.DEFAULTS.withTracing(true));
            assertTrue(Logging.isTracing());
        } finally {
            Logging.disableTracing();
        }
    }

}
