package net.grammex.util.match;

import net.grammex.api.match.ElementPredicate;
import net.grammex.util.Formats;

public final class Predicates {

    /* Base class giving predicates a readable description. */
    public static abstract class NamedPredicate<E>
            implements ElementPredicate<E> {

        private final String name;

        public NamedPredicate(String name) {
            this.name = name;
        }

        public String toString() {
            return name;
        }

    }

    private static final ElementPredicate<Character> ALPHA =
        new NamedPredicate<Character>("alpha") {
            public boolean test(Character ch) {
                return Character.isLetter(ch);
            }
        };

    private static final ElementPredicate<Character> ALNUM =
        new NamedPredicate<Character>("alnum") {
            public boolean test(Character ch) {
                return Character.isLetterOrDigit(ch);
            }
        };

    /* Only ASCII digits; numeric rules rely on Character.digit() agreeing
     * with this. */
    private static final ElementPredicate<Character> DIGIT =
        new NamedPredicate<Character>("digit") {
            public boolean test(Character ch) {
                return (ch >= '0' && ch <= '9');
            }
        };

    private static final ElementPredicate<Character> XDIGIT =
        new NamedPredicate<Character>("xdigit") {
            public boolean test(Character ch) {
                return ((ch >= '0' && ch <= '9') ||
                        (ch >= 'a' && ch <= 'f') ||
                        (ch >= 'A' && ch <= 'F'));
            }
        };

    private static final ElementPredicate<Character> OCTAL =
        new NamedPredicate<Character>("octal") {
            public boolean test(Character ch) {
                return (ch >= '0' && ch <= '7');
            }
        };

    private static final ElementPredicate<Character> SPACE =
        new NamedPredicate<Character>("space") {
            public boolean test(Character ch) {
                return Character.isWhitespace(ch);
            }
        };

    private static final ElementPredicate<Character> LOWER =
        new NamedPredicate<Character>("lower") {
            public boolean test(Character ch) {
                return Character.isLowerCase(ch);
            }
        };

    private static final ElementPredicate<Character> UPPER =
        new NamedPredicate<Character>("upper") {
            public boolean test(Character ch) {
                return Character.isUpperCase(ch);
            }
        };

    private static final ElementPredicate<Character> PUNCT =
        new NamedPredicate<Character>("punct") {
            public boolean test(Character ch) {
                return (ch > ' ' && ch < 127 &&
                        ! Character.isLetterOrDigit(ch));
            }
        };

    private static final ElementPredicate<Object> ANYTHING =
        new NamedPredicate<Object>("anything") {
            public boolean test(Object o) {
                return true;
            }
        };

    private static final ElementPredicate<Object> NOTHING =
        new NamedPredicate<Object>("nothing") {
            public boolean test(Object o) {
                return false;
            }
        };

    // Prevent construction.
    private Predicates() {}

    public static ElementPredicate<Character> alpha() {
        return ALPHA;
    }

    public static ElementPredicate<Character> alnum() {
        return ALNUM;
    }

    public static ElementPredicate<Character> digit() {
        return DIGIT;
    }

    public static ElementPredicate<Character> xdigit() {
        return XDIGIT;
    }

    public static ElementPredicate<Character> octal() {
        return OCTAL;
    }

    public static ElementPredicate<Character> space() {
        return SPACE;
    }

    public static ElementPredicate<Character> lower() {
        return LOWER;
    }

    public static ElementPredicate<Character> upper() {
        return UPPER;
    }

    public static ElementPredicate<Character> punct() {
        return PUNCT;
    }

    @SuppressWarnings("unchecked")
    public static <E> ElementPredicate<E> anything() {
        return (ElementPredicate<E>) ANYTHING;
    }

    @SuppressWarnings("unchecked")
    public static <E> ElementPredicate<E> nothing() {
        return (ElementPredicate<E>) NOTHING;
    }

    public static ElementPredicate<Character> range(final char lo,
                                                    final char hi) {
        if (lo > hi)
            throw new IllegalArgumentException("Invalid character range " +
                Formats.formatChar(lo) + ".." + Formats.formatChar(hi));
        return new NamedPredicate<Character>("range(" +
                Formats.formatChar(lo) + ".." + Formats.formatChar(hi) +
                ")") {
            public boolean test(Character ch) {
                return (ch >= lo && ch <= hi);
            }
        };
    }

    public static ElementPredicate<Character> oneOf(final String chars) {
        if (chars == null)
            throw new NullPointerException(
                "Character set may not be null");
        return new NamedPredicate<Character>("oneOf(" +
                Formats.formatString(chars) + ")") {
            public boolean test(Character ch) {
                return (chars.indexOf(ch) != -1);
            }
        };
    }

    public static <E> ElementPredicate<E> equalTo(final E value) {
        if (value == null)
            throw new NullPointerException(
                "Predicate value may not be null");
        return new NamedPredicate<E>("equalTo(" +
                Formats.formatElement(value) + ")") {
            public boolean test(E element) {
                return value.equals(element);
            }
        };
    }

    public static <E> ElementPredicate<E> and(final ElementPredicate<E> a,
                                              final ElementPredicate<E> b) {
        checkOperands(a, b);
        return new NamedPredicate<E>("(" + a + " && " + b + ")") {
            public boolean test(E element) {
                return a.test(element) && b.test(element);
            }
        };
    }

    public static <E> ElementPredicate<E> or(final ElementPredicate<E> a,
                                             final ElementPredicate<E> b) {
        checkOperands(a, b);
        return new NamedPredicate<E>("(" + a + " || " + b + ")") {
            public boolean test(E element) {
                return a.test(element) || b.test(element);
            }
        };
    }

    public static <E> ElementPredicate<E> not(final ElementPredicate<E> p) {
        if (p == null)
            throw new NullPointerException(
                "Predicate operand may not be null");
        return new NamedPredicate<E>("!" + p) {
            public boolean test(E element) {
                return ! p.test(element);
            }
        };
    }

    private static void checkOperands(ElementPredicate<?> a,
                                      ElementPredicate<?> b) {
        if (a == null || b == null)
            throw new NullPointerException(
                "Predicate operands may not be null");
    }

}
