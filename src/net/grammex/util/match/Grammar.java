package net.grammex.util.match;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import net.grammex.api.match.InvalidGrammarException;
import net.grammex.api.match.Rule;
import net.grammex.util.Logging;

/**
 * A set of named rules that may refer to each other.
 * ref() hands out a Reference for a name whether or not the name has been
 * defined yet; define() binds it. validate() checks that every name that
 * has been referenced is also defined.
 * If the settings enable tracing, every defined rule is wrapped into a
 * trace rule carrying its name, and trace output goes to standard error
 * unless Logging.enableTracing() has installed another stream already.
 */
public class Grammar<E> {

    public static final Pattern NAME_PATTERN = Pattern.compile(
        "[a-zA-Z$_-][A-Za-z0-9$_-]*");

    private static final Logger LOGGER = Logger.getLogger("Grammar");

    private final MatchSettings settings;
    private final Map<String, Reference<E>> rules;

    public Grammar(MatchSettings settings) {
        if (settings == null)
            throw new NullPointerException("Settings may not be null");
        this.settings = settings;
        this.rules = new LinkedHashMap<String, Reference<E>>();
        if (settings.isTracing()) Logging.enableTracing(System.err);
    }
    public Grammar() {
        this(MatchSettings.load());
    }

    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(getClass().getName());
        sb.append('@');
        sb.append(Integer.toHexString(hashCode()));
        sb.append('[');
        boolean first = true;
        for (Reference<E> r : rules.values()) {
            if (first) {
                first = false;
            } else {
                sb.append(',');
            }
            sb.append(r.getName()).append('=');
            sb.append((r.isBound()) ? String.valueOf(r.get()) : "?");
        }
        sb.append(']');
        return sb.toString();
    }

    public MatchSettings getSettings() {
        return settings;
    }

    public Set<String> getRuleNames() {
        return Collections.unmodifiableSet(rules.keySet());
    }

    public boolean isDefined(String name) {
        Reference<E> r = rules.get(name);
        return (r != null && r.isBound());
    }

    /* The named rule, or null if the name has neither been defined nor
     * referenced. */
    public Reference<E> get(String name) {
        return rules.get(name);
    }

    public Reference<E> ref(String name) {
        if (name == null)
            throw new NullPointerException("Rule name may not be null");
        Reference<E> ret = rules.get(name);
        if (ret == null) {
            ret = new Reference<E>(name);
            rules.put(name, ret);
        }
        return ret;
    }

    public Reference<E> define(String name, Rule<E> rule) {
        if (rule == null)
            throw new NullPointerException("Rule " + name +
                " may not be null");
        Reference<E> ret = ref(name);
        if (ret.isBound())
            throw new IllegalArgumentException("Rule " + name +
                " defined twice");
        ret.set((settings.isTracing()) ? Rules.trace(name, rule) : rule);
        return ret;
    }

    public void validate() throws InvalidGrammarException {
        for (Reference<E> r : rules.values()) {
            if (! NAME_PATTERN.matcher(r.getName()).matches())
                throw new InvalidGrammarException("Invalid rule name " +
                    r.getName());
            if (! r.isBound())
                throw new InvalidGrammarException("Rule " + r.getName() +
                    " is referenced but never defined");
        }
        LOGGER.config("Validated grammar with " + rules.size() + " rules");
    }
    public void validate(String startName) throws InvalidGrammarException {
        if (! isDefined(startName))
            throw new InvalidGrammarException("Missing start rule " +
                startName);
        validate();
    }

    public RuleMatcher<E> compile(String startName,
                                  Diagnostics<E> diagnostics)
            throws InvalidGrammarException {
        validate(startName);
        return new RuleMatcher<E>(get(startName), settings, diagnostics);
    }
    public RuleMatcher<E> compile(String startName)
            throws InvalidGrammarException {
        return compile(startName, null);
    }

}
