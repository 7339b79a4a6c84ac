package net.grammex.util.match;

import java.util.logging.Logger;
import net.grammex.util.LineColumnTracker;
import net.grammex.util.config.Configuration;

public class MatchSettings {

    public static final String TRACE_KEY = "grammex.trace";
    public static final String TAB_SIZE_KEY = "grammex.tabSize";
    public static final String CONTEXT_LENGTH_KEY = "grammex.contextLength";

    public static final int DEFAULT_CONTEXT_LENGTH = 20;

    public static final MatchSettings DEFAULTS = new MatchSettings(false,
        LineColumnTracker.DEFAULT_TAB_SIZE, DEFAULT_CONTEXT_LENGTH);

    private static final Logger LOGGER = Logger.getLogger("MatchSettings");

    private final boolean tracing;
    private final int tabSize;
    private final int contextLength;

    public MatchSettings(boolean tracing, int tabSize, int contextLength) {
        if (tabSize <= 0)
            throw new IllegalArgumentException("Tab size must be positive");
        if (contextLength < 0)
            throw new IllegalArgumentException("Context length may not " +
                "be negative");
        this.tracing = tracing;
        this.tabSize = tabSize;
        this.contextLength = contextLength;
    }

    public String toString() {
        return String.format("%s@%h[tracing=%s,tabSize=%s," +
            "contextLength=%s]", getClass().getName(), this, isTracing(),
            getTabSize(), getContextLength());
    }

    public boolean isTracing() {
        return tracing;
    }

    public int getTabSize() {
        return tabSize;
    }

    public int getContextLength() {
        return contextLength;
    }

    public MatchSettings withTracing(boolean t) {
        return new MatchSettings(t, tabSize, contextLength);
    }

    private static int parseInt(Configuration conf, String key, int def,
                                int min) {
        String raw = conf.get(key);
        if (raw == null || raw.trim().isEmpty()) return def;
        int ret;
        try {
            ret = Integer.parseInt(raw.trim());
        } catch (NumberFormatException exc) {
            LOGGER.warning("Ignoring malformed value " + raw + " for " +
                           key);
            return def;
        }
        if (ret >= min) return ret;
        LOGGER.warning("Ignoring out-of-range value " + raw + " for " +
                       key);
        return def;
    }

    public static MatchSettings fromConfiguration(Configuration conf) {
        String trace = conf.get(TRACE_KEY);
        boolean tracing = (trace != null &&
                           Boolean.parseBoolean(trace.trim()));
        return new MatchSettings(tracing,
            parseInt(conf, TAB_SIZE_KEY, DEFAULTS.getTabSize(), 1),
            parseInt(conf, CONTEXT_LENGTH_KEY, DEFAULTS.getContextLength(),
                     0));
    }

    /* Read once, on first use. */
    private static class Loaded {
        static final MatchSettings INSTANCE =
            fromConfiguration(Configuration.DEFAULT);
    }

    /* Settings from system properties, the environment, and a
     * grammex.properties class path resource, in that order. Used by
     * everything that is not given explicit settings. */
    public static MatchSettings load() {
        return Loaded.INSTANCE;
    }

}
