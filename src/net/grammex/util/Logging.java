package net.grammex.util;

import java.io.OutputStream;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.StreamHandler;

public final class Logging {

    public static final String TRACE_LOGGER = "TraceRule";

    private static final String FORMAT =
        "[%1$tY-%1$tm-%1$td %1$tH:%1$tM:%1$tS.%1$tL %2$s %3$s] %4$s%n";

    /* Held strongly so that the level and handler set below stick. */
    private static final Logger TRACE = Logger.getLogger(TRACE_LOGGER);

    private static Handler traceHandler;

    private Logging() {}

    public static Formatter compactFormatter() {
        return new Formatter() {
            public String format(LogRecord record) {
                return String.format(FORMAT, record.getMillis(),
                    record.getLevel().getName(), record.getLoggerName(),
                    formatMessage(record));
            }
        };
    }

    public static Handler makeStreamHandler(OutputStream os) {
        Handler ret = new StreamHandler(os, compactFormatter()) {
            public synchronized void publish(LogRecord record) {
                // HACK: Force quick flushing.
                super.publish(record);
                flush();
            }
        };
        ret.setLevel(Level.ALL);
        return ret;
    }

    /* Send trace rule output down to FINER to os. If a trace stream is
     * installed already, it is kept and returned instead. */
    public static synchronized Handler enableTracing(OutputStream os) {
        if (traceHandler == null) {
            traceHandler = makeStreamHandler(os);
            TRACE.addHandler(traceHandler);
            TRACE.setUseParentHandlers(false);
        }
        TRACE.setLevel(Level.FINER);
        return traceHandler;
    }

    /* Undo enableTracing(). The stream itself is flushed but not closed. */
    public static synchronized void disableTracing() {
        if (traceHandler != null) {
            TRACE.removeHandler(traceHandler);
            traceHandler.flush();
            traceHandler = null;
        }
        TRACE.setUseParentHandlers(true);
        TRACE.setLevel(null);
    }

    public static synchronized boolean isTracing() {
        return (traceHandler != null);
    }

}
