package net.grammex.util.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;
import java.util.logging.Logger;

public class PropertiesConfiguration implements Configuration {

    private static final Logger LOGGER =
        Logger.getLogger("PropertiesConfiguration");

    private final Properties base;
    private final String origin;

    public PropertiesConfiguration(Properties base, String origin) {
        if (base == null)
            throw new NullPointerException("Properties may not be null");
        this.base = base;
        this.origin = origin;
    }
    public PropertiesConfiguration(Properties base) {
        this(base, null);
    }

    public String toString() {
        return String.format("%s@%h[origin=%s,keys=%s]",
            getClass().getName(), this, origin, base.size());
    }

    public Properties getBase() {
        return base;
    }

    public String getOrigin() {
        return origin;
    }

    public String get(String key) {
        return base.getProperty(key);
    }

    public static Properties loadProperties(InputStream in)
            throws IOException {
        Properties ret = new Properties();
        try {
            ret.load(in);
        } finally {
            in.close();
        }
        return ret;
    }

    /* The named class path resource, or null if there is none. */
    public static PropertiesConfiguration fromResource(ClassLoader loader,
                                                       String name) {
        InputStream in = loader.getResourceAsStream(name);
        if (in == null) return null;
        try {
            PropertiesConfiguration ret = new PropertiesConfiguration(
                loadProperties(in), name);
            LOGGER.config("Loaded " + ret.getBase().size() +
                          " settings from " + name);
            return ret;
        } catch (IOException exc) {
            throw new UncheckedIOException("Cannot read " + name, exc);
        }
    }

}
