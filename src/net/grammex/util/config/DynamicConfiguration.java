package net.grammex.util.config;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class DynamicConfiguration implements Configuration {

    public static final String RESOURCE_NAME = "grammex.properties";

    public static final Configuration PROPERTY_SOURCE = new Configuration() {
        public String get(String key) {
            return System.getProperty(key);
        }
    };

    /* grammex.tabSize is looked up as GRAMMEX_TABSIZE. */
    public static final Configuration ENV_SOURCE = new Configuration() {
        public String get(String key) {
            return System.getenv(key.toUpperCase().replace(".", "_"));
        }
    };

    private final List<Configuration> sources;
    private final Map<String, String> cache;

    public DynamicConfiguration() {
        sources = new ArrayList<Configuration>();
        cache = new HashMap<String, String>();
    }

    /* Values are looked up once; later changes to the sources are not
     * seen. */
    public synchronized String get(String key) {
        if (cache.containsKey(key)) return cache.get(key);
        String ret = null;
        for (Configuration src : sources) {
            ret = src.get(key);
            if (ret != null) break;
        }
        cache.put(key, ret);
        return ret;
    }

    public synchronized void addSource(Configuration source) {
        if (source == null)
            throw new NullPointerException(
                "Configuration source may not be null");
        sources.add(source);
    }

    public static DynamicConfiguration makeDefault(ClassLoader loader) {
        DynamicConfiguration ret = new DynamicConfiguration();
        ret.addSource(PROPERTY_SOURCE);
        ret.addSource(ENV_SOURCE);
        Configuration file = PropertiesConfiguration.fromResource(loader,
            RESOURCE_NAME);
        if (file != null) ret.addSource(file);
        return ret;
    }
    public static DynamicConfiguration makeDefault() {
        return makeDefault(DynamicConfiguration.class.getClassLoader());
    }

}
