package net.grammex.util.config;

public interface Configuration {

    /* System properties, then the environment, then a grammex.properties
     * file on the class path. */
    Configuration DEFAULT = DynamicConfiguration.makeDefault();

    String get(String key);

}
