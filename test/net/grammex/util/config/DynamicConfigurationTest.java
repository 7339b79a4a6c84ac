package net.grammex.util.config;

import java.util.Properties;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DynamicConfigurationTest {

    @Test
    void shouldConsultSourcesInOrder() {
        Properties first = new Properties();
        first.setProperty("grammex.tabSize", "2");
        Properties second = new Properties();
        second.setProperty("grammex.tabSize", "6");
        second.setProperty("grammex.trace", "true");

        DynamicConfiguration conf = new DynamicConfiguration();
        conf.addSource(new PropertiesConfiguration(first));
        conf.addSource(new PropertiesConfiguration(second));

        assertEquals("2", conf.get("grammex.tabSize"));
        assertEquals("true", conf.get("grammex.trace"));
        assertNull(conf.get("grammex.missing"));
        assertThrows(NullPointerException.class,
                     () -> conf.addSource(null));
    }

    @Test
    void shouldCacheLookups() {
        Properties props = new Properties();
        props.setProperty("key", "old");
        DynamicConfiguration conf = new DynamicConfiguration();
        conf.addSource(new PropertiesConfiguration(props));

        assertEquals("old", conf.get("key"));
        assertNull(conf.get("other"));
        props.setProperty("key", "new");
        props.setProperty("other", "late");
        assertEquals("old", conf.get("key"));
        assertNull(conf.get("other"));
    }

    @Test
    void shouldPreferSystemPropertiesOverResource() {
        System.setProperty("grammex.contextLength", "12");
        try {
            DynamicConfiguration conf = DynamicConfiguration.makeDefault();
            assertEquals("12", conf.get("grammex.contextLength"));
        } finally {
            System.clearProperty("grammex.contextLength");
        }
        DynamicConfiguration conf = DynamicConfiguration.makeDefault();
        assertEquals("30", conf.get("grammex.contextLength"));
        assertNull(conf.get("grammex.test.unset"));
    }

}
