package net.grammex.util.config;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Properties;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PropertiesConfigurationTest {

    private static ClassLoader loader() {
        return PropertiesConfigurationTest.class.getClassLoader();
    }

    @Test
    void shouldLoadClassPathResource() {
        PropertiesConfiguration conf = PropertiesConfiguration.fromResource(
            loader(), "grammex-test.properties");
        assertEquals("4", conf.get("grammex.tabSize"));
        assertEquals("grammex-test.properties", conf.getOrigin());
        assertNull(conf.get("grammex.unknown"));
    }

    @Test
    void shouldReturnNullForMissingResource() {
        assertNull(PropertiesConfiguration.fromResource(loader(),
            "does-not-exist.properties"));
    }

    @Test
    void shouldLoadStreams() throws IOException {
        Properties props = PropertiesConfiguration.loadProperties(
            new ByteArrayInputStream("a = 1\n# b = 2\n".getBytes(
                StandardCharsets.ISO_8859_1)));
        assertEquals("1", props.getProperty("a"));
        assertNull(props.getProperty("b"));
        assertThrows(NullPointerException.class,
                     () -> new PropertiesConfiguration(null));
    }

}
