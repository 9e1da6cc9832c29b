package win.ixuni.cloudreve.core.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DriverConfigTest {

    @Test
    void trimsTrailingSlashes() {
        DriverConfig config = new DriverConfig();
        config.setBaseUrl("http://cloud.test///");

        assertEquals("http://cloud.test", config.getBaseUrl());
    }

    @Test
    void typedProperties() {
        DriverConfig config = new DriverConfig();
        config.getProperties().put(ClientProperties.LIST_PAGE_SIZE, "25");
        config.getProperties().put(ClientProperties.REQUEST_TIMEOUT_MS, 500);
        config.getProperties().put("flag", "true");

        assertEquals(25, config.getInt(ClientProperties.LIST_PAGE_SIZE, ClientProperties.DEFAULT_LIST_PAGE_SIZE));
        assertEquals(500L, config.getLong(ClientProperties.REQUEST_TIMEOUT_MS, 0L));
        assertTrue(config.getBoolean("flag", false));
        assertEquals(ClientProperties.DEFAULT_USER_AGENT,
                config.getString(ClientProperties.USER_AGENT, ClientProperties.DEFAULT_USER_AGENT));
    }

    @Test
    void withTypeCopies() {
        DriverConfig config = new DriverConfig();
        config.setName("main");
        config.setBaseUrl("http://cloud.test");
        config.getProperties().put("k", "v");

        DriverConfig copy = config.withType("v4");
        copy.getProperties().put("k", "changed");

        assertEquals("v4", copy.getType());
        assertEquals("main", copy.getName());
        assertEquals("v", config.getProperties().get("k"));
    }
}
