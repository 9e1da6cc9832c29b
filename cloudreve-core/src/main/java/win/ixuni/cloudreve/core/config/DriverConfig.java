package win.ixuni.cloudreve.core.config;

import lombok.Data;

import java.util.HashMap;
import java.util.Map;

/**
 * Driver configuration
 * <p>
 * Base URL of the server plus a free-form property map; known keys are listed in
 * {@link ClientProperties}.
 */
@Data
public class DriverConfig {

    /**
     * Driver instance name (used in log lines)
     */
    private String name;

    /**
     * Driver type, the API version id ("v3" / "v4")
     */
    private String type;

    /**
     * Server root URL without the {@code /api/vN} suffix
     */
    private String baseUrl;

    /**
     * Driver-specific configuration
     */
    private Map<String, Object> properties = new HashMap<>();

    /**
     * Set the base URL, trimming trailing slashes
     */
    public void setBaseUrl(String baseUrl) {
        String url = baseUrl;
        while (url != null && url.endsWith("/")) {
            url = url.substring(0, url.length() - 1);
        }
        this.baseUrl = url;
    }

    /**
     * Get a configuration value
     */
    @SuppressWarnings("unchecked")
    public <T> T getProperty(String key, T defaultValue) {
        Object value = properties.get(key);
        if (value == null) {
            return defaultValue;
        }
        return (T) value;
    }

    /**
     * Get a string configuration value
     */
    public String getString(String key, String defaultValue) {
        Object value = properties.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    /**
     * Get an integer configuration value
     */
    public Integer getInt(String key, Integer defaultValue) {
        Object value = properties.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return Integer.parseInt(value.toString());
    }

    /**
     * Get a long integer configuration value
     */
    public Long getLong(String key, Long defaultValue) {
        Object value = properties.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        return Long.parseLong(value.toString());
    }

    /**
     * Get a boolean configuration value
     */
    public Boolean getBoolean(String key, Boolean defaultValue) {
        Object value = properties.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return Boolean.parseBoolean(value.toString());
    }

    /**
     * Copy of this configuration bound to another driver type
     */
    public DriverConfig withType(String newType) {
        DriverConfig copy = new DriverConfig();
        copy.setName(name);
        copy.setType(newType);
        copy.setBaseUrl(baseUrl);
        copy.setProperties(new HashMap<>(properties));
        return copy;
    }
}
