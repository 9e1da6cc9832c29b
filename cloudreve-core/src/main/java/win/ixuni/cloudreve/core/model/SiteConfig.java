package win.ixuni.cloudreve.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;
import win.ixuni.cloudreve.core.driver.ApiVersion;

/**
 * Public site configuration
 * <p>
 * The two versions share few keys, so the raw object is kept.
 */
@Value
public class SiteConfig {

    ApiVersion apiVersion;

    /**
     * Requested section (V4), null for V3
     */
    String section;

    JsonNode values;

    public String getString(String key) {
        JsonNode node = values.get(key);
        return node == null || node.isNull() ? null : node.asText();
    }

    public String getTitle() {
        String title = getString("title");
        return title != null ? title : getString("siteName");
    }
}
