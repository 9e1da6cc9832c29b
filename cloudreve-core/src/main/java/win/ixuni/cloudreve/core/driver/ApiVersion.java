package win.ixuni.cloudreve.core.driver;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Locale;

/**
 * Server protocol versions
 */
@Getter
@RequiredArgsConstructor
public enum ApiVersion {

    /**
     * Legacy protocol: cookie session, identifier-addressed mutations
     */
    V3("v3"),

    /**
     * Current protocol: bearer token, URI-addressed
     */
    V4("v4");

    /**
     * Path segment under {@code /api/} and the driver type identifier
     */
    private final String id;

    public static ApiVersion fromId(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ApiVersion version : values()) {
            if (version.id.equals(normalized)) {
                return version;
            }
        }
        throw new IllegalArgumentException("Unknown API version: " + value);
    }
}
