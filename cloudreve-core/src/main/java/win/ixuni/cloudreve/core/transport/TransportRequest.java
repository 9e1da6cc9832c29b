package win.ixuni.cloudreve.core.transport;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Outgoing HTTP request
 */
@Value
@Builder(toBuilder = true)
public class TransportRequest {

    /**
     * GET, POST, PUT, PATCH or DELETE
     */
    String method;

    /**
     * Absolute URL including the query string
     */
    String url;

    @Singular
    Map<String, String> headers;

    /**
     * Request body, null when the request carries none
     */
    byte[] body;

    public URI uri() {
        return URI.create(url);
    }

    /**
     * Path component of the URL (no query)
     */
    public String path() {
        return uri().getRawPath();
    }

    /**
     * Decoded value of a query parameter, or null
     */
    public String queryParameter(String name) {
        String query = uri().getRawQuery();
        if (query == null) {
            return null;
        }
        for (String pair : query.split("&")) {
            int eq = pair.indexOf('=');
            String key = eq < 0 ? pair : pair.substring(0, eq);
            if (key.equals(name)) {
                String raw = eq < 0 ? "" : pair.substring(eq + 1);
                return URLDecoder.decode(raw, StandardCharsets.UTF_8);
            }
        }
        return null;
    }

    public String bodyAsString() {
        return body == null ? "" : new String(body, StandardCharsets.UTF_8);
    }
}
