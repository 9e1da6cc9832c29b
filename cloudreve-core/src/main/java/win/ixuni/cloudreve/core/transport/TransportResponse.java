package win.ixuni.cloudreve.core.transport;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Raw HTTP response
 */
@Value
@Builder
public class TransportResponse {

    int status;

    @Singular
    Map<String, List<String>> headers;

    byte[] body;

    public boolean isSuccessful() {
        return status >= 200 && status < 300;
    }

    public String bodyAsString() {
        return body == null ? "" : new String(body, StandardCharsets.UTF_8);
    }

    /**
     * All values of a header, matched case-insensitively
     */
    public List<String> headerValues(String name) {
        for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
            if (entry.getKey() != null && entry.getKey().equalsIgnoreCase(name)) {
                return entry.getValue();
            }
        }
        return Collections.emptyList();
    }
}
