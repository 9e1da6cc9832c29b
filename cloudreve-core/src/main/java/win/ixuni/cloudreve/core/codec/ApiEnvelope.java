package win.ixuni.cloudreve.core.codec;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;

/**
 * Uniform response wrapper of both protocol versions: {@code {code, msg, data}}
 */
@Data
public class ApiEnvelope {

    private int code;

    private String msg;

    /**
     * Object, array, string or null
     */
    private JsonNode data;

    public boolean isSuccess() {
        return code == 0;
    }

    public boolean hasData() {
        return data != null && !data.isNull() && !data.isMissingNode();
    }
}
