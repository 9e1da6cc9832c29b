package win.ixuni.cloudreve.driver.v3.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Upload session returned by {@code PUT /file/upload}
 */
@Data
@NoArgsConstructor
public class V3UploadSession {

    @JsonProperty("sessionID")
    private String sessionId;

    @JsonProperty("chunkSize")
    private long chunkSize;

    private long expires;
}
