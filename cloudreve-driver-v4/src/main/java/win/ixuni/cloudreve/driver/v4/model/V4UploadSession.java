package win.ixuni.cloudreve.driver.v4.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Upload session returned by {@code PUT /file/upload}
 */
@Data
@NoArgsConstructor
public class V4UploadSession {

    @JsonProperty("session_id")
    private String sessionId;

    @JsonProperty("chunk_size")
    private long chunkSize;

    private long expires;

    @JsonProperty("upload_id")
    private String uploadId;
}
