package win.ixuni.cloudreve.driver.v3.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Storage policy of a V3 directory
 */
@Data
@NoArgsConstructor
public class V3Policy {

    public static final String TYPE_ONEDRIVE = "onedrive";

    private String id;

    private String name;

    @JsonProperty("type")
    private String type;

    @JsonProperty("max_size")
    private long maxSize;

    @JsonProperty("file_type")
    private List<String> fileType;
}
