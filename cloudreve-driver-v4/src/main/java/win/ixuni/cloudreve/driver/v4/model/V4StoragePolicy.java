package win.ixuni.cloudreve.driver.v4.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class V4StoragePolicy {

    private String id;

    private String name;

    private String type;

    @JsonProperty("max_size")
    private long maxSize;
}
