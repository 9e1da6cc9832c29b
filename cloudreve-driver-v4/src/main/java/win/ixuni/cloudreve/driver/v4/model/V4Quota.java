package win.ixuni.cloudreve.driver.v4.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class V4Quota {

    private long used;

    private long total;

    @JsonProperty("storage_pack_total")
    private Long storagePackTotal;
}
