package win.ixuni.cloudreve.driver.v3.model;

import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class V3StorageInfo {

    private long used;

    private long free;

    private long total;
}
