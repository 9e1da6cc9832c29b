package win.ixuni.cloudreve.driver.v3.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
public class V3ShareList {

    private List<V3Share> items = new ArrayList<>();

    private int total;
}
