package win.ixuni.cloudreve.driver.v4.model;

import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
public class V4ShareList {

    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private List<V4ShareLink> shares = new ArrayList<>();

    private V4Pagination pagination = new V4Pagination();

    public void setPagination(V4Pagination pagination) {
        this.pagination = pagination == null ? new V4Pagination() : pagination;
    }
}
