package win.ixuni.cloudreve.driver.v3.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
public class V3WebdavAccountList {

    private List<V3WebdavAccount> accounts = new ArrayList<>();
}
