package win.ixuni.cloudreve.core.operation.dav;

import lombok.Value;
import win.ixuni.cloudreve.core.model.DavAccount;
import win.ixuni.cloudreve.core.operation.Operation;

import java.util.List;

/**
 * 列出 WebDAV 账户
 */
@Value
public class ListDavAccountsOperation implements Operation<List<DavAccount>> {

    Integer pageSize;
}
