package win.ixuni.cloudreve.driver.v4.handler.dav;

import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudreve.core.model.DavAccount;
import win.ixuni.cloudreve.core.operation.dav.ListDavAccountsOperation;
import win.ixuni.cloudreve.driver.v4.context.V4DriverContext;
import win.ixuni.cloudreve.driver.v4.handler.AbstractV4Handler;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * First page of WebDAV accounts; the page size defaults to the lookup page size
 */
public class V4ListDavAccountsHandler extends AbstractV4Handler<ListDavAccountsOperation, List<DavAccount>> {

    @Override
    protected Mono<List<DavAccount>> doHandle(ListDavAccountsOperation operation, V4DriverContext context) {
        int pageSize = operation.getPageSize() != null ? operation.getPageSize() : context.getDavLookupPageSize();
        return context.getClient().davAccounts(pageSize, null)
                .map(page -> new ArrayList<DavAccount>(page.getAccounts()));
    }

    @Override
    public Class<ListDavAccountsOperation> getOperationType() {
        return ListDavAccountsOperation.class;
    }

    @Override
    public Set<Capability> getProvidedCapabilities() {
        return EnumSet.of(Capability.WEBDAV);
    }
}
