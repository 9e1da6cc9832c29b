package win.ixuni.cloudreve.driver.v3.handler.dav;

import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudreve.core.model.DavAccount;
import win.ixuni.cloudreve.core.operation.dav.ListDavAccountsOperation;
import win.ixuni.cloudreve.driver.v3.context.V3DriverContext;
import win.ixuni.cloudreve.driver.v3.handler.AbstractV3Handler;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * V3 returns every account at once; page size does not apply
 */
public class V3ListDavAccountsHandler extends AbstractV3Handler<ListDavAccountsOperation, List<DavAccount>> {

    @Override
    protected Mono<List<DavAccount>> doHandle(ListDavAccountsOperation operation, V3DriverContext context) {
        return context.getClient().webdavAccounts()
                .map(ArrayList<DavAccount>::new);
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
