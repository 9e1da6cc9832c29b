package win.ixuni.cloudreve.driver.v3.handler.share;

import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudreve.core.model.ShareItem;
import win.ixuni.cloudreve.core.operation.share.ListSharesOperation;
import win.ixuni.cloudreve.driver.v3.context.V3DriverContext;
import win.ixuni.cloudreve.driver.v3.handler.AbstractV3Handler;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

public class V3ListSharesHandler extends AbstractV3Handler<ListSharesOperation, List<ShareItem>> {

    @Override
    protected Mono<List<ShareItem>> doHandle(ListSharesOperation operation, V3DriverContext context) {
        return context.getClient().listShares()
                .map(ArrayList<ShareItem>::new);
    }

    @Override
    public Class<ListSharesOperation> getOperationType() {
        return ListSharesOperation.class;
    }

    @Override
    public Set<Capability> getProvidedCapabilities() {
        return EnumSet.of(Capability.SHARE_MANAGEMENT);
    }
}
