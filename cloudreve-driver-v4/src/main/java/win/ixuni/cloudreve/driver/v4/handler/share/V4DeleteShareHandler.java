package win.ixuni.cloudreve.driver.v4.handler.share;

import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudreve.core.operation.share.DeleteShareOperation;
import win.ixuni.cloudreve.core.util.CloudrevePaths;
import win.ixuni.cloudreve.driver.v4.context.V4DriverContext;
import win.ixuni.cloudreve.driver.v4.handler.AbstractV4Handler;

import java.util.EnumSet;
import java.util.Set;

public class V4DeleteShareHandler extends AbstractV4Handler<DeleteShareOperation, Void> {

    @Override
    protected Mono<Void> doHandle(DeleteShareOperation operation, V4DriverContext context) {
        return context.getClient().deleteShare(CloudrevePaths.requireText(operation.getShareId(), "shareId"));
    }

    @Override
    public Class<DeleteShareOperation> getOperationType() {
        return DeleteShareOperation.class;
    }

    @Override
    public Set<Capability> getProvidedCapabilities() {
        return EnumSet.of(Capability.SHARE_MANAGEMENT);
    }
}
