package win.ixuni.cloudreve.driver.v4.handler.dav;

import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudreve.core.operation.dav.DeleteDavAccountOperation;
import win.ixuni.cloudreve.core.util.CloudrevePaths;
import win.ixuni.cloudreve.driver.v4.context.V4DriverContext;
import win.ixuni.cloudreve.driver.v4.handler.AbstractV4Handler;

import java.util.EnumSet;
import java.util.Set;

public class V4DeleteDavAccountHandler extends AbstractV4Handler<DeleteDavAccountOperation, Void> {

    @Override
    protected Mono<Void> doHandle(DeleteDavAccountOperation operation, V4DriverContext context) {
        return context.getClient().deleteDavAccount(CloudrevePaths.requireText(operation.getAccountId(), "accountId"));
    }

    @Override
    public Class<DeleteDavAccountOperation> getOperationType() {
        return DeleteDavAccountOperation.class;
    }

    @Override
    public Set<Capability> getProvidedCapabilities() {
        return EnumSet.of(Capability.WEBDAV_MANAGEMENT);
    }
}
