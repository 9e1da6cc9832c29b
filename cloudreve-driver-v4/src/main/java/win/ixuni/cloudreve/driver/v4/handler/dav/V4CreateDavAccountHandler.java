package win.ixuni.cloudreve.driver.v4.handler.dav;

import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudreve.core.operation.dav.CreateDavAccountOperation;
import win.ixuni.cloudreve.core.util.CloudrevePaths;
import win.ixuni.cloudreve.driver.v4.client.V4Uris;
import win.ixuni.cloudreve.driver.v4.context.V4DriverContext;
import win.ixuni.cloudreve.driver.v4.handler.AbstractV4Handler;
import win.ixuni.cloudreve.driver.v4.model.V4Requests;

import java.util.EnumSet;
import java.util.Set;

public class V4CreateDavAccountHandler extends AbstractV4Handler<CreateDavAccountOperation, Void> {

    @Override
    protected Mono<Void> doHandle(CreateDavAccountOperation operation, V4DriverContext context) {
        String name = CloudrevePaths.requireText(operation.getName(), "name");
        return context.getClient().createDavAccount(new V4Requests.DavAccount(
                V4Uris.pathToUri(operation.getRoot()), name, operation.isReadOnly(), operation.isProxy()));
    }

    @Override
    public Class<CreateDavAccountOperation> getOperationType() {
        return CreateDavAccountOperation.class;
    }

    @Override
    public Set<Capability> getProvidedCapabilities() {
        return EnumSet.of(Capability.WEBDAV_MANAGEMENT);
    }
}
