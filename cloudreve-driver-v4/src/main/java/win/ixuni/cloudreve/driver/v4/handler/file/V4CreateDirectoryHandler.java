package win.ixuni.cloudreve.driver.v4.handler.file;

import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudreve.core.operation.file.CreateDirectoryOperation;
import win.ixuni.cloudreve.driver.v4.client.V4Uris;
import win.ixuni.cloudreve.driver.v4.context.V4DriverContext;
import win.ixuni.cloudreve.driver.v4.handler.AbstractV4Handler;

import java.util.EnumSet;
import java.util.Set;

public class V4CreateDirectoryHandler extends AbstractV4Handler<CreateDirectoryOperation, Void> {

    @Override
    protected Mono<Void> doHandle(CreateDirectoryOperation operation, V4DriverContext context) {
        String path = V4Uris.requireNotRoot(operation.getPath(), "create");
        return context.getClient().createFolder(V4Uris.pathToUri(path));
    }

    @Override
    public Class<CreateDirectoryOperation> getOperationType() {
        return CreateDirectoryOperation.class;
    }

    @Override
    public Set<Capability> getProvidedCapabilities() {
        return EnumSet.of(Capability.WRITE);
    }
}
