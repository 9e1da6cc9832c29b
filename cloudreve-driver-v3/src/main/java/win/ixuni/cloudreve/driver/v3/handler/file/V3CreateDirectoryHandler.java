package win.ixuni.cloudreve.driver.v3.handler.file;

import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudreve.core.operation.file.CreateDirectoryOperation;
import win.ixuni.cloudreve.core.util.CloudrevePaths;
import win.ixuni.cloudreve.driver.v3.context.V3DriverContext;
import win.ixuni.cloudreve.driver.v3.handler.AbstractV3Handler;

import java.util.EnumSet;
import java.util.Set;

public class V3CreateDirectoryHandler extends AbstractV3Handler<CreateDirectoryOperation, Void> {

    @Override
    protected Mono<Void> doHandle(CreateDirectoryOperation operation, V3DriverContext context) {
        String path = CloudrevePaths.requireNotRoot(operation.getPath(), "create");
        return context.getClient().createDirectory(path);
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
