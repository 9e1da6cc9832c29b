package win.ixuni.cloudreve.driver.v4.handler.file;

import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudreve.core.exception.InvalidArgumentException;
import win.ixuni.cloudreve.core.operation.file.RenameOperation;
import win.ixuni.cloudreve.core.util.CloudrevePaths;
import win.ixuni.cloudreve.driver.v4.client.V4Uris;
import win.ixuni.cloudreve.driver.v4.context.V4DriverContext;
import win.ixuni.cloudreve.driver.v4.handler.AbstractV4Handler;

import java.util.EnumSet;
import java.util.Set;

public class V4RenameHandler extends AbstractV4Handler<RenameOperation, Void> {

    @Override
    protected Mono<Void> doHandle(RenameOperation operation, V4DriverContext context) {
        String path = V4Uris.requireNotRoot(operation.getPath(), "rename");
        String newName = CloudrevePaths.requireText(operation.getNewName(), "newName");
        if (newName.contains("/")) {
            throw new InvalidArgumentException("New name must not contain '/': " + newName);
        }
        return context.getClient().rename(V4Uris.pathToUri(path), newName);
    }

    @Override
    public Class<RenameOperation> getOperationType() {
        return RenameOperation.class;
    }

    @Override
    public Set<Capability> getProvidedCapabilities() {
        return EnumSet.of(Capability.WRITE);
    }
}
