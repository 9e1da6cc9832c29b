package win.ixuni.cloudreve.driver.v3.handler.file;

import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudreve.core.exception.InvalidArgumentException;
import win.ixuni.cloudreve.core.operation.file.RenameOperation;
import win.ixuni.cloudreve.core.util.CloudrevePaths;
import win.ixuni.cloudreve.driver.v3.context.V3DriverContext;
import win.ixuni.cloudreve.driver.v3.handler.AbstractV3Handler;
import win.ixuni.cloudreve.driver.v3.model.V3Requests;

import java.util.EnumSet;
import java.util.Set;

/**
 * V3 重命名处理器
 * <p>
 * A missing source fails with the names that do exist in its directory.
 */
public class V3RenameHandler extends AbstractV3Handler<RenameOperation, Void> {

    @Override
    protected Mono<Void> doHandle(RenameOperation operation, V3DriverContext context) {
        String path = CloudrevePaths.requireNotRoot(operation.getPath(), "rename");
        String newName = CloudrevePaths.requireText(operation.getNewName(), "newName");
        if (newName.contains("/")) {
            throw new InvalidArgumentException("New name must not contain '/': " + newName);
        }
        return context.getResolver().resolveWithHint(path)
                .flatMap(object -> context.getClient().rename(V3Requests.SourceItems.of(object), newName));
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
