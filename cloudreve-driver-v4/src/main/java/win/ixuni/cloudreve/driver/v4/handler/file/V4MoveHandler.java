package win.ixuni.cloudreve.driver.v4.handler.file;

import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudreve.core.operation.file.MoveOperation;
import win.ixuni.cloudreve.core.operation.file.RenameOperation;
import win.ixuni.cloudreve.core.util.CloudrevePaths;
import win.ixuni.cloudreve.driver.v4.client.V4Uris;
import win.ixuni.cloudreve.driver.v4.context.V4DriverContext;
import win.ixuni.cloudreve.driver.v4.handler.AbstractV4Handler;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * V4 移动处理器
 * <p>
 * Same directory with another leaf name becomes a rename; otherwise the source is moved
 * into the target directory, keeping its name.
 */
public class V4MoveHandler extends AbstractV4Handler<MoveOperation, Void> {

    @Override
    protected Mono<Void> doHandle(MoveOperation operation, V4DriverContext context) {
        String source = V4Uris.requireNotRoot(operation.getSource(), "move");
        String destination = V4Uris.canonicalPath(operation.getDestination());

        if (CloudrevePaths.isRenameInPlace(source, destination)) {
            return context.execute(new RenameOperation(source, CloudrevePaths.name(destination)));
        }

        String targetDir = CloudrevePaths.targetDirectory(source, destination);
        return context.getClient().move(List.of(V4Uris.pathToUri(source)), V4Uris.pathToUri(targetDir), false);
    }

    @Override
    public Class<MoveOperation> getOperationType() {
        return MoveOperation.class;
    }

    @Override
    public Set<Capability> getProvidedCapabilities() {
        return EnumSet.of(Capability.WRITE);
    }
}
