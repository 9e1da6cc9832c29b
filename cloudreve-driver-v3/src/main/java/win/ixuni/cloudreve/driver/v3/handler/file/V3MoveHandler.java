package win.ixuni.cloudreve.driver.v3.handler.file;

import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudreve.core.operation.file.MoveOperation;
import win.ixuni.cloudreve.core.operation.file.RenameOperation;
import win.ixuni.cloudreve.core.util.CloudrevePaths;
import win.ixuni.cloudreve.driver.v3.context.V3DriverContext;
import win.ixuni.cloudreve.driver.v3.handler.AbstractV3Handler;
import win.ixuni.cloudreve.driver.v3.model.V3Requests;

import java.util.EnumSet;
import java.util.Set;

/**
 * V3 移动处理器
 * <p>
 * Same directory with another leaf name becomes a rename; otherwise the object is moved into
 * the target directory by ID.
 */
public class V3MoveHandler extends AbstractV3Handler<MoveOperation, Void> {

    @Override
    protected Mono<Void> doHandle(MoveOperation operation, V3DriverContext context) {
        String source = CloudrevePaths.requireNotRoot(operation.getSource(), "move");
        String destination = CloudrevePaths.normalize(operation.getDestination());

        if (CloudrevePaths.isRenameInPlace(source, destination)) {
            return context.execute(new RenameOperation(source, CloudrevePaths.name(destination)));
        }

        String targetDir = CloudrevePaths.targetDirectory(source, destination);
        return context.getResolver().resolve(source)
                .flatMap(object -> context.getClient().move(
                        CloudrevePaths.parent(source), V3Requests.SourceItems.of(object), targetDir));
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
