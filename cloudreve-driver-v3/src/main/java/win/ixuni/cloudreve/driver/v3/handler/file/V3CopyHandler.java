package win.ixuni.cloudreve.driver.v3.handler.file;

import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.driver.ApiVersion;
import win.ixuni.cloudreve.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudreve.core.exception.OperationNotSupportedException;
import win.ixuni.cloudreve.core.exception.ResourceNotFoundException;
import win.ixuni.cloudreve.core.operation.file.CopyOperation;
import win.ixuni.cloudreve.core.util.CloudrevePaths;
import win.ixuni.cloudreve.driver.v3.context.V3DriverContext;
import win.ixuni.cloudreve.driver.v3.handler.AbstractV3Handler;
import win.ixuni.cloudreve.driver.v3.model.V3Object;
import win.ixuni.cloudreve.driver.v3.model.V3Requests;

import java.util.EnumSet;
import java.util.Set;

/**
 * V3 复制处理器
 * <p>
 * The legacy copy keeps the source name. A destination naming an existing folder next to the
 * source is a copy into that folder; any other copy into the same directory under another name
 * has no V3 equivalent.
 */
public class V3CopyHandler extends AbstractV3Handler<CopyOperation, Void> {

    @Override
    protected Mono<Void> doHandle(CopyOperation operation, V3DriverContext context) {
        String source = CloudrevePaths.requireNotRoot(operation.getSource(), "copy");
        String destination = CloudrevePaths.normalize(operation.getDestination());

        if (CloudrevePaths.isRenameInPlace(source, destination)) {
            return context.getResolver().resolve(destination)
                    .map(V3Object::isFolder)
                    .onErrorResume(ResourceNotFoundException.class, e -> Mono.just(false))
                    .flatMap(folder -> folder
                            ? copyInto(source, destination, context)
                            : Mono.<Void>error(new OperationNotSupportedException("CopyWithRename", ApiVersion.V3)));
        }
        return copyInto(source, CloudrevePaths.targetDirectory(source, destination), context);
    }

    private Mono<Void> copyInto(String source, String targetDir, V3DriverContext context) {
        return context.getResolver().resolve(source)
                .flatMap(object -> context.getClient().copy(
                        CloudrevePaths.parent(source), V3Requests.SourceItems.of(object), targetDir));
    }

    @Override
    public Class<CopyOperation> getOperationType() {
        return CopyOperation.class;
    }

    @Override
    public Set<Capability> getProvidedCapabilities() {
        return EnumSet.of(Capability.COPY);
    }
}
