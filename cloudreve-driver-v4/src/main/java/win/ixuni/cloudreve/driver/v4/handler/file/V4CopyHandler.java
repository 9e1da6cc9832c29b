package win.ixuni.cloudreve.driver.v4.handler.file;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudreve.core.model.FileInfo;
import win.ixuni.cloudreve.core.operation.file.CopyOperation;
import win.ixuni.cloudreve.core.operation.file.CreateDirectoryOperation;
import win.ixuni.cloudreve.core.operation.file.DeleteOperation;
import win.ixuni.cloudreve.core.operation.file.GetFileInfoOperation;
import win.ixuni.cloudreve.core.operation.file.MoveOperation;
import win.ixuni.cloudreve.core.operation.file.RenameOperation;
import win.ixuni.cloudreve.core.util.CloudrevePaths;
import win.ixuni.cloudreve.driver.v4.client.V4Uris;
import win.ixuni.cloudreve.driver.v4.context.V4DriverContext;
import win.ixuni.cloudreve.driver.v4.handler.AbstractV4Handler;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * V4 复制处理器
 * <p>
 * The server copies only into a directory and keeps the source name. A destination naming an
 * existing folder next to the source is a plain copy into that folder. Any other copy inside the
 * same directory under another name is built from smaller steps:
 * <ol>
 *   <li>delete an existing destination file</li>
 *   <li>create a uniquely named temporary directory next to the destination</li>
 *   <li>copy the source into it</li>
 *   <li>rename the copy to an intermediate name</li>
 *   <li>move it into the destination directory</li>
 *   <li>rename it to the destination name</li>
 *   <li>remove the temporary directory (best-effort)</li>
 * </ol>
 * Nothing is rolled back: a failure after step 2 leaves the temporary directory behind.
 */
@Slf4j
public class V4CopyHandler extends AbstractV4Handler<CopyOperation, Void> {

    @Override
    protected Mono<Void> doHandle(CopyOperation operation, V4DriverContext context) {
        String source = V4Uris.requireNotRoot(operation.getSource(), "copy");
        String destination = V4Uris.canonicalPath(operation.getDestination());

        if (CloudrevePaths.isRenameInPlace(source, destination)) {
            return lookup(destination, context).flatMap(existing -> {
                if (existing.isPresent() && existing.get().isFolder()) {
                    return copyInto(source, destination, context);
                }
                return copyWithRename(source, destination, existing.isPresent(), context);
            });
        }
        return copyInto(source, CloudrevePaths.targetDirectory(source, destination), context);
    }

    private Mono<Void> copyInto(String source, String targetDir, V4DriverContext context) {
        return context.getClient().move(List.of(V4Uris.pathToUri(source)), V4Uris.pathToUri(targetDir), true);
    }

    /**
     * A failed lookup counts as absent
     */
    private Mono<Optional<FileInfo>> lookup(String destination, V4DriverContext context) {
        return Mono.defer(() -> context.execute(new GetFileInfoOperation(destination)))
                .map(Optional::of)
                .onErrorResume(e -> Mono.just(Optional.empty()))
                .defaultIfEmpty(Optional.empty());
    }

    private Mono<Void> copyWithRename(String source, String destination, boolean replace, V4DriverContext context) {
        String destDir = CloudrevePaths.parent(destination);
        String destName = CloudrevePaths.name(destination);
        String shortId = UUID.randomUUID().toString().substring(0, 8);
        String tempDir = CloudrevePaths.join(destDir,
                context.getTempDirPrefix() + UUID.randomUUID());
        String intermediateName = destName + ".tmp-" + shortId;
        String intermediate = CloudrevePaths.join(tempDir, intermediateName);
        log.debug("Copying {} to {} through {}", source, destination, tempDir);

        Mono<Void> steps = Mono.defer(() -> context.execute(new CreateDirectoryOperation(tempDir)))
                .then(Mono.defer(() -> context.getClient().move(
                        List.of(V4Uris.pathToUri(source)), V4Uris.pathToUri(tempDir), true)))
                .then(Mono.defer(() -> context.execute(new RenameOperation(
                        CloudrevePaths.join(tempDir, CloudrevePaths.name(source)), intermediateName))))
                .then(Mono.defer(() -> context.execute(new MoveOperation(intermediate, destDir))))
                .then(Mono.defer(() -> context.execute(new RenameOperation(
                        CloudrevePaths.join(destDir, intermediateName), destName))))
                .doOnError(e -> log.warn("Copy of {} to {} failed, temporary directory {} may be left behind: {}",
                        source, destination, tempDir, e.getMessage()));

        Mono<Void> clear = replace ? deleteExisting(destination, context) : Mono.empty();
        return clear
                .then(steps)
                .then(Mono.defer(() -> context.execute(new DeleteOperation(tempDir)))
                        .onErrorResume(e -> {
                            log.warn("Could not remove temporary directory {}: {}", tempDir, e.getMessage());
                            return Mono.empty();
                        }));
    }

    /**
     * A failed delete is only logged
     */
    private Mono<Void> deleteExisting(String destination, V4DriverContext context) {
        log.debug("Replacing existing {}", destination);
        return Mono.defer(() -> context.execute(new DeleteOperation(destination)))
                .onErrorResume(e -> {
                    log.warn("Could not delete existing {}: {}", destination, e.getMessage());
                    return Mono.empty();
                });
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
