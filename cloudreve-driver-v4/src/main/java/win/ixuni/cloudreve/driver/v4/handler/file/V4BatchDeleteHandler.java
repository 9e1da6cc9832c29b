package win.ixuni.cloudreve.driver.v4.handler.file;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudreve.core.exception.InvalidArgumentException;
import win.ixuni.cloudreve.core.model.BatchDeleteResult;
import win.ixuni.cloudreve.core.operation.file.BatchDeleteOperation;
import win.ixuni.cloudreve.core.util.CloudrevePaths;
import win.ixuni.cloudreve.driver.v4.client.V4ApiClient;
import win.ixuni.cloudreve.driver.v4.client.V4Uris;
import win.ixuni.cloudreve.driver.v4.context.V4DriverContext;
import win.ixuni.cloudreve.driver.v4.handler.AbstractV4Handler;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * V4 批量删除处理器
 * <p>
 * All targets go out in one delete call. When the server rejects the batch, each target is
 * retried on its own so the result can say which paths failed.
 */
@Slf4j
public class V4BatchDeleteHandler extends AbstractV4Handler<BatchDeleteOperation, BatchDeleteResult> {

    @Override
    protected Mono<BatchDeleteResult> doHandle(BatchDeleteOperation operation, V4DriverContext context) {
        BatchDeleteResult.BatchDeleteResultBuilder result = BatchDeleteResult.builder();
        List<String> targets = new ArrayList<>();

        for (String raw : operation.getPaths()) {
            String path;
            try {
                path = V4Uris.canonicalPath(raw);
            } catch (InvalidArgumentException e) {
                result.failure(new BatchDeleteResult.Failure(raw, e.getMessage()));
                continue;
            }
            if (CloudrevePaths.isRoot(path)) {
                result.failure(new BatchDeleteResult.Failure(raw, "Cannot delete root directory"));
                continue;
            }
            targets.add(path);
        }
        if (targets.isEmpty()) {
            return Mono.fromCallable(result::build);
        }

        V4ApiClient client = context.getClient();
        List<String> uris = targets.stream().map(V4Uris::pathToUri).collect(Collectors.toList());
        return client.delete(uris)
                .then(Mono.fromRunnable(() -> targets.forEach(result::deletedPath)))
                .onErrorResume(e -> {
                    log.warn("Batch delete of {} path(s) rejected ({}), deleting one by one", targets.size(), e.getMessage());
                    return deleteEach(client, targets, result);
                })
                .then(Mono.fromCallable(result::build));
    }

    private Mono<Void> deleteEach(V4ApiClient client, List<String> targets,
                                  BatchDeleteResult.BatchDeleteResultBuilder result) {
        return Flux.fromIterable(targets)
                .concatMap(path -> client.delete(List.of(V4Uris.pathToUri(path)))
                        .then(Mono.fromRunnable(() -> result.deletedPath(path)))
                        .onErrorResume(e -> {
                            result.failure(new BatchDeleteResult.Failure(path, e.getMessage()));
                            return Mono.empty();
                        }))
                .then();
    }

    @Override
    public Class<BatchDeleteOperation> getOperationType() {
        return BatchDeleteOperation.class;
    }

    @Override
    public Set<Capability> getProvidedCapabilities() {
        return EnumSet.of(Capability.BATCH_DELETE);
    }
}
