package win.ixuni.cloudreve.driver.v3.handler.file;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudreve.core.model.BatchDeleteResult;
import win.ixuni.cloudreve.core.operation.file.BatchDeleteOperation;
import win.ixuni.cloudreve.core.util.CloudrevePaths;
import win.ixuni.cloudreve.driver.v3.context.V3DriverContext;
import win.ixuni.cloudreve.driver.v3.handler.AbstractV3Handler;
import win.ixuni.cloudreve.driver.v3.model.V3DirectoryList;
import win.ixuni.cloudreve.driver.v3.model.V3Object;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * V3 批量删除处理器
 * <p>
 * Targets are grouped by parent directory so each parent is listed once; the resolved IDs of
 * one group go out in a single delete call with separate {@code items} and {@code dirs} lists.
 * A target that does not resolve, or whose group delete fails, is reported as a failure
 * without stopping the other groups.
 */
@Slf4j
public class V3BatchDeleteHandler extends AbstractV3Handler<BatchDeleteOperation, BatchDeleteResult> {

    @Override
    protected Mono<BatchDeleteResult> doHandle(BatchDeleteOperation operation, V3DriverContext context) {
        BatchDeleteResult.BatchDeleteResultBuilder result = BatchDeleteResult.builder();
        Map<String, List<String>> byParent = new LinkedHashMap<>();

        for (String raw : operation.getPaths()) {
            String path = CloudrevePaths.normalize(raw);
            if (CloudrevePaths.isRoot(path)) {
                result.failure(new BatchDeleteResult.Failure(path, "Cannot delete root directory"));
                continue;
            }
            byParent.computeIfAbsent(CloudrevePaths.parent(path), key -> new ArrayList<>()).add(path);
        }

        return Flux.fromIterable(byParent.entrySet())
                .concatMap(group -> deleteGroup(group.getKey(), group.getValue(), context, result))
                .then(Mono.fromCallable(result::build))
                .doOnNext(report -> {
                    if (!report.isAllSucceeded()) {
                        log.warn("Batch delete finished with {} failure(s) out of {}",
                                report.getFailureCount(), operation.getPaths().size());
                    }
                });
    }

    private Mono<Void> deleteGroup(String parent, List<String> paths, V3DriverContext context,
                                   BatchDeleteResult.BatchDeleteResultBuilder result) {
        return context.getClient().listDirectory(parent)
                .flatMap(listing -> {
                    List<String> items = new ArrayList<>();
                    List<String> dirs = new ArrayList<>();
                    List<String> resolved = new ArrayList<>();
                    for (String path : paths) {
                        V3Object object = find(listing, path);
                        if (object == null) {
                            result.failure(new BatchDeleteResult.Failure(path, "File not found: " + path));
                            continue;
                        }
                        (object.isFolder() ? dirs : items).add(object.getId());
                        resolved.add(path);
                    }
                    if (resolved.isEmpty()) {
                        return Mono.empty();
                    }
                    return context.getClient().delete(items, dirs)
                            .then(Mono.fromRunnable(() -> resolved.forEach(result::deletedPath)))
                            .onErrorResume(e -> {
                                resolved.forEach(path -> result.failure(
                                        new BatchDeleteResult.Failure(path, e.getMessage())));
                                return Mono.empty();
                            });
                })
                .onErrorResume(e -> {
                    // 父目录列举失败：整组记为失败
                    paths.forEach(path -> result.failure(new BatchDeleteResult.Failure(path, e.getMessage())));
                    return Mono.empty();
                })
                .then();
    }

    private static V3Object find(V3DirectoryList listing, String path) {
        return listing.find(CloudrevePaths.name(path)).orElse(null);
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
