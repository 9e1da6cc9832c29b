package win.ixuni.cloudreve.driver.v3.handler.task;

import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudreve.core.exception.InvalidArgumentException;
import win.ixuni.cloudreve.core.model.TaskRecord;
import win.ixuni.cloudreve.core.operation.task.CreateRemoteDownloadOperation;
import win.ixuni.cloudreve.core.util.CloudrevePaths;
import win.ixuni.cloudreve.driver.v3.context.V3DriverContext;
import win.ixuni.cloudreve.driver.v3.handler.AbstractV3Handler;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * V3 离线下载
 * <p>
 * The legacy endpoint acknowledges without returning tasks, so the result is empty; use
 * {@code ListTasksOperation} to find them.
 */
public class V3CreateRemoteDownloadHandler extends AbstractV3Handler<CreateRemoteDownloadOperation, List<TaskRecord>> {

    @Override
    protected Mono<List<TaskRecord>> doHandle(CreateRemoteDownloadOperation operation, V3DriverContext context) {
        if (operation.getUrls() == null || operation.getUrls().isEmpty()) {
            throw new InvalidArgumentException("At least one URL is required");
        }
        String destination = CloudrevePaths.normalize(operation.getDestination());
        return context.getClient().createRemoteDownload(destination, operation.getUrls())
                .thenReturn(List.of());
    }

    @Override
    public Class<CreateRemoteDownloadOperation> getOperationType() {
        return CreateRemoteDownloadOperation.class;
    }

    @Override
    public Set<Capability> getProvidedCapabilities() {
        return EnumSet.of(Capability.REMOTE_DOWNLOAD);
    }
}
