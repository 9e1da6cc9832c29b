package win.ixuni.cloudreve.driver.v4.handler.task;

import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudreve.core.exception.InvalidArgumentException;
import win.ixuni.cloudreve.core.model.TaskRecord;
import win.ixuni.cloudreve.core.operation.task.CreateRemoteDownloadOperation;
import win.ixuni.cloudreve.driver.v4.client.V4Uris;
import win.ixuni.cloudreve.driver.v4.context.V4DriverContext;
import win.ixuni.cloudreve.driver.v4.handler.AbstractV4Handler;
import win.ixuni.cloudreve.driver.v4.model.V4Task;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * V4 离线下载，每个 URL 对应一个任务
 */
public class V4CreateRemoteDownloadHandler extends AbstractV4Handler<CreateRemoteDownloadOperation, List<TaskRecord>> {

    @Override
    protected Mono<List<TaskRecord>> doHandle(CreateRemoteDownloadOperation operation, V4DriverContext context) {
        if (operation.getUrls() == null || operation.getUrls().isEmpty()) {
            throw new InvalidArgumentException("At least one URL is required");
        }
        return context.getClient().createRemoteDownload(V4Uris.pathToUri(operation.getDestination()), operation.getUrls())
                .map(tasks -> tasks.stream().map(V4Task::toTaskRecord).collect(Collectors.toList()));
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
