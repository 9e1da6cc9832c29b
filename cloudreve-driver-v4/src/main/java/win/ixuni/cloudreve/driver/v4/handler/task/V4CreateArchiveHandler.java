package win.ixuni.cloudreve.driver.v4.handler.task;

import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudreve.core.exception.InvalidArgumentException;
import win.ixuni.cloudreve.core.model.TaskRecord;
import win.ixuni.cloudreve.core.operation.task.CreateArchiveOperation;
import win.ixuni.cloudreve.driver.v4.client.V4Uris;
import win.ixuni.cloudreve.driver.v4.context.V4DriverContext;
import win.ixuni.cloudreve.driver.v4.handler.AbstractV4Handler;
import win.ixuni.cloudreve.driver.v4.model.V4Task;

import java.util.EnumSet;
import java.util.Set;

/**
 * V4 压缩任务，目标为压缩包路径
 */
public class V4CreateArchiveHandler extends AbstractV4Handler<CreateArchiveOperation, TaskRecord> {

    @Override
    protected Mono<TaskRecord> doHandle(CreateArchiveOperation operation, V4DriverContext context) {
        if (operation.getSources() == null || operation.getSources().isEmpty()) {
            throw new InvalidArgumentException("Nothing to archive");
        }
        String destination = V4Uris.requireNotRoot(operation.getDestination(), "archive to");
        return context.getClient().createArchive(V4Uris.pathsToUris(operation.getSources()), V4Uris.pathToUri(destination))
                .map(V4Task::toTaskRecord);
    }

    @Override
    public Class<CreateArchiveOperation> getOperationType() {
        return CreateArchiveOperation.class;
    }

    @Override
    public Set<Capability> getProvidedCapabilities() {
        return EnumSet.of(Capability.WORKFLOW);
    }
}
