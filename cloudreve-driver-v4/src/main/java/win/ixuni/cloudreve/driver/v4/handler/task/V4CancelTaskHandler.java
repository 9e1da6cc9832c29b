package win.ixuni.cloudreve.driver.v4.handler.task;

import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudreve.core.operation.task.CancelTaskOperation;
import win.ixuni.cloudreve.core.util.CloudrevePaths;
import win.ixuni.cloudreve.driver.v4.context.V4DriverContext;
import win.ixuni.cloudreve.driver.v4.handler.AbstractV4Handler;

import java.util.EnumSet;
import java.util.Set;

public class V4CancelTaskHandler extends AbstractV4Handler<CancelTaskOperation, Void> {

    @Override
    protected Mono<Void> doHandle(CancelTaskOperation operation, V4DriverContext context) {
        return context.getClient().cancelDownload(CloudrevePaths.requireText(operation.getTaskId(), "taskId"));
    }

    @Override
    public Class<CancelTaskOperation> getOperationType() {
        return CancelTaskOperation.class;
    }

    @Override
    public Set<Capability> getProvidedCapabilities() {
        return EnumSet.of(Capability.REMOTE_DOWNLOAD);
    }
}
