package win.ixuni.cloudreve.driver.v3.handler.task;

import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudreve.core.operation.task.CancelTaskOperation;
import win.ixuni.cloudreve.core.util.CloudrevePaths;
import win.ixuni.cloudreve.driver.v3.context.V3DriverContext;
import win.ixuni.cloudreve.driver.v3.handler.AbstractV3Handler;

import java.util.EnumSet;
import java.util.Set;

public class V3CancelTaskHandler extends AbstractV3Handler<CancelTaskOperation, Void> {

    @Override
    protected Mono<Void> doHandle(CancelTaskOperation operation, V3DriverContext context) {
        return context.getClient().cancelTask(CloudrevePaths.requireText(operation.getTaskId(), "taskId"));
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
