package win.ixuni.cloudreve.driver.v4.handler.task;

import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudreve.core.model.TaskProgress;
import win.ixuni.cloudreve.core.operation.task.GetTaskProgressOperation;
import win.ixuni.cloudreve.core.util.CloudrevePaths;
import win.ixuni.cloudreve.driver.v4.context.V4DriverContext;
import win.ixuni.cloudreve.driver.v4.handler.AbstractV4Handler;

import java.util.EnumSet;
import java.util.Set;

public class V4GetTaskProgressHandler extends AbstractV4Handler<GetTaskProgressOperation, TaskProgress> {

    @Override
    protected Mono<TaskProgress> doHandle(GetTaskProgressOperation operation, V4DriverContext context) {
        String taskId = CloudrevePaths.requireText(operation.getTaskId(), "taskId");
        return context.getClient().progress(taskId)
                .map(progress -> progress.toTaskProgress(taskId));
    }

    @Override
    public Class<GetTaskProgressOperation> getOperationType() {
        return GetTaskProgressOperation.class;
    }

    @Override
    public Set<Capability> getProvidedCapabilities() {
        return EnumSet.of(Capability.WORKFLOW);
    }
}
