package win.ixuni.cloudreve.driver.v4.handler.task;

import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudreve.core.exception.InvalidArgumentException;
import win.ixuni.cloudreve.core.model.TaskRecord;
import win.ixuni.cloudreve.core.operation.task.RelocateOperation;
import win.ixuni.cloudreve.core.util.CloudrevePaths;
import win.ixuni.cloudreve.driver.v4.client.V4Uris;
import win.ixuni.cloudreve.driver.v4.context.V4DriverContext;
import win.ixuni.cloudreve.driver.v4.handler.AbstractV4Handler;
import win.ixuni.cloudreve.driver.v4.model.V4Task;

import java.util.EnumSet;
import java.util.Set;

/**
 * V4 存储策略迁移
 * <p>
 * Moves the stored blobs of the sources to another storage policy; paths stay the same.
 */
public class V4RelocateHandler extends AbstractV4Handler<RelocateOperation, TaskRecord> {

    @Override
    protected Mono<TaskRecord> doHandle(RelocateOperation operation, V4DriverContext context) {
        if (operation.getSources() == null || operation.getSources().isEmpty()) {
            throw new InvalidArgumentException("Nothing to relocate");
        }
        String policyId = CloudrevePaths.requireText(operation.getPolicyId(), "policyId");
        return context.getClient().relocate(V4Uris.pathsToUris(operation.getSources()), policyId)
                .map(V4Task::toTaskRecord);
    }

    @Override
    public Class<RelocateOperation> getOperationType() {
        return RelocateOperation.class;
    }

    @Override
    public Set<Capability> getProvidedCapabilities() {
        return EnumSet.of(Capability.WORKFLOW);
    }
}
