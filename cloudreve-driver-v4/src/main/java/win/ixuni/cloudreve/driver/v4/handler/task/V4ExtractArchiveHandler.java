package win.ixuni.cloudreve.driver.v4.handler.task;

import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudreve.core.model.TaskRecord;
import win.ixuni.cloudreve.core.operation.task.ExtractArchiveOperation;
import win.ixuni.cloudreve.driver.v4.client.V4Uris;
import win.ixuni.cloudreve.driver.v4.context.V4DriverContext;
import win.ixuni.cloudreve.driver.v4.handler.AbstractV4Handler;
import win.ixuni.cloudreve.driver.v4.model.V4Task;

import java.util.EnumSet;
import java.util.Set;

public class V4ExtractArchiveHandler extends AbstractV4Handler<ExtractArchiveOperation, TaskRecord> {

    @Override
    protected Mono<TaskRecord> doHandle(ExtractArchiveOperation operation, V4DriverContext context) {
        String source = V4Uris.requireNotRoot(operation.getSource(), "extract");
        return context.getClient().extractArchive(V4Uris.pathToUri(source),
                        V4Uris.pathToUri(operation.getDestination()), operation.getPassword())
                .map(V4Task::toTaskRecord);
    }

    @Override
    public Class<ExtractArchiveOperation> getOperationType() {
        return ExtractArchiveOperation.class;
    }

    @Override
    public Set<Capability> getProvidedCapabilities() {
        return EnumSet.of(Capability.WORKFLOW);
    }
}
