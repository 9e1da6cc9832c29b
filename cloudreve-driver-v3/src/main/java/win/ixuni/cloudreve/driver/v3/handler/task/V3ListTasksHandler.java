package win.ixuni.cloudreve.driver.v3.handler.task;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudreve.core.exception.InvalidArgumentException;
import win.ixuni.cloudreve.core.model.TaskRecord;
import win.ixuni.cloudreve.core.operation.task.ListTasksOperation;
import win.ixuni.cloudreve.driver.v3.client.V3ApiClient;
import win.ixuni.cloudreve.driver.v3.context.V3DriverContext;
import win.ixuni.cloudreve.driver.v3.handler.AbstractV3Handler;
import win.ixuni.cloudreve.driver.v3.model.V3Aria2Task;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * V3 任务列表
 * <p>
 * Categories: {@code downloading}, {@code downloaded}, or {@code general} (both, running
 * first). Page size does not apply.
 */
public class V3ListTasksHandler extends AbstractV3Handler<ListTasksOperation, List<TaskRecord>> {

    @Override
    protected Mono<List<TaskRecord>> doHandle(ListTasksOperation operation, V3DriverContext context) {
        V3ApiClient client = context.getClient();
        String category = operation.getCategory() == null ? "general" : operation.getCategory();
        Flux<V3Aria2Task> tasks;
        switch (category) {
            case "downloading":
                tasks = client.downloading().flatMapIterable(list -> list);
                break;
            case "downloaded":
            case "finished":
                tasks = client.finished().flatMapIterable(list -> list);
                break;
            case "general":
                tasks = client.downloading().flatMapIterable(list -> list)
                        .concatWith(client.finished().flatMapIterable(list -> list));
                break;
            default:
                throw new InvalidArgumentException("Unknown task category: " + category);
        }
        return tasks.map(V3Aria2Task::toTaskRecord).collectList();
    }

    @Override
    public Class<ListTasksOperation> getOperationType() {
        return ListTasksOperation.class;
    }

    @Override
    public Set<Capability> getProvidedCapabilities() {
        return EnumSet.of(Capability.REMOTE_DOWNLOAD);
    }
}
