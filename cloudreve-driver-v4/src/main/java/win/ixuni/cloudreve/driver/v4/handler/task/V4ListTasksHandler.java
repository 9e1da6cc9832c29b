package win.ixuni.cloudreve.driver.v4.handler.task;

import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudreve.core.model.TaskRecord;
import win.ixuni.cloudreve.core.operation.task.ListTasksOperation;
import win.ixuni.cloudreve.driver.v4.context.V4DriverContext;
import win.ixuni.cloudreve.driver.v4.handler.AbstractV4Handler;
import win.ixuni.cloudreve.driver.v4.model.V4Task;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * V4 任务列表（第一页），默认 general 分类
 */
public class V4ListTasksHandler extends AbstractV4Handler<ListTasksOperation, List<TaskRecord>> {

    static final String DEFAULT_CATEGORY = "general";

    @Override
    protected Mono<List<TaskRecord>> doHandle(ListTasksOperation operation, V4DriverContext context) {
        String category = operation.getCategory() != null ? operation.getCategory() : DEFAULT_CATEGORY;
        int pageSize = operation.getPageSize() != null ? operation.getPageSize() : context.getListPageSize();
        return context.getClient().tasks(pageSize, category)
                .map(page -> page.getTasks().stream().map(V4Task::toTaskRecord).collect(Collectors.toList()));
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
