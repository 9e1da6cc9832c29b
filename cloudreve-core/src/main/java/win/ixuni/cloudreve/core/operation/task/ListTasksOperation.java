package win.ixuni.cloudreve.core.operation.task;

import lombok.Value;
import win.ixuni.cloudreve.core.model.TaskRecord;
import win.ixuni.cloudreve.core.operation.Operation;

import java.util.List;

/**
 * 列出任务
 */
@Value
public class ListTasksOperation implements Operation<List<TaskRecord>> {

    /**
     * V4 category (general, downloading, downloaded); null means general
     */
    String category;

    Integer pageSize;
}
