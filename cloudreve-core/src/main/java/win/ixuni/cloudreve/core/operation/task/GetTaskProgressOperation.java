package win.ixuni.cloudreve.core.operation.task;

import lombok.Value;
import win.ixuni.cloudreve.core.model.TaskProgress;
import win.ixuni.cloudreve.core.operation.Operation;

/**
 * Progress of one task
 */
@Value
public class GetTaskProgressOperation implements Operation<TaskProgress> {

    String taskId;
}
