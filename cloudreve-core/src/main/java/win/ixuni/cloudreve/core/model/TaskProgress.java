package win.ixuni.cloudreve.core.model;

import lombok.Builder;
import lombok.Value;

/**
 * Progress snapshot of one task
 */
@Value
@Builder
public class TaskProgress {

    String taskId;

    double progress;

    String message;

    Long total;

    Long current;
}
