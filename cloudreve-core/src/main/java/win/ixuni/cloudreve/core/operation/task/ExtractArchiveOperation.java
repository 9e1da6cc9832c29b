package win.ixuni.cloudreve.core.operation.task;

import lombok.Value;
import win.ixuni.cloudreve.core.model.TaskRecord;
import win.ixuni.cloudreve.core.operation.Operation;

/**
 * Extracts an archive
 */
@Value
public class ExtractArchiveOperation implements Operation<TaskRecord> {

    String source;

    /**
     * Target directory
     */
    String destination;

    /**
     * Null for unencrypted archives
     */
    String password;
}
