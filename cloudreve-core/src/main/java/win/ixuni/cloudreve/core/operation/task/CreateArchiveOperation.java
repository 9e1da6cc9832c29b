package win.ixuni.cloudreve.core.operation.task;

import lombok.Value;
import win.ixuni.cloudreve.core.model.TaskRecord;
import win.ixuni.cloudreve.core.operation.Operation;

import java.util.List;

/**
 * Compresses files into an archive
 */
@Value
public class CreateArchiveOperation implements Operation<TaskRecord> {

    List<String> sources;

    /**
     * Path of the archive to create
     */
    String destination;
}
