package win.ixuni.cloudreve.core.operation.task;

import lombok.Value;
import win.ixuni.cloudreve.core.model.TaskRecord;
import win.ixuni.cloudreve.core.operation.Operation;

import java.util.List;

/**
 * Asks the server to fetch URLs into a directory
 */
@Value
public class CreateRemoteDownloadOperation implements Operation<List<TaskRecord>> {

    /**
     * Target directory
     */
    String destination;

    List<String> urls;
}
