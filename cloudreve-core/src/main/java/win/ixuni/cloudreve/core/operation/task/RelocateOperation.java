package win.ixuni.cloudreve.core.operation.task;

import lombok.Value;
import win.ixuni.cloudreve.core.model.TaskRecord;
import win.ixuni.cloudreve.core.operation.Operation;

import java.util.List;

/**
 * Moves file blobs to another storage policy
 */
@Value
public class RelocateOperation implements Operation<TaskRecord> {

    List<String> sources;

    String policyId;
}
