package win.ixuni.cloudreve.core.model;

import lombok.Builder;
import lombok.Value;

/**
 * Long-running server-side operation (archive, extract, remote download, relocate)
 * <p>
 * Returned as soon as the server accepted the task; polling is up to the caller.
 */
@Value
@Builder
public class TaskRecord {

    String id;

    /**
     * Server task type, e.g. "create_archive" or "remote_download"
     */
    String type;

    TaskStatus status;

    String createdAt;

    String updatedAt;

    String error;

    /**
     * Completion ratio in [0, 1], null when unknown
     */
    Double progress;
}
