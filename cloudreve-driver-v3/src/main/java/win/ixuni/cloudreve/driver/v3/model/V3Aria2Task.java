package win.ixuni.cloudreve.driver.v3.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;
import lombok.NoArgsConstructor;
import win.ixuni.cloudreve.core.model.TaskRecord;
import win.ixuni.cloudreve.core.model.TaskStatus;

/**
 * 离线下载任务
 * <p>
 * {@code status} is an aria2 state number on most servers, a status word on some.
 */
@Data
@NoArgsConstructor
public class V3Aria2Task {

    public static final String TYPE = "remote_download";

    private static final TaskStatus[] ARIA2_STATES = {
            TaskStatus.QUEUED,
            TaskStatus.PROCESSING,
            TaskStatus.SUSPENDING,
            TaskStatus.ERROR,
            TaskStatus.COMPLETED,
            TaskStatus.CANCELED
    };

    private String id;

    private String gid;

    private String name;

    private String url;

    private JsonNode status;

    private double progress;

    private long total;

    private long downloaded;

    @JsonProperty("created_at")
    private String createdAt;

    @JsonProperty("update")
    private String updatedAt;

    private String error;

    public TaskRecord toTaskRecord() {
        return TaskRecord.builder()
                .id(gid != null ? gid : id)
                .type(TYPE)
                .status(toStatus(status))
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .error(error == null || error.isEmpty() ? null : error)
                .progress(progressRatio())
                .build();
    }

    private Double progressRatio() {
        if (total > 0) {
            return (double) downloaded / total;
        }
        return progress > 1 ? progress / 100 : progress;
    }

    static TaskStatus toStatus(JsonNode status) {
        if (status == null || status.isNull()) {
            return TaskStatus.UNKNOWN;
        }
        String text = status.asText();
        if (status.isInt() || text.matches("\\d+")) {
            int code = Integer.parseInt(text);
            return code < ARIA2_STATES.length ? ARIA2_STATES[code] : TaskStatus.UNKNOWN;
        }
        return TaskStatus.fromValue(text);
    }
}
