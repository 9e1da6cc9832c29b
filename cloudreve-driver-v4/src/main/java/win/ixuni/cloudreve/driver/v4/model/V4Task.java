package win.ixuni.cloudreve.driver.v4.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;
import lombok.NoArgsConstructor;
import win.ixuni.cloudreve.core.model.TaskRecord;
import win.ixuni.cloudreve.core.model.TaskStatus;

/**
 * V4 工作流任务
 */
@Data
@NoArgsConstructor
public class V4Task {

    private String id;

    private String name;

    private String status;

    private String type;

    @JsonProperty("created_at")
    private String createdAt;

    @JsonProperty("updated_at")
    private String updatedAt;

    private String error;

    private JsonNode summary;

    public TaskRecord toTaskRecord() {
        return TaskRecord.builder()
                .id(id)
                .type(type)
                .status(TaskStatus.fromValue(status))
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .error(error == null || error.isEmpty() ? null : error)
                .build();
    }
}
