package win.ixuni.cloudreve.driver.v4.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import win.ixuni.cloudreve.core.model.TaskProgress;

/**
 * Response of {@code GET /workflow/progress/{id}}
 * <p>
 * Servers report either byte counters ({@code total}, {@code current}) or a ratio with a message.
 */
@Data
@NoArgsConstructor
public class V4Progress {

    private Long total;

    private Long current;

    private String identifier;

    private Double progress;

    private String message;

    public TaskProgress toTaskProgress(String taskId) {
        double ratio;
        if (total != null && total > 0 && current != null) {
            ratio = (double) current / total;
        } else if (progress != null) {
            ratio = progress > 1 ? progress / 100 : progress;
        } else {
            ratio = 0;
        }
        return TaskProgress.builder()
                .taskId(taskId)
                .progress(ratio)
                .message(message != null ? message : identifier)
                .total(total)
                .current(current)
                .build();
    }
}
