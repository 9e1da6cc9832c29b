package win.ixuni.cloudreve.core.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Status of a server-side task
 */
@Getter
@RequiredArgsConstructor
public enum TaskStatus {

    QUEUED("queued"),
    PROCESSING("processing"),
    SUSPENDING("suspending"),
    ERROR("error"),
    CANCELED("canceled"),
    COMPLETED("completed"),

    /**
     * Status value this client does not know
     */
    UNKNOWN("unknown");

    private final String value;

    public static TaskStatus fromValue(String value) {
        if (value != null) {
            for (TaskStatus status : values()) {
                if (status.value.equalsIgnoreCase(value)) {
                    return status;
                }
            }
        }
        return UNKNOWN;
    }

    public boolean isTerminal() {
        return this == ERROR || this == CANCELED || this == COMPLETED;
    }
}
