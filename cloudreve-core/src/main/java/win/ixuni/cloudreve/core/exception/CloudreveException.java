package win.ixuni.cloudreve.core.exception;

import lombok.Getter;

/**
 * Base exception of the Cloudreve client
 * <p>
 * Every failure surfaced by a driver or the facade is a subclass; {@code errorCode}
 * names its category for callers that prefer string matching over instanceof.
 */
@Getter
public class CloudreveException extends RuntimeException {

    private final String errorCode;

    public CloudreveException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public CloudreveException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
