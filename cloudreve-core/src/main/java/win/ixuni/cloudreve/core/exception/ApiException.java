package win.ixuni.cloudreve.core.exception;

import lombok.Getter;

/**
 * Error reported by the server
 * <p>
 * {@code code} is the envelope code when the body carried one, otherwise the HTTP status.
 */
@Getter
public class ApiException extends CloudreveException {

    private final int code;
    private final int httpStatus;

    public ApiException(int code, String message, int httpStatus) {
        super("ApiError", message);
        this.code = code;
        this.httpStatus = httpStatus;
    }

    @Override
    public String toString() {
        return "ApiException{code=" + code + ", httpStatus=" + httpStatus + ", message=" + getMessage() + "}";
    }
}
