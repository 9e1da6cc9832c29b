package win.ixuni.cloudreve.core.exception;

/**
 * Malformed JSON, schema mismatch or a missing payload where one was expected
 */
public class DecodeException extends CloudreveException {

    public DecodeException(String message) {
        super("DecodeError", message);
    }

    public DecodeException(String message, Throwable cause) {
        super("DecodeError", message, cause);
    }
}
