package win.ixuni.cloudreve.core.exception;

/**
 * Invalid caller input detected before any request is sent
 */
public class InvalidArgumentException extends CloudreveException {

    public InvalidArgumentException(String message) {
        super("InvalidArgument", message);
    }

    protected InvalidArgumentException(String errorCode, String message) {
        super(errorCode, message);
    }
}
