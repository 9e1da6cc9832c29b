package win.ixuni.cloudreve.core.exception;

/**
 * Credentials were requested before a login or an explicit token set
 */
public class NotAuthenticatedException extends CloudreveException {

    public NotAuthenticatedException(String message) {
        super("NotAuthenticated", message);
    }
}
