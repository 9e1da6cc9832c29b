package win.ixuni.cloudreve.core.exception;

/**
 * A value expected to be a canonical resource URI lacks the URI prefix
 */
public class InvalidUriException extends InvalidArgumentException {

    public InvalidUriException(String uri, String expectedPrefix) {
        super("InvalidUri", "Invalid URI format: " + uri + " (expected prefix " + expectedPrefix + ")");
    }
}
