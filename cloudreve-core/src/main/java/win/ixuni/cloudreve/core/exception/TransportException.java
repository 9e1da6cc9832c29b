package win.ixuni.cloudreve.core.exception;

/**
 * Connection, DNS or timeout failure reported by the HTTP transport
 */
public class TransportException extends CloudreveException {

    public TransportException(String message, Throwable cause) {
        super("TransportError", "Transport failure: " + message, cause);
    }
}
