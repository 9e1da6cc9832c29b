package win.ixuni.cloudreve.core.exception;

import lombok.Getter;
import win.ixuni.cloudreve.core.driver.ApiVersion;

/**
 * Operation not supported exception
 * <p>
 * Thrown when the active protocol version has no equivalent of the requested operation,
 * e.g. WebDAV account mutation on a V3 server.
 */
@Getter
public class OperationNotSupportedException extends CloudreveException {

    private final String operation;
    private final ApiVersion apiVersion;

    public OperationNotSupportedException(String operation, ApiVersion apiVersion) {
        super("NotImplemented",
                String.format("The operation '%s' is not supported by the %s API", operation, apiVersion));
        this.operation = operation;
        this.apiVersion = apiVersion;
    }
}
