package win.ixuni.cloudreve.core.exception;

import lombok.Getter;

/**
 * A path could not be resolved to a server-side object
 */
@Getter
public class ResourceNotFoundException extends CloudreveException {

    private final String path;

    public ResourceNotFoundException(String path) {
        this(path, "File not found: " + path);
    }

    public ResourceNotFoundException(String path, String message) {
        super("NotFound", message);
        this.path = path;
    }
}
