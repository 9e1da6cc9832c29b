package win.ixuni.cloudreve.core.exception;

/**
 * Neither protocol endpoint answered the liveness probe
 */
public class VersionDetectionException extends CloudreveException {

    public VersionDetectionException(String baseUrl, Throwable lastError) {
        super("VersionDetectionFailed",
                "Could not detect API version. Neither V3 nor V4 endpoints responded. (" + baseUrl + ")",
                lastError);
    }
}
