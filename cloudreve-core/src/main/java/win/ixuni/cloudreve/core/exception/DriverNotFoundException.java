package win.ixuni.cloudreve.core.exception;

/**
 * Driver not found exception
 * <p>
 * No {@code DriverFactory} is registered for the requested driver type.
 */
public class DriverNotFoundException extends CloudreveException {

    public DriverNotFoundException(String driverType) {
        super("DriverNotFound", "No driver registered for type: " + driverType);
    }
}
