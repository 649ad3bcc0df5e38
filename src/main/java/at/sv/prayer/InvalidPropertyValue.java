package at.sv.prayer;

/**
 * Signals a configuration value that could not be parsed, e.g. an unknown calculation method name.
 */
public final class InvalidPropertyValue extends RuntimeException {
    public InvalidPropertyValue(String message) {
        super(message);
    }
}
