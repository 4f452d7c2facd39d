package at.sv.huebridge.resource;

/**
 * The ownership of a resource points to an id the store does not know. The mirror is inconsistent; this is never
 * silently ignored.
 */
public final class MissingResourceException extends RuntimeException {
    public MissingResourceException(String message) {
        super(message);
    }
}
