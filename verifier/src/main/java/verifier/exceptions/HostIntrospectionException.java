package verifier.exceptions;

/**
 * Thrown when the host cannot introspect a class or field it has already
 * reported as available, e.g. a static field that became unreadable.
 *
 * <p>This is a defect in the host collaborator. It is unchecked and the
 * verifier does not catch it.
 */
public class HostIntrospectionException extends RuntimeException {

    public HostIntrospectionException(String message) {
        super(message);
    }

    public HostIntrospectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
