package verifier.exceptions;

import verifier.model.HeapObjectRef;

/**
 * Thrown when the host snapshot cache breaks its structural contract, for
 * example when a recorded referrer is itself missing from the cache.
 *
 * <p>This indicates a defect in the collaborator that built the snapshot, not a
 * verification finding. It is unchecked and is never caught by the verifier.
 *
 * @see verifier.trace.RootTracer
 * @see verifier.host.InMemorySnapshotCache
 */
public class SnapshotIntegrityException extends RuntimeException {

    /** Safe diagnostic representation of the object involved */
    private final String objectIdStr;

    /**
     * Creates a new exception with a message.
     *
     * @param message the error message
     */
    public SnapshotIntegrityException(String message) {
        super(message);
        this.objectIdStr = null;
    }

    /**
     * Creates a new exception with diagnostic context.
     *
     * @param message the error message
     * @param object the object whose entry is inconsistent (will be safely described)
     */
    public SnapshotIntegrityException(String message, HeapObjectRef object) {
        super(message);
        this.objectIdStr = safeDescribe(object);
    }

    private static String safeDescribe(HeapObjectRef o) {
        if (o == null) return "null";
        try {
            return o.identity() + " " + o.ownerClass().name();
        } catch (RuntimeException e) {
            return "[describe failed: " + e.getClass().getSimpleName() + "]";
        }
    }

    /**
     * Returns a safe string representation of the offending object.
     *
     * @return the object description, or null if not set
     */
    public String getObjectIdStr() {
        return objectIdStr;
    }

    @Override
    public String getMessage() {
        String base = super.getMessage();
        return objectIdStr == null ? base : base + " [object=" + objectIdStr + "]";
    }
}
