package verifier.model;

import java.util.Objects;

/**
 * An archived object together with the object through which it was reached
 * when the snapshot was built.
 *
 * <p>A null {@code referrer} marks a snapshot root. Referrer links form a
 * tree over the snapshot's objects.
 *
 * @param object the archived object
 * @param referrer the parent object, or null for a root
 */
public record SnapshotEntry(HeapObjectRef object, HeapObjectRef referrer) {

    public SnapshotEntry {
        Objects.requireNonNull(object, "object");
    }

    /** Creates a root entry. */
    public static SnapshotEntry root(HeapObjectRef object) {
        return new SnapshotEntry(object, null);
    }

    /** Returns true if this entry has no recorded referrer. */
    public boolean isRoot() {
        return referrer == null;
    }
}
