package verifier.host;

import verifier.model.HeapObjectRef;
import verifier.model.SnapshotEntry;

import java.util.function.Consumer;

/**
 * The host's cache of archived heap objects and their recorded referrers.
 *
 * <p>The cache must not change while the verifier iterates it.
 *
 * @see verifier.check.SnapshotCrossChecker
 * @see verifier.trace.RootTracer
 */
public interface SnapshotCache {

    /**
     * Visits every archived object exactly once.
     *
     * @param visitor receives each entry
     */
    void iterate(Consumer<SnapshotEntry> visitor);

    /**
     * Looks up the entry recorded for an archived object.
     *
     * @param object the archived object
     * @return the entry, or null if the object is not archived
     */
    SnapshotEntry lookup(HeapObjectRef object);

    /** Returns the number of archived objects. */
    int size();
}
