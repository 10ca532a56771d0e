package verifier.index;

import verifier.model.HeapObjectRef;
import verifier.model.StaticFieldOrigin;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Maps a live object to the static field that currently exposes it.
 *
 * <p>Keys compare by object identity (see {@link HeapObjectRef}). The index is
 * filled once by {@link verifier.scan.ClassFieldScanner} and then only read.
 * {@link #put} overwrites, so when two static fields hold the same object the
 * field scanned last is the one reported.
 *
 * @see verifier.check.SnapshotCrossChecker
 */
public final class LiveStaticFieldIndex {

    private final Map<HeapObjectRef, StaticFieldOrigin> map = new HashMap<>();

    /**
     * Records the origin of a live object, replacing any earlier origin.
     *
     * @param object the live object
     * @param origin the static field holding it
     * @return the origin that was replaced, or null
     */
    public StaticFieldOrigin put(HeapObjectRef object, StaticFieldOrigin origin) {
        return map.put(Objects.requireNonNull(object, "object"), Objects.requireNonNull(origin, "origin"));
    }

    /**
     * Get the static field origin for the given object.
     *
     * @param object the object to look up
     * @return the origin, or null if the object is not exposed by any indexed field
     */
    public StaticFieldOrigin get(HeapObjectRef object) {
        return object == null ? null : map.get(object);
    }

    /** Check if the index has an origin for the given object. */
    public boolean contains(HeapObjectRef object) {
        return get(object) != null;
    }

    /** Returns the number of distinct indexed objects. */
    public int size() {
        return map.size();
    }

    public boolean isEmpty() {
        return map.isEmpty();
    }
}
