package verifier.host;

import verifier.exceptions.SnapshotIntegrityException;
import verifier.model.HeapObjectRef;
import verifier.model.SnapshotEntry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * {@link SnapshotCache} held in memory, iterated in insertion order.
 *
 * <p>A referrer must be added before the objects it refers to, which keeps
 * the referrer links a tree rooted at entries without a referrer.
 */
public final class InMemorySnapshotCache implements SnapshotCache {

    private final Map<HeapObjectRef, SnapshotEntry> entries = new LinkedHashMap<>();

    /**
     * Adds a snapshot root.
     *
     * @param object the archived object
     * @return the new entry
     */
    public SnapshotEntry addRoot(HeapObjectRef object) {
        return add(object, null);
    }

    /**
     * Adds an archived object reached through {@code referrer}.
     *
     * @param object the archived object
     * @param referrer the parent object, or null for a root
     * @return the new entry
     * @throws IllegalArgumentException if the object is already archived
     * @throws SnapshotIntegrityException if the referrer is not archived
     */
    public SnapshotEntry add(HeapObjectRef object, HeapObjectRef referrer) {
        Objects.requireNonNull(object, "object");
        if (entries.containsKey(object)) {
            throw new IllegalArgumentException("Object already archived: " + object);
        }
        if (referrer != null && !entries.containsKey(referrer)) {
            throw new SnapshotIntegrityException("Referrer must be archived before its referents", referrer);
        }
        SnapshotEntry entry = new SnapshotEntry(object, referrer);
        entries.put(object, entry);
        return entry;
    }

    @Override
    public void iterate(Consumer<SnapshotEntry> visitor) {
        for (SnapshotEntry e : Collections.unmodifiableCollection(entries.values())) {
            visitor.accept(e);
        }
    }

    @Override
    public SnapshotEntry lookup(HeapObjectRef object) {
        return object == null ? null : entries.get(object);
    }

    @Override
    public int size() {
        return entries.size();
    }
}
