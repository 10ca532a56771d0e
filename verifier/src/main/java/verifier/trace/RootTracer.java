package verifier.trace;

import verifier.alert.DiagnosticSink;
import verifier.exceptions.SnapshotIntegrityException;
import verifier.host.SnapshotCache;
import verifier.model.HeapObjectRef;
import verifier.model.ReferenceSlot;
import verifier.model.SnapshotEntry;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Reconstructs the path from a snapshot root down to an archived object.
 *
 * <p>The ascent follows referrer links with an explicit stack, so deep
 * snapshots do not grow the call stack. Each hop except the last names the
 * slot on that object which refers to the next hop. A root that is a string
 * is preceded by a {@link TraceHop#STRING_TABLE_LABEL} line, because such
 * roots are reached through the shared string table rather than a parent.
 *
 * <p>Example output for a field reached through a list:
 * <pre>
 * [ 0] 0x4e25154f verifier/demo/Holder::items
 * [ 1] 0x70dea4e java/util/ArrayList::elementData
 * [ 2] 0x5c647e05 [Ljava/lang/Object; @[0]
 * [ 3] 0x33909752 verifier/demo/Config
 * </pre>
 *
 * @see verifier.check.SnapshotCrossChecker
 */
public final class RootTracer {

    private final SnapshotCache cache;

    public RootTracer(SnapshotCache cache) {
        this.cache = Objects.requireNonNull(cache);
    }

    /**
     * Computes the root-first trace for an archived object.
     *
     * @param entry the entry of the object to trace
     * @return the hops, root first, the traced object last
     * @throws SnapshotIntegrityException if a referrer is not present in the cache
     *         or the referrer links loop
     */
    public List<TraceHop> trace(SnapshotEntry entry) {
        Deque<HeapObjectRef> chain = ascend(entry);

        List<TraceHop> hops = new ArrayList<>(chain.size() + 1);
        int level = 0;
        HeapObjectRef root = chain.peekFirst();
        if (root.isString()) {
            hops.add(TraceHop.stringTable(level++));
        }

        HeapObjectRef current = chain.pollFirst();
        while (current != null) {
            HeapObjectRef child = chain.pollFirst();
            ReferenceSlot slot = child == null ? null : findSlot(current, child);
            hops.add(new TraceHop(level++, current, slot));
            current = child;
        }
        return hops;
    }

    /**
     * Computes the trace and writes each rendered hop to the sink.
     *
     * @param entry the entry of the object to trace
     * @param sink the diagnostic sink
     * @return the number of lines written
     */
    public int printTrace(SnapshotEntry entry, DiagnosticSink sink) {
        List<TraceHop> hops = trace(entry);
        for (TraceHop hop : hops) {
            sink.traceLine(hop.render());
        }
        return hops.size();
    }

    // root ends up first
    private Deque<HeapObjectRef> ascend(SnapshotEntry entry) {
        Deque<HeapObjectRef> chain = new ArrayDeque<>();
        Set<HeapObjectRef> seen = new HashSet<>();
        SnapshotEntry current = entry;
        while (true) {
            if (!seen.add(current.object())) {
                throw new SnapshotIntegrityException("Referrer chain loops back", current.object());
            }
            chain.addFirst(current.object());
            if (current.isRoot()) {
                return chain;
            }
            SnapshotEntry parent = cache.lookup(current.referrer());
            if (parent == null) {
                throw new SnapshotIntegrityException("Referrer is not in the snapshot cache", current.referrer());
            }
            current = parent;
        }
    }

    /**
     * Finds the first slot on {@code parent} whose current value is {@code child}.
     * Named fields are searched for ordinary objects, elements for arrays.
     *
     * @return the slot, or null if the parent no longer refers to the child
     */
    static ReferenceSlot findSlot(HeapObjectRef parent, HeapObjectRef child) {
        boolean array = parent.isArray();
        for (ReferenceSlot slot : parent.referenceSlots()) {
            boolean candidate = array ? slot.isArrayElement() : (slot.isObjectTyped() || slot.isArrayTyped());
            if (candidate && slot.value() != null && slot.value().equals(child)) {
                return slot;
            }
        }
        return null;
    }
}
