package verifier.check;

import verifier.alert.DiagnosticSink;
import verifier.host.SnapshotCache;
import verifier.index.LiveStaticFieldIndex;
import verifier.model.SnapshotEntry;
import verifier.model.StaticFieldOrigin;
import verifier.trace.RootTracer;

import java.util.Objects;

/**
 * Checks every archived object against the live static field index.
 *
 * <p>Every entry of the snapshot cache is visited; the check never stops
 * early. An entry whose object is in the index is a finding: the sink gets the
 * field, the object and a full trace from a snapshot root. No exclusions are
 * applied here, all filtering happened while the index was built.
 *
 * <p>A checker keeps its counters across {@link #check} calls; create one per
 * verification run.
 */
public final class SnapshotCrossChecker {

    private final LiveStaticFieldIndex index;
    private final RootTracer tracer;
    private final DiagnosticSink sink;

    private int scannedObjects;
    private int problems;

    public SnapshotCrossChecker(LiveStaticFieldIndex index, RootTracer tracer, DiagnosticSink sink) {
        this.index = Objects.requireNonNull(index);
        this.tracer = Objects.requireNonNull(tracer);
        this.sink = Objects.requireNonNull(sink);
    }

    /**
     * Checks every entry of the cache.
     *
     * @param cache the snapshot cache
     */
    public void check(SnapshotCache cache) {
        cache.iterate(this::checkEntry);
    }

    /**
     * Checks a single snapshot entry.
     *
     * @param entry the entry to check
     */
    void checkEntry(SnapshotEntry entry) {
        scannedObjects++;

        StaticFieldOrigin origin = index.get(entry.object());
        if (origin == null) {
            return;
        }

        sink.violation(origin, entry.object());
        tracer.printTrace(entry, sink);
        sink.traceEnd();
        problems++;
    }

    /** Returns the number of snapshot entries checked so far. */
    public int scannedObjects() {
        return scannedObjects;
    }

    /** Returns the number of findings reported so far. */
    public int problems() {
        return problems;
    }
}
