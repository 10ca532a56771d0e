package verifier.alert;

import verifier.model.HeapObjectRef;
import verifier.model.StaticFieldOrigin;
import verifier.scan.ScanStatistics;

/**
 * Receives the output of a verification run.
 *
 * <p>For each finding the verifier calls {@link #violation}, then
 * {@link #traceLine} once per trace hop, then {@link #traceEnd}. The run
 * ends with a single {@link #summary} call.
 *
 * @see Slf4jDiagnosticSink
 */
public interface DiagnosticSink {

    /** A sink that discards everything. */
    DiagnosticSink NOOP = new DiagnosticSink() {
        @Override public void verificationStarted(int archivedObjects) {}
        @Override public void scanCompleted(ScanStatistics statistics) {}
        @Override public void violation(StaticFieldOrigin origin, HeapObjectRef value) {}
        @Override public void traceLine(String line) {}
        @Override public void traceEnd() {}
        @Override public void summary(int scannedObjects, int problems) {}
    };

    /**
     * Called once before the static field scan.
     *
     * @param archivedObjects the number of objects in the snapshot cache
     */
    void verificationStarted(int archivedObjects);

    /**
     * Called once after the index has been built.
     *
     * @param statistics counters from the static field scan
     */
    void scanCompleted(ScanStatistics statistics);

    /**
     * Reports an archived object that is the current value of a static field.
     *
     * @param origin the static field
     * @param value the archived object
     */
    void violation(StaticFieldOrigin origin, HeapObjectRef value);

    /**
     * Emits one rendered line of the trace for the last reported violation.
     *
     * @param line the rendered hop
     */
    void traceLine(String line);

    /** Ends the trace for the last reported violation. */
    void traceEnd();

    /**
     * Called once after the whole snapshot has been checked.
     *
     * @param scannedObjects the number of snapshot entries checked
     * @param problems the number of violations reported
     */
    void summary(int scannedObjects, int problems);
}
