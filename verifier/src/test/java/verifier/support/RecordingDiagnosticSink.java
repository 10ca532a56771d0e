package verifier.support;

import verifier.alert.DiagnosticSink;
import verifier.model.HeapObjectRef;
import verifier.model.StaticFieldOrigin;
import verifier.scan.ScanStatistics;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link DiagnosticSink} that records every finding and the rendered output.
 */
public final class RecordingDiagnosticSink implements DiagnosticSink {

    /** One reported finding with its trace lines. */
    public record Finding(StaticFieldOrigin origin, HeapObjectRef value, List<String> trace) {}

    private final List<Finding> findings = new ArrayList<>();
    private final List<String> lines = new ArrayList<>();
    private ScanStatistics statistics;
    private int archivedObjects = -1;
    private int scannedObjects = -1;
    private int problems = -1;
    private int summaries;

    @Override
    public void verificationStarted(int archivedObjects) {
        this.archivedObjects = archivedObjects;
    }

    @Override
    public void scanCompleted(ScanStatistics statistics) {
        this.statistics = statistics;
    }

    @Override
    public void violation(StaticFieldOrigin origin, HeapObjectRef value) {
        findings.add(new Finding(origin, value, new ArrayList<>()));
        lines.add("Field: " + origin);
        lines.add("Value: " + value.describe());
    }

    @Override
    public void traceLine(String line) {
        findings.get(findings.size() - 1).trace().add(line);
        lines.add(line);
    }

    @Override
    public void traceEnd() {
        lines.add("--- trace end ---");
    }

    @Override
    public void summary(int scannedObjects, int problems) {
        this.scannedObjects = scannedObjects;
        this.problems = problems;
        this.summaries++;
        lines.add("Scanned " + scannedObjects + " objects, found " + problems + " problem(s)");
    }

    public List<Finding> findings() { return findings; }
    public List<String> lines() { return lines; }
    public ScanStatistics statistics() { return statistics; }
    public int archivedObjects() { return archivedObjects; }
    public int scannedObjects() { return scannedObjects; }
    public int problems() { return problems; }
    public int summaries() { return summaries; }
}
