package verifier.alert;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import verifier.config.AlertLevel;
import verifier.model.HeapObjectRef;
import verifier.model.StaticFieldOrigin;
import verifier.scan.ScanStatistics;

import java.util.Objects;

/**
 * {@link DiagnosticSink} that writes to the SLF4J logger {@code archive.heap}.
 *
 * <p>Findings are logged at WARN, one log record per line, so that each trace
 * stays readable in line-oriented log files. Progress events use markers with
 * key=value pairs for easy parsing.
 *
 * <h2>Alert Level Configuration:</h2>
 * <ul>
 *   <li>DEBUG: logs start, scan statistics, clean summaries and findings</li>
 *   <li>WARNING: logs findings and the problem summary only</li>
 *   <li>ERROR: logs nothing from a verification run</li>
 * </ul>
 *
 * <h2>Example Output:</h2>
 * <pre>
 * 12:00:00.000 WARN  archive.heap - Archive heap points to a static field that may be reinitialized at runtime:
 * 12:00:00.000 WARN  archive.heap - Field: com.example.Foo::archivedFoo
 * 12:00:00.000 WARN  archive.heap - Value: 0x1b6d3586 com.example.Foo
 * 12:00:00.000 WARN  archive.heap - --- trace begin ---
 * 12:00:00.000 WARN  archive.heap - [ 0] 0x1b6d3586 com/example/Foo
 * 12:00:00.000 WARN  archive.heap - --- trace end ---
 * 12:00:00.001 WARN  archive.heap - Scanned 120 objects. Found 1 case(s) where an object points to a static field that may be reinitialized at runtime.
 * </pre>
 */
public final class Slf4jDiagnosticSink implements DiagnosticSink {

    /** Name of the logger all verifier diagnostics go to. */
    public static final String LOGGER_NAME = "archive.heap";

    private final Logger log;
    private final AlertLevel alertLevel;

    public Slf4jDiagnosticSink(AlertLevel alertLevel) {
        this(LoggerFactory.getLogger(LOGGER_NAME), alertLevel);
    }

    Slf4jDiagnosticSink(Logger log, AlertLevel alertLevel) {
        this.log = Objects.requireNonNull(log);
        this.alertLevel = alertLevel != null ? alertLevel : AlertLevel.WARNING;
    }

    /** Returns the alert level this sink filters by. */
    public AlertLevel alertLevel() {
        return alertLevel;
    }

    private boolean shouldLogInfo() {
        return alertLevel == AlertLevel.DEBUG;
    }

    private boolean shouldLogWarn() {
        return alertLevel == AlertLevel.DEBUG || alertLevel == AlertLevel.WARNING;
    }

    @Override
    public void verificationStarted(int archivedObjects) {
        if (shouldLogInfo()) {
            log.info("HEAP_VERIFY_STARTED archived_objects={}", archivedObjects);
        }
    }

    @Override
    public void scanCompleted(ScanStatistics statistics) {
        if (shouldLogInfo()) {
            log.info("STATIC_FIELD_SCAN_COMPLETED {}", statistics.summary());
        }
    }

    @Override
    public void violation(StaticFieldOrigin origin, HeapObjectRef value) {
        if (shouldLogWarn()) {
            log.warn("Archive heap points to a static field that may be reinitialized at runtime:");
            log.warn("Field: {}::{}", origin.ownerClassName(), origin.fieldName());
            log.warn("Value: {}", value.describe());
            log.warn("--- trace begin ---");
        }
    }

    @Override
    public void traceLine(String line) {
        if (shouldLogWarn()) {
            log.warn("{}", line);
        }
    }

    @Override
    public void traceEnd() {
        if (shouldLogWarn()) {
            log.warn("--- trace end ---");
        }
    }

    @Override
    public void summary(int scannedObjects, int problems) {
        if (problems > 0) {
            if (shouldLogWarn()) {
                log.warn("Scanned {} objects. Found {} case(s) where an object points to a static field "
                        + "that may be reinitialized at runtime.", scannedObjects, problems);
            }
        } else if (shouldLogInfo()) {
            log.info("HEAP_VERIFY_COMPLETED scanned={} problems=0", scannedObjects);
        }
    }
}
