package verifier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import verifier.alert.DiagnosticSink;
import verifier.alert.Slf4jDiagnosticSink;
import verifier.check.SnapshotCrossChecker;
import verifier.config.VerifierConfig;
import verifier.config.VerifierConfigLoader;
import verifier.exclusion.ExclusionRegistry;
import verifier.host.ClassRegistry;
import verifier.host.SnapshotCache;
import verifier.index.LiveStaticFieldIndex;
import verifier.scan.ClassFieldScanner;
import verifier.scan.ScanStatistics;
import verifier.trace.RootTracer;

import java.util.Objects;

/**
 * Checks that no archived heap object is the current value of a static field
 * that may be reinitialized at runtime.
 *
 * <p>Consider an archived {@code Foo} whose {@code bar} field was copied from
 * {@code Bar.bar} while the archive was dumped. At runtime {@code Bar}'s static
 * initializer runs again and assigns a fresh object, so the restored
 * {@code Foo.bar} and {@code Bar.bar} are no longer the same object, although
 * they are without the archive. This verifier finds such objects:
 * <ol>
 *   <li>{@link ClassFieldScanner} indexes the current value of every static
 *       object field of every loaded class, minus known safe fields</li>
 *   <li>{@link SnapshotCrossChecker} looks up every archived object in that
 *       index and reports each hit with a {@link RootTracer} trace</li>
 * </ol>
 *
 * <p>The class registry and the snapshot cache must not change during a run.
 * A verifier instance is one-shot; the index is built in the constructor and
 * only read afterwards.
 *
 * <h2>Usage:</h2>
 * <pre>
 * ArchiveHeapVerifier.verify(classRegistry, snapshotCache);
 * </pre>
 */
public final class ArchiveHeapVerifier {

    private static final Logger log = LoggerFactory.getLogger(ArchiveHeapVerifier.class);

    private final LiveStaticFieldIndex index = new LiveStaticFieldIndex();
    private final ScanStatistics scanStatistics;
    private final DiagnosticSink sink;
    private boolean checked;

    /**
     * Creates a verifier and builds the live static field index.
     *
     * @param registry the loaded classes
     * @param exclusions the exempted static fields
     * @param sink receives all diagnostics
     */
    public ArchiveHeapVerifier(ClassRegistry registry, ExclusionRegistry exclusions, DiagnosticSink sink) {
        this.sink = Objects.requireNonNull(sink);
        this.scanStatistics = new ClassFieldScanner(exclusions).scan(registry, index);
        sink.scanCompleted(scanStatistics);
    }

    /**
     * Runs a full verification with the configuration found on the classpath,
     * or the defaults when there is none.
     *
     * @param registry the loaded classes
     * @param cache the archived objects
     */
    public static void verify(ClassRegistry registry, SnapshotCache cache) {
        VerifierConfig config = VerifierConfigLoader.loadOrDefaults();
        verify(registry, cache, config, new Slf4jDiagnosticSink(config.alertLevel()));
    }

    /**
     * Runs a full verification.
     *
     * @param registry the loaded classes
     * @param cache the archived objects
     * @param config the verifier configuration
     * @param sink receives all diagnostics
     */
    public static void verify(ClassRegistry registry, SnapshotCache cache, VerifierConfig config, DiagnosticSink sink) {
        if (!config.enabled()) {
            log.debug("Archive heap verification disabled");
            return;
        }
        sink.verificationStarted(cache.size());
        new ArchiveHeapVerifier(registry, config.exclusionRegistry(), sink).check(cache);
    }

    /**
     * Checks every archived object against the index and reports the summary.
     *
     * @param cache the archived objects
     * @throws IllegalStateException if this verifier has already checked a cache
     */
    public void check(SnapshotCache cache) {
        if (checked) {
            throw new IllegalStateException("ArchiveHeapVerifier is one-shot");
        }
        checked = true;

        SnapshotCrossChecker checker = new SnapshotCrossChecker(index, new RootTracer(cache), sink);
        checker.check(cache);
        sink.summary(checker.scannedObjects(), checker.problems());
        log.debug("Checked {} archived objects against {} indexed static field values",
                checker.scannedObjects(), index.size());
    }

    /** Returns the counters from building the index. */
    public ScanStatistics scanStatistics() {
        return scanStatistics;
    }
}
