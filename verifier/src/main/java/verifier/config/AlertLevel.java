package verifier.config;

/**
 * Alert level for verifier diagnostics.
 *
 * <p>Controls the minimum severity of events that get logged by
 * {@link verifier.alert.Slf4jDiagnosticSink}. This can be configured
 * via the {@code verifier.alert.level} property.
 *
 * <p>Log output at each level:
 * <ul>
 *   <li>{@link #DEBUG} - Everything: scan statistics, clean summaries, findings with traces</li>
 *   <li>{@link #WARNING} - Findings with traces and the problem summary</li>
 *   <li>{@link #ERROR} - Nothing from a verification run, which never fails</li>
 * </ul>
 *
 * @see VerifierConfig#alertLevel()
 */
public enum AlertLevel {
    /** Log all events including scan statistics and clean runs. */
    DEBUG,

    /** Log findings only. This is the default level. */
    WARNING,

    /** Log errors only. */
    ERROR
}
