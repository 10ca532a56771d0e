package verifier.exclusion;

/**
 * Why a static field is exempt from verification.
 *
 * <p>Categories are audit metadata only. Every category has the same effect:
 * the field is never indexed.
 *
 * @see ExclusionRegistry
 */
public enum ExclusionCategory {
    /**
     * Module bootstrap code reassigns the field to point into the archived
     * module graph, e.g. {@code java.lang.System::bootLayer}.
     */
    BOOTSTRAP_REASSIGNED,

    /**
     * A final static string initialized inside the static initializer whose
     * value is always the same string literal.
     */
    DETERMINISTIC_LITERAL,

    /**
     * A non-final static string assigned a literal during class
     * initialization and never changed while the archive is dumped.
     */
    LITERAL_VALUED_CACHE,

    /** A simple cache whose value does not matter. */
    VALUE_INSENSITIVE_CACHE,

    /** Other cases, documented where the entry is declared. */
    AD_HOC
}
