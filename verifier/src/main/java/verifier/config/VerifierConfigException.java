package verifier.config;

/**
 * Thrown when the verifier configuration cannot be found or parsed.
 *
 * @see VerifierConfigLoader
 */
public class VerifierConfigException extends RuntimeException {

    /** Config file name, or null when no file was found */
    private final String source;

    /**
     * Creates an exception for a file that could not be read or parsed.
     *
     * @param message a description of the problem
     * @param source the config file name
     * @param cause the I/O or YAML error
     */
    public VerifierConfigException(String message, String source, Throwable cause) {
        super(message + ": " + source, cause);
        this.source = source;
    }

    private VerifierConfigException(String message) {
        super(message);
        this.source = null;
    }

    /** Creates the exception raised when the classpath holds no config file. */
    static VerifierConfigException missing(String... candidates) {
        return new VerifierConfigException("Config file required: " + String.join(" or ", candidates));
    }

    /** Returns the config file name, or null if no file was found. */
    public String source() {
        return source;
    }

    /** Returns true if this exception reports an absent config file rather than a broken one. */
    public boolean isMissingConfig() {
        return source == null;
    }
}
