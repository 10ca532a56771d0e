package verifier.config;

import verifier.exclusion.ExclusionCategory;
import verifier.exclusion.ExclusionRegistry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Central configuration for archive heap verification.
 *
 * <p>Configuration can be loaded from {@code verifier.properties} or
 * {@code verifier.yml} using {@link VerifierConfigLoader}.
 *
 * @see VerifierConfigLoader
 * @see verifier.ArchiveHeapVerifier
 */
public final class VerifierConfig {

    public static final VerifierConfig DEFAULTS = builder().build();

    private final boolean enabled;
    private final AlertLevel alertLevel;
    private final boolean includeDefaultExclusions;
    private final Map<String, Set<String>> additionalExclusions;

    private VerifierConfig(Builder b) {
        this.enabled = b.enabled;
        this.alertLevel = b.alertLevel;
        this.includeDefaultExclusions = b.includeDefaultExclusions;
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        b.additionalExclusions.forEach((cls, fields) ->
                copy.put(cls, Collections.unmodifiableSet(new LinkedHashSet<>(fields))));
        this.additionalExclusions = Collections.unmodifiableMap(copy);
    }

    /**
     * Creates a new configuration builder.
     *
     * @return a new builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /** Returns false if verification is switched off and must do nothing. */
    public boolean enabled() { return enabled; }

    /** Returns the alert level for logging. */
    public AlertLevel alertLevel() { return alertLevel; }

    /** Returns true if the built-in core library exemptions apply. */
    public boolean includeDefaultExclusions() { return includeDefaultExclusions; }

    /** Returns exemptions added by configuration, keyed by class name. */
    public Map<String, Set<String>> additionalExclusions() { return additionalExclusions; }

    /**
     * Builds the exclusion registry this configuration describes: the default
     * table (unless switched off) plus every configured exemption, the latter
     * categorized as {@link ExclusionCategory#AD_HOC}.
     *
     * @return the registry to scan with
     */
    public ExclusionRegistry exclusionRegistry() {
        if (additionalExclusions.isEmpty()) {
            return includeDefaultExclusions ? ExclusionRegistry.defaults() : ExclusionRegistry.empty();
        }
        ExclusionRegistry.Builder b = includeDefaultExclusions
                ? ExclusionRegistry.defaults().toBuilder()
                : ExclusionRegistry.builder();
        additionalExclusions.forEach((cls, fields) ->
                b.exclude(cls, ExclusionCategory.AD_HOC, fields.toArray(new String[0])));
        return b.build();
    }

    @Override
    public String toString() {
        return "VerifierConfig{" +
                "enabled=" + enabled +
                ", alertLevel=" + alertLevel +
                ", includeDefaultExclusions=" + includeDefaultExclusions +
                ", additionalExclusions=" + additionalExclusions +
                '}';
    }

    /**
     * Builder for constructing {@link VerifierConfig} instances.
     */
    public static final class Builder {
        private boolean enabled = true;
        private AlertLevel alertLevel = AlertLevel.WARNING;
        private boolean includeDefaultExclusions = true;
        private final Map<String, Set<String>> additionalExclusions = new LinkedHashMap<>();

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder alertLevel(AlertLevel level) {
            this.alertLevel = level != null ? level : AlertLevel.WARNING;
            return this;
        }

        public Builder includeDefaultExclusions(boolean include) {
            this.includeDefaultExclusions = include;
            return this;
        }

        public Builder exclude(String className, String... fieldNames) {
            if (className == null || className.isBlank()) {
                throw new IllegalArgumentException("className must not be blank");
            }
            Set<String> fields = additionalExclusions.computeIfAbsent(
                    className.trim().replace('/', '.'), k -> new LinkedHashSet<>());
            for (String f : fieldNames) {
                if (f != null && !f.isBlank()) fields.add(f.trim());
            }
            return this;
        }

        public VerifierConfig build() {
            return new VerifierConfig(this);
        }
    }
}
