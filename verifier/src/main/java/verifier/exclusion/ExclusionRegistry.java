package verifier.exclusion;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static verifier.exclusion.ExclusionCategory.AD_HOC;
import static verifier.exclusion.ExclusionCategory.BOOTSTRAP_REASSIGNED;
import static verifier.exclusion.ExclusionCategory.DETERMINISTIC_LITERAL;
import static verifier.exclusion.ExclusionCategory.LITERAL_VALUED_CACHE;
import static verifier.exclusion.ExclusionCategory.VALUE_INSENSITIVE_CACHE;

/**
 * Immutable table of static fields that archived objects may legitimately
 * reference.
 *
 * <p>Class names are stored in external form ({@code java.lang.System}); lookups
 * accept the internal form ({@code java/lang/System}) as well. Each exempted
 * field carries an {@link ExclusionCategory}, which has no effect on lookup.
 *
 * <p>The {@link #defaults()} table has to be maintained by hand alongside the
 * core library. When a core library class starts publishing an archived
 * object through a new static field, either the library code or this table
 * must change.
 *
 * @see verifier.scan.ClassFieldScanner
 */
public final class ExclusionRegistry {

    private static final ExclusionRegistry EMPTY = new ExclusionRegistry(Map.of());

    private static final ExclusionRegistry DEFAULTS = builder()
            .exclude("java.lang.ClassLoader",                       BOOTSTRAP_REASSIGNED, "scl")
            .exclude("java.lang.invoke.InvokerBytecodeGenerator",   DETERMINISTIC_LITERAL,
                    "DONTINLINE_SIG", "FORCEINLINE_SIG", "HIDDEN_SIG", "INJECTEDPROFILE_SIG", "LF_COMPILED_SIG")
            .exclude("java.lang.Module",                            BOOTSTRAP_REASSIGNED,
                    "ALL_UNNAMED_MODULE", "ALL_UNNAMED_MODULE_SET", "EVERYONE_MODULE", "EVERYONE_SET")
            .exclude("java.lang.System",                            BOOTSTRAP_REASSIGNED, "bootLayer")
            .exclude("java.lang.VersionProps",                      LITERAL_VALUED_CACHE,
                    "VENDOR_URL_BUG", "VENDOR_URL_VM_BUG", "VENDOR_VERSION")
            .exclude("java.net.URL$DefaultFactory",                 DETERMINISTIC_LITERAL, "PREFIX")
            // dummy value used by HashSet, never tested for equality
            .exclude("java.util.HashSet",                           AD_HOC, "PRESENT")
            .exclude("jdk.internal.loader.BuiltinClassLoader",      BOOTSTRAP_REASSIGNED, "packageToModule")
            .exclude("jdk.internal.loader.ClassLoaders",            BOOTSTRAP_REASSIGNED,
                    "BOOT_LOADER", "APP_LOADER", "PLATFORM_LOADER")
            .exclude("jdk.internal.loader.URLClassPath",            DETERMINISTIC_LITERAL, "JAVA_VERSION")
            .exclude("jdk.internal.module.Builder",                 VALUE_INSENSITIVE_CACHE, "cachedVersion")
            .exclude("jdk.internal.module.ModuleLoaderMap$Mapper",  BOOTSTRAP_REASSIGNED,
                    "APP_CLASSLOADER", "APP_LOADER_INDEX", "PLATFORM_CLASSLOADER", "PLATFORM_LOADER_INDEX")
            .exclude("jdk.internal.module.ServicesCatalog",         BOOTSTRAP_REASSIGNED, "CLV")
            // points to an empty map
            .exclude("jdk.internal.reflect.Reflection",             AD_HOC, "methodFilterMap")
            .exclude("jdk.internal.util.StaticProperty",            LITERAL_VALUED_CACHE, "FILE_ENCODING")
            .build();

    // className -> (fieldName -> category), both in insertion order
    private final Map<String, Map<String, ExclusionCategory>> table;

    private ExclusionRegistry(Map<String, Map<String, ExclusionCategory>> table) {
        this.table = table;
    }

    /**
     * Returns the built-in table of core library exemptions.
     *
     * @return the default registry
     */
    public static ExclusionRegistry defaults() {
        return DEFAULTS;
    }

    /**
     * Returns a registry that exempts nothing.
     *
     * @return the empty registry
     */
    public static ExclusionRegistry empty() {
        return EMPTY;
    }

    /**
     * Creates a new registry builder.
     *
     * @return a new, empty builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the exempted field names for a class.
     *
     * @param className the class name in external or internal form
     * @return the exempted field names, empty if none are registered
     */
    public Set<String> lookup(String className) {
        Map<String, ExclusionCategory> fields = table.get(normalize(className));
        return fields == null ? Set.of() : Collections.unmodifiableSet(fields.keySet());
    }

    /**
     * Returns true if the given field of the given class is exempted.
     */
    public boolean isExcluded(String className, String fieldName) {
        Map<String, ExclusionCategory> fields = table.get(normalize(className));
        return fields != null && fields.containsKey(fieldName);
    }

    /**
     * Returns the category recorded for an exempted field.
     *
     * @return the category, or null if the field is not exempted
     */
    public ExclusionCategory categoryOf(String className, String fieldName) {
        Map<String, ExclusionCategory> fields = table.get(normalize(className));
        return fields == null ? null : fields.get(fieldName);
    }

    /** Returns the names of all classes that have at least one exemption. */
    public Set<String> classNames() {
        return Collections.unmodifiableSet(table.keySet());
    }

    /** Returns the total number of exempted fields. */
    public int size() {
        return table.values().stream().mapToInt(Map::size).sum();
    }

    /**
     * Returns a builder pre-populated with this registry's entries.
     */
    public Builder toBuilder() {
        Builder b = new Builder();
        table.forEach((cls, fields) -> fields.forEach((f, cat) -> b.exclude(cls, cat, f)));
        return b;
    }

    static String normalize(String className) {
        return Objects.requireNonNull(className, "className").replace('/', '.');
    }

    @Override
    public String toString() {
        return "ExclusionRegistry{classes=" + table.size() + ", fields=" + size() + '}';
    }

    /**
     * Builder for {@link ExclusionRegistry}. A field added twice keeps the
     * category of the last addition.
     */
    public static final class Builder {
        private final Map<String, Map<String, ExclusionCategory>> table = new LinkedHashMap<>();

        private Builder() {}

        public Builder exclude(String className, ExclusionCategory category, String... fieldNames) {
            Objects.requireNonNull(category, "category");
            Map<String, ExclusionCategory> fields =
                    table.computeIfAbsent(normalize(className), k -> new LinkedHashMap<>());
            for (String f : fieldNames) {
                fields.put(Objects.requireNonNull(f, "fieldName"), category);
            }
            return this;
        }

        public Builder merge(ExclusionRegistry other) {
            other.table.forEach((cls, fields) -> fields.forEach((f, cat) -> exclude(cls, cat, f)));
            return this;
        }

        public ExclusionRegistry build() {
            Map<String, Map<String, ExclusionCategory>> copy = new LinkedHashMap<>();
            table.forEach((cls, fields) ->
                    copy.put(cls, Collections.unmodifiableMap(new LinkedHashMap<>(fields))));
            return new ExclusionRegistry(Collections.unmodifiableMap(copy));
        }
    }
}
