package verifier.scan;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import verifier.exclusion.ExclusionRegistry;
import verifier.host.ClassRegistry;
import verifier.index.LiveStaticFieldIndex;
import verifier.model.ClassDescriptor;
import verifier.model.FieldDescriptor;
import verifier.model.HeapObjectRef;
import verifier.model.StaticFieldOrigin;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Collects every static object field of every loaded class whose current
 * value may be reassigned when the class is initialized for real.
 *
 * <p>Only fields whose declared type is a plain object type are considered;
 * array-typed statics are never indexed. For each such field the skip rules
 * are applied in order,
 * stopping at the first match:
 * <ol>
 *   <li>the class is a root class (the whole class is skipped)</li>
 *   <li>the field is exempted in the {@link ExclusionRegistry}</li>
 *   <li>the field holds null</li>
 *   <li>the field is final, holds a string and has a compile-time initial value
 *       (an interned literal)</li>
 *   <li>the field is final and holds a class mirror</li>
 *   <li>the value's class has archived enum instances</li>
 * </ol>
 * Fields that survive every rule are put into the {@link LiveStaticFieldIndex}.
 *
 * @see verifier.check.SnapshotCrossChecker
 */
public final class ClassFieldScanner {

    private static final Logger log = LoggerFactory.getLogger(ClassFieldScanner.class);

    private final ExclusionRegistry exclusions;

    public ClassFieldScanner(ExclusionRegistry exclusions) {
        this.exclusions = Objects.requireNonNull(exclusions);
    }

    /**
     * Builds a fresh index from every class in the registry.
     *
     * @param registry the loaded classes
     * @return the populated index
     */
    public LiveStaticFieldIndex buildIndex(ClassRegistry registry) {
        LiveStaticFieldIndex index = new LiveStaticFieldIndex();
        scan(registry, index);
        return index;
    }

    /**
     * Scans every class in the registry into the given index.
     *
     * @param registry the loaded classes
     * @param index the index to populate
     * @return counters for this pass
     */
    public ScanStatistics scan(ClassRegistry registry, LiveStaticFieldIndex index) {
        Objects.requireNonNull(index, "index");
        Counters c = new Counters();
        for (ClassDescriptor cls : registry.loadedClasses()) {
            scanClass(cls, index, c);
        }
        ScanStatistics stats = c.toStatistics();
        log.debug("Static field scan completed: {}", stats.summary());
        return stats;
    }

    private void scanClass(ClassDescriptor cls, LiveStaticFieldIndex index, Counters c) {
        c.classes++;
        if (cls.isRootClass()) {
            // restored by the archived subgraph mechanism, which updates its statics at runtime
            c.rootClasses++;
            c.skip(SkipReason.ROOT_CLASS);
            return;
        }

        for (FieldDescriptor field : cls.staticFields()) {
            // arrays, e.g. an enum's $VALUES, are left out like primitives
            if (!field.isObjectTyped()) continue;
            c.fields++;

            if (exclusions.isExcluded(cls.name(), field.name())) {
                log.debug("Skipping exempted field {}::{} ({})",
                        cls.name(), field.name(), exclusions.categoryOf(cls.name(), field.name()));
                c.skip(SkipReason.EXCLUDED);
                continue;
            }

            HeapObjectRef value = field.currentValue();
            SkipReason reason = classify(field, value);
            if (reason != null) {
                c.skip(reason);
                continue;
            }

            StaticFieldOrigin origin = new StaticFieldOrigin(cls.name(), field.name());
            StaticFieldOrigin previous = index.put(value, origin);
            c.indexed++;
            if (previous != null) {
                c.overwritten++;
                log.debug("Object {} is held by both {} and {}; keeping {}",
                        value.identity(), previous, origin, origin);
            }
        }
    }

    /**
     * Applies the value-dependent skip rules to a static object field that is
     * neither in a root class nor exempted.
     *
     * @param field the static object-typed field
     * @param value the field's current value, or null
     * @return the first matching rule, or null if the field must be indexed
     */
    static SkipReason classify(FieldDescriptor field, HeapObjectRef value) {
        if (value == null) {
            return SkipReason.NULL_VALUE;
        }
        if (field.isFinal() && value.isString() && field.hasCompileTimeInitialValue()) {
            // static final String FOO = "literal"; lives in the shared string table
            return SkipReason.STRING_LITERAL;
        }
        if (field.isFinal() && value.isMirror()) {
            // archived mirrors are verified separately
            return SkipReason.MIRROR;
        }
        if (value.ownerClass().hasArchivedEnumInstances()) {
            // once an enum instance is archived, all statics of the enum class are archived with it
            return SkipReason.ARCHIVED_ENUM;
        }
        return null;
    }

    private static final class Counters {
        int classes;
        int rootClasses;
        int fields;
        int indexed;
        int overwritten;
        final Map<SkipReason, Integer> skips = new EnumMap<>(SkipReason.class);

        void skip(SkipReason reason) {
            skips.merge(reason, 1, Integer::sum);
        }

        ScanStatistics toStatistics() {
            return new ScanStatistics(classes, rootClasses, fields, skips, indexed, overwritten);
        }
    }
}
