package verifier.reflect;

import verifier.host.SnapshotCache;
import verifier.model.HeapObjectRef;

import java.util.Collections;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * Host view of the running JVM's own heap, built on {@code java.lang.reflect}.
 *
 * <p>Hands out {@link ReflectiveObjectRef}s and caches one
 * {@link ReflectiveClassDescriptor} per class, so that per-class facts (root
 * class, archived enum instances, compile-time constants) are computed once.
 *
 * <h2>Usage:</h2>
 * <pre>
 * InMemorySnapshotCache cache = new InMemorySnapshotCache();
 * ReflectiveHeap heap = ReflectiveHeap.builder()
 *         .rootClass(ArchivedModuleGraph.class)
 *         .archivedEnumsFrom(cache)
 *         .build();
 * cache.addRoot(heap.ref(archivedObject));
 * </pre>
 *
 * @see ReflectionClassRegistry
 */
public final class ReflectiveHeap {

    private final Set<Class<?>> rootClasses;
    private final Predicate<Class<?>> archivedEnumTypes;
    private final Map<Class<?>, ReflectiveClassDescriptor> descriptors = new ConcurrentHashMap<>();

    private ReflectiveHeap(Builder b) {
        this.rootClasses = Collections.unmodifiableSet(new HashSet<>(b.rootClasses));
        this.archivedEnumTypes = b.archivedEnumTypes;
    }

    /**
     * Creates a new heap builder.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Wraps a Java object.
     *
     * @param object the object, may be null
     * @return the ref, or null for a null object
     */
    public HeapObjectRef ref(Object object) {
        return object == null ? null : new ReflectiveObjectRef(this, object);
    }

    /**
     * Returns the descriptor of a class.
     *
     * @param clazz the class
     * @return the cached descriptor
     */
    public ReflectiveClassDescriptor describe(Class<?> clazz) {
        return descriptors.computeIfAbsent(Objects.requireNonNull(clazz), c -> new ReflectiveClassDescriptor(this, c));
    }

    boolean isRootClass(Class<?> clazz) {
        return rootClasses.contains(clazz);
    }

    boolean hasArchivedEnumInstances(Class<?> clazz) {
        Class<?> enumType = enumTypeOf(clazz);
        return enumType != null && archivedEnumTypes.test(enumType);
    }

    /**
     * Returns the enum type of a class, following constant-specific class
     * bodies up to their enum, or null if the class is not an enum.
     */
    static Class<?> enumTypeOf(Class<?> clazz) {
        if (clazz.isEnum()) {
            return clazz;
        }
        Class<?> sup = clazz.getSuperclass();
        return sup != null && sup.isEnum() ? sup : null;
    }

    /**
     * Builder for {@link ReflectiveHeap}.
     */
    public static final class Builder {
        private final Set<Class<?>> rootClasses = new HashSet<>();
        private Predicate<Class<?>> archivedEnumTypes = c -> false;

        private Builder() {}

        /** Marks classes whose static fields are restored by a separately verified mechanism. */
        public Builder rootClass(Class<?>... classes) {
            Collections.addAll(rootClasses, classes);
            return this;
        }

        /** Declares enum types that have archived instances. */
        public Builder archivedEnum(Class<?>... enumTypes) {
            Set<Class<?>> explicit = Set.of(enumTypes);
            Predicate<Class<?>> previous = archivedEnumTypes;
            archivedEnumTypes = c -> explicit.contains(c) || previous.test(c);
            return this;
        }

        /**
         * Treats every enum type with an instance in the given cache as having
         * archived instances. The cache is read on first use and must be complete by then.
         */
        public Builder archivedEnumsFrom(SnapshotCache cache) {
            Objects.requireNonNull(cache);
            Predicate<Class<?>> previous = archivedEnumTypes;
            ArchivedEnumTypes fromCache = new ArchivedEnumTypes(cache);
            archivedEnumTypes = c -> fromCache.contains(c) || previous.test(c);
            return this;
        }

        public ReflectiveHeap build() {
            return new ReflectiveHeap(this);
        }
    }

    private static final class ArchivedEnumTypes {
        private final SnapshotCache cache;
        private volatile Set<Class<?>> types;

        ArchivedEnumTypes(SnapshotCache cache) {
            this.cache = cache;
        }

        boolean contains(Class<?> enumType) {
            Set<Class<?>> t = types;
            if (t == null) {
                Set<Class<?>> collected = new HashSet<>();
                cache.iterate(entry -> {
                    if (entry.object() instanceof ReflectiveObjectRef ref && ref.referent() instanceof Enum<?> e) {
                        collected.add(e.getDeclaringClass());
                    }
                });
                types = t = collected;
            }
            return t.contains(enumType);
        }
    }
}
