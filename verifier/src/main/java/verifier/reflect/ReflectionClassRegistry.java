package verifier.reflect;

import org.reflections.Reflections;
import org.reflections.scanners.Scanners;
import org.reflections.util.ClasspathHelper;
import org.reflections.util.ConfigurationBuilder;
import org.reflections.util.FilterBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import verifier.host.ClassRegistry;
import verifier.model.ClassDescriptor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * {@link ClassRegistry} over a fixed set of Java classes.
 *
 * <p>Classes are enumerated in the order they were added; classes discovered
 * by {@link Builder#scanPackage} are added sorted by name so that the
 * enumeration order does not depend on the classpath layout.
 *
 * <h2>Usage:</h2>
 * <pre>
 * ReflectionClassRegistry registry = ReflectionClassRegistry.builder(heap)
 *         .addClass(java.lang.System.class)
 *         .scanPackage("com.example.app")
 *         .build();
 * </pre>
 *
 * @see ReflectiveHeap
 */
public final class ReflectionClassRegistry implements ClassRegistry {

    private static final Logger log = LoggerFactory.getLogger(ReflectionClassRegistry.class);

    private final List<ReflectiveClassDescriptor> classes;

    private ReflectionClassRegistry(List<ReflectiveClassDescriptor> classes) {
        this.classes = Collections.unmodifiableList(classes);
    }

    /**
     * Creates a new registry builder backed by the given heap.
     *
     * @param heap the heap that describes classes and wraps objects
     * @return a new builder
     */
    public static Builder builder(ReflectiveHeap heap) {
        return new Builder(heap);
    }

    @Override
    public Collection<ReflectiveClassDescriptor> loadedClasses() {
        return classes;
    }

    /**
     * Builder for {@link ReflectionClassRegistry}.
     */
    public static final class Builder {
        private final ReflectiveHeap heap;
        private final Set<Class<?>> classes = new LinkedHashSet<>();

        private Builder(ReflectiveHeap heap) {
            this.heap = Objects.requireNonNull(heap);
        }

        public Builder addClass(Class<?>... types) {
            for (Class<?> t : types) {
                addOne(t);
            }
            return this;
        }

        public Builder addClasses(Collection<? extends Class<?>> types) {
            types.forEach(this::addOne);
            return this;
        }

        /**
         * Adds every class found under a package with the Reflections library.
         *
         * @param packageName the package prefix, e.g. {@code com.example}
         * @param classLoaders class loaders to search, the default ones if empty
         */
        public Builder scanPackage(String packageName, ClassLoader... classLoaders) {
            ConfigurationBuilder config = new ConfigurationBuilder()
                    .setUrls(ClasspathHelper.forPackage(packageName, classLoaders))
                    .filterInputsBy(new FilterBuilder().includePackage(packageName))
                    .setScanners(Scanners.SubTypes.filterResultsBy(name -> true));
            if (classLoaders.length > 0) {
                config.addClassLoaders(classLoaders);
            }

            Reflections reflections = new Reflections(config);
            String prefix = packageName + ".";
            List<Class<?>> found = new ArrayList<>();
            for (Class<?> c : reflections.getSubTypesOf(Object.class)) {
                if (c.getName().startsWith(prefix)) {
                    found.add(c);
                }
            }
            found.sort(Comparator.comparing(Class::getName));
            log.debug("Found {} classes under {}", found.size(), packageName);
            return addClasses(found);
        }

        private void addOne(Class<?> type) {
            Objects.requireNonNull(type, "class");
            if (type.isPrimitive() || type.isArray()) {
                // no static fields
                return;
            }
            classes.add(type);
        }

        public ReflectionClassRegistry build() {
            List<ReflectiveClassDescriptor> descriptors = new ArrayList<>(classes.size());
            for (Class<?> c : classes) {
                descriptors.add(heap.describe(c));
            }
            return new ReflectionClassRegistry(descriptors);
        }
    }
}
