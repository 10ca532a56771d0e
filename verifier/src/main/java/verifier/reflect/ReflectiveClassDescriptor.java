package verifier.reflect;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import verifier.model.ClassDescriptor;
import verifier.model.FieldDescriptor;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * {@link ClassDescriptor} over a {@link Class}.
 *
 * <p>Static fields that cannot be made accessible (e.g. in packages of named
 * modules that are not opened to the verifier) are left out of
 * {@link #staticFields()} and logged at DEBUG.
 */
public final class ReflectiveClassDescriptor implements ClassDescriptor {

    private static final Logger log = LoggerFactory.getLogger(ReflectiveClassDescriptor.class);

    private final ReflectiveHeap heap;
    private final Class<?> clazz;
    private volatile List<FieldDescriptor> staticFields;

    ReflectiveClassDescriptor(ReflectiveHeap heap, Class<?> clazz) {
        this.heap = heap;
        this.clazz = clazz;
    }

    /** Returns the described class. */
    public Class<?> type() {
        return clazz;
    }

    @Override
    public String name() {
        return clazz.getName();
    }

    @Override
    public List<FieldDescriptor> staticFields() {
        List<FieldDescriptor> fields = staticFields;
        if (fields == null) {
            staticFields = fields = loadStaticFields();
        }
        return fields;
    }

    private List<FieldDescriptor> loadStaticFields() {
        Field[] declared = clazz.getDeclaredFields();
        Set<String> constants = null;
        List<FieldDescriptor> result = new ArrayList<>();
        for (Field f : declared) {
            if (!Modifier.isStatic(f.getModifiers())) continue;
            if (!FieldAccess.ensureAccessible(f, null)) {
                log.debug("Skipping inaccessible static field {}::{}", clazz.getName(), f.getName());
                continue;
            }
            boolean hasConstant = false;
            if (Modifier.isFinal(f.getModifiers()) && !f.getType().isPrimitive() && !f.getType().isArray()) {
                // the class file is only parsed for classes with final object fields
                if (constants == null) {
                    constants = ConstantValueReader.constantFields(clazz);
                }
                hasConstant = constants.contains(f.getName());
            }
            result.add(new ReflectiveFieldDescriptor(heap, f, hasConstant));
        }
        return Collections.unmodifiableList(result);
    }

    @Override
    public boolean isRootClass() {
        return heap.isRootClass(clazz);
    }

    @Override
    public boolean hasArchivedEnumInstances() {
        return heap.hasArchivedEnumInstances(clazz);
    }

    @Override
    public String toString() {
        return "ReflectiveClassDescriptor[" + clazz.getName() + "]";
    }
}
