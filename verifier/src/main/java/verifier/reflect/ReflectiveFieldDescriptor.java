package verifier.reflect;

import verifier.exceptions.HostIntrospectionException;
import verifier.model.FieldDescriptor;
import verifier.model.HeapObjectRef;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;

/**
 * {@link FieldDescriptor} over an accessible static {@link Field}.
 *
 * <p>Reading the value initializes the declaring class if it has not been
 * initialized yet.
 */
final class ReflectiveFieldDescriptor implements FieldDescriptor {

    private final ReflectiveHeap heap;
    private final Field field;
    private final boolean compileTimeConstant;

    ReflectiveFieldDescriptor(ReflectiveHeap heap, Field field, boolean compileTimeConstant) {
        this.heap = heap;
        this.field = field;
        this.compileTimeConstant = compileTimeConstant;
    }

    @Override
    public String name() {
        return field.getName();
    }

    @Override
    public boolean isObjectTyped() {
        Class<?> type = field.getType();
        return !type.isPrimitive() && !type.isArray();
    }

    @Override
    public boolean isArrayTyped() {
        return field.getType().isArray();
    }

    @Override
    public boolean isFinal() {
        return Modifier.isFinal(field.getModifiers());
    }

    @Override
    public boolean hasCompileTimeInitialValue() {
        return compileTimeConstant;
    }

    @Override
    public HeapObjectRef currentValue() {
        if (!isObjectTyped()) {
            return null;
        }
        try {
            return heap.ref(field.get(null));
        } catch (IllegalAccessException e) {
            throw new HostIntrospectionException(
                    "Static field became unreadable: " + field.getDeclaringClass().getName() + "::" + field.getName(), e);
        }
    }

    @Override
    public String toString() {
        return field.getDeclaringClass().getName() + "::" + field.getName();
    }
}
