package verifier.reflect;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import verifier.model.ClassDescriptor;
import verifier.model.HeapObjectRef;
import verifier.model.ReferenceSlot;

import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Locale;

/**
 * {@link HeapObjectRef} over a Java object.
 *
 * <p>Two refs are equal exactly when they wrap the same object, regardless of
 * the object's own {@code equals}.
 */
public final class ReflectiveObjectRef implements HeapObjectRef {

    private static final Logger log = LoggerFactory.getLogger(ReflectiveObjectRef.class);

    private static final int MAX_DESCRIPTION = 120;

    private final ReflectiveHeap heap;
    private final Object referent;
    private final int hash;

    ReflectiveObjectRef(ReflectiveHeap heap, Object referent) {
        this.heap = heap;
        this.referent = referent;
        this.hash = System.identityHashCode(referent);
    }

    /** Returns the wrapped object. */
    public Object referent() {
        return referent;
    }

    @Override
    public ClassDescriptor ownerClass() {
        return heap.describe(referent.getClass());
    }

    @Override
    public boolean isString() {
        return referent instanceof String;
    }

    @Override
    public boolean isMirror() {
        return referent instanceof Class<?>;
    }

    @Override
    public boolean isArray() {
        Class<?> cls = referent.getClass();
        return cls.isArray() && !cls.getComponentType().isPrimitive();
    }

    @Override
    public List<ReferenceSlot> referenceSlots() {
        Class<?> cls = referent.getClass();
        if (cls.isArray()) {
            if (cls.getComponentType().isPrimitive()) {
                return List.of();
            }
            int len = Array.getLength(referent);
            List<ReferenceSlot> slots = new ArrayList<>(len);
            for (int i = 0; i < len; i++) {
                slots.add(ReferenceSlot.element(i, heap.ref(Array.get(referent, i))));
            }
            return Collections.unmodifiableList(slots);
        }

        List<ReferenceSlot> slots = new ArrayList<>();
        for (Class<?> c : hierarchyTopDown(cls)) {
            for (Field f : c.getDeclaredFields()) {
                if (Modifier.isStatic(f.getModifiers()) || f.getType().isPrimitive()) continue;
                if (!FieldAccess.ensureAccessible(f, referent)) {
                    log.debug("Skipping inaccessible field {}::{}", c.getName(), f.getName());
                    continue;
                }
                try {
                    slots.add(ReferenceSlot.field(f.getName(), f.getType().isArray(), heap.ref(f.get(referent))));
                } catch (IllegalAccessException e) {
                    log.debug("Failed to read field {}::{}: {}", c.getName(), f.getName(), e.getMessage());
                }
            }
        }
        return Collections.unmodifiableList(slots);
    }

    // superclass fields come first, as in the object layout
    private static Deque<Class<?>> hierarchyTopDown(Class<?> cls) {
        Deque<Class<?>> chain = new ArrayDeque<>();
        for (Class<?> c = cls; c != null; c = c.getSuperclass()) {
            chain.addFirst(c);
        }
        return chain;
    }

    @Override
    public String identity() {
        return String.format(Locale.ROOT, "0x%08x", hash);
    }

    @Override
    public String describe() {
        StringBuilder sb = new StringBuilder(identity()).append(' ').append(referent.getClass().getName());
        if (referent instanceof String s) {
            sb.append(" - string: \"").append(truncate(s)).append('"');
        } else if (referent instanceof Class<?> c) {
            sb.append(" - mirror of ").append(c.getName());
        } else if (referent.getClass().isArray()) {
            sb.append(" - length: ").append(Array.getLength(referent));
        } else {
            sb.append(" [").append(truncate(safeToString())).append(']');
        }
        return sb.toString();
    }

    private String safeToString() {
        try {
            String s = referent.toString();
            return s != null ? s : "null";
        } catch (RuntimeException e) {
            return "toString failed";
        }
    }

    private static String truncate(String s) {
        return s.length() <= MAX_DESCRIPTION ? s : s.substring(0, MAX_DESCRIPTION) + "...";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ReflectiveObjectRef other)) return false;
        return referent == other.referent;
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return identity() + " " + referent.getClass().getName();
    }
}
