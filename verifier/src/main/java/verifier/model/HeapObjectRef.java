package verifier.model;

import java.util.List;

/**
 * Opaque identity of a managed heap object.
 *
 * <p>Implementations must compare by identity of the underlying object: two
 * refs are {@code equals} exactly when they denote the same heap object, and
 * {@code hashCode} must be consistent with that. The verifier relies on this
 * to key the {@link verifier.index.LiveStaticFieldIndex}.
 *
 * @see ReferenceSlot
 */
public interface HeapObjectRef {

    /**
     * Returns the class this object is an instance of.
     *
     * @return the owning class descriptor
     */
    ClassDescriptor ownerClass();

    /** Returns true if this object is a string instance. */
    boolean isString();

    /** Returns true if this object is itself a class object (a mirror). */
    boolean isMirror();

    /** Returns true if this object is an array of references. */
    boolean isArray();

    /**
     * Returns the object-valued instance fields, or the elements when this is
     * a reference array, in declaration (or index) order.
     *
     * @return the reference slots, never null
     */
    List<ReferenceSlot> referenceSlots();

    /**
     * Returns a short identity rendering, e.g. {@code 0x1b6d3586}.
     *
     * @return the identity string
     */
    String identity();

    /**
     * Returns a textual rendering of the object for diagnostics.
     *
     * @return the description
     */
    String describe();
}
