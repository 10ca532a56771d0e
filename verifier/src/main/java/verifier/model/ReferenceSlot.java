package verifier.model;

/**
 * An object-valued storage location inside a heap object: either a named
 * instance field or an element of a reference array.
 *
 * <p>Only object- or array-typed locations are ever represented; primitive
 * fields and primitive arrays have no slots.
 *
 * @param name the field name, or null for an array element
 * @param index the element index, or -1 for a field
 * @param arrayTyped true if the field's declared type is an array
 * @param value the current value, or null
 */
public record ReferenceSlot(String name, int index, boolean arrayTyped, HeapObjectRef value) {

    /**
     * Creates a slot for a named instance field.
     */
    public static ReferenceSlot field(String name, boolean arrayTyped, HeapObjectRef value) {
        return new ReferenceSlot(name, -1, arrayTyped, value);
    }

    /**
     * Creates a slot for a reference array element.
     */
    public static ReferenceSlot element(int index, HeapObjectRef value) {
        return new ReferenceSlot(null, index, false, value);
    }

    /** Returns true if this slot is an array element rather than a named field. */
    public boolean isArrayElement() {
        return index >= 0;
    }

    /** Returns true if this is a named field whose declared type is a plain object type. */
    public boolean isObjectTyped() {
        return !isArrayElement() && !arrayTyped;
    }

    /** Returns true if this is a named field whose declared type is an array type. */
    public boolean isArrayTyped() {
        return !isArrayElement() && arrayTyped;
    }

    /**
     * Renders the slot the way it is appended to a trace line:
     * {@code ::name} for a field, {@code  @[i]} for an array element.
     */
    public String label() {
        return isArrayElement() ? " @[" + index + "]" : "::" + name;
    }
}
