package verifier.model;

/**
 * A declared static field of a {@link ClassDescriptor}.
 */
public interface FieldDescriptor {

    /** Returns the field name. */
    String name();

    /**
     * Returns true if the field's declared type is a plain object reference.
     * Array-typed and primitive fields are not object-typed.
     */
    boolean isObjectTyped();

    /** Returns true if the field's declared type is an array type, primitive or reference. */
    boolean isArrayTyped();

    /** Returns true if the field is declared final. */
    boolean isFinal();

    /** Returns true if the class file carries a compile-time initial value for this field. */
    boolean hasCompileTimeInitialValue();

    /**
     * Reads the current value of this field from the static storage of its
     * declaring class.
     *
     * @return the current value, or null when the field holds no object or is
     *         not object-typed
     */
    HeapObjectRef currentValue();
}
