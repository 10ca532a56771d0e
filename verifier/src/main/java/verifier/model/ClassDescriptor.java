package verifier.model;

import java.util.List;

/**
 * A loaded class as seen by the verifier.
 *
 * @see FieldDescriptor
 * @see verifier.host.ClassRegistry
 */
public interface ClassDescriptor {

    /**
     * Returns the external class name, e.g. {@code java.lang.System}.
     *
     * @return the class name
     */
    String name();

    /**
     * Returns the internal class name, e.g. {@code java/lang/System}.
     *
     * @return the internal name
     */
    default String internalName() {
        return name().replace('.', '/');
    }

    /**
     * Returns the declared static fields in declaration order.
     *
     * @return the static fields, never null
     */
    List<FieldDescriptor> staticFields();

    /**
     * Returns true if the static object fields of this class are restored by
     * a separately verified mechanism and must not be examined.
     */
    boolean isRootClass();

    /** Returns true if at least one instance of this class has been archived as an enum constant. */
    boolean hasArchivedEnumInstances();
}
