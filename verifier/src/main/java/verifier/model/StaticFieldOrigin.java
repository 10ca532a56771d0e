package verifier.model;

import java.util.Objects;

/**
 * The (class, field) pair through which a live object is currently exposed.
 *
 * @param ownerClassName the external name of the class declaring the field
 * @param fieldName the static field name
 */
public record StaticFieldOrigin(String ownerClassName, String fieldName) {

    public StaticFieldOrigin {
        Objects.requireNonNull(ownerClassName, "ownerClassName");
        Objects.requireNonNull(fieldName, "fieldName");
    }

    @Override
    public String toString() {
        return ownerClassName + "::" + fieldName;
    }
}
