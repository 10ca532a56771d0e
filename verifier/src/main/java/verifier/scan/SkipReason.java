package verifier.scan;

/**
 * The rule under which {@link ClassFieldScanner} declined to index a static
 * object field. Listed in the order the rules are applied.
 */
public enum SkipReason {
    /** The declaring class is a root class; none of its fields are examined. */
    ROOT_CLASS,
    /** The field is exempted in the {@link verifier.exclusion.ExclusionRegistry}. */
    EXCLUDED,
    /** The field currently holds no object. */
    NULL_VALUE,
    /** A final string field with a compile-time initial value: an interned literal. */
    STRING_LITERAL,
    /** A final field holding a class mirror. */
    MIRROR,
    /** The value's class has archived enum instances. */
    ARCHIVED_ENUM
}
