package verifier.reflect;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Field;

/**
 * Opens fields for reading by the reflective host.
 *
 * <p>Fields in packages that a named module does not open to the verifier stay
 * closed; callers leave them out of the scan.
 */
final class FieldAccess {

    private static final Logger log = LoggerFactory.getLogger(FieldAccess.class);

    private FieldAccess() {}

    /**
     * Returns true if {@code field} can be read on {@code target}, opening it if needed.
     *
     * @param field the field to read
     * @param target the instance to read from, null for a static field
     */
    static boolean ensureAccessible(Field field, Object target) {
        if (field.canAccess(target)) {
            return true;
        }
        try {
            if (field.trySetAccessible()) {
                return true;
            }
        } catch (SecurityException e) {
            log.debug("Access to {} denied: {}", field, e.getMessage());
            return false;
        }
        Module module = field.getDeclaringClass().getModule();
        log.debug("Package {} of {} is not open to the verifier",
                field.getDeclaringClass().getPackageName(), module.isNamed() ? module.getName() : "unnamed module");
        return false;
    }
}
