package verifier.host;

import verifier.model.ClassDescriptor;

import java.util.Collection;

/**
 * The host's registry of loaded classes.
 *
 * <p>The caller guarantees that no class is loaded or unloaded while the
 * verifier walks the registry.
 *
 * @see verifier.scan.ClassFieldScanner
 */
public interface ClassRegistry {

    /**
     * Returns every loaded class. The enumeration order determines which
     * origin wins when two static fields hold the same object.
     *
     * @return the loaded classes, never null
     */
    Collection<? extends ClassDescriptor> loadedClasses();
}
