package verifier.reflect;

import org.objectweb.asm.ClassReader;
import org.objectweb.asm.ClassVisitor;
import org.objectweb.asm.FieldVisitor;
import org.objectweb.asm.Opcodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Reads the names of static fields that carry a {@code ConstantValue}
 * attribute, i.e. fields with a compile-time initial value such as
 * {@code static final String NAME = "literal";}.
 *
 * <p>Reflection cannot tell these apart from fields assigned in the static
 * initializer, so the class file is parsed with ASM.
 */
final class ConstantValueReader {

    private static final Logger log = LoggerFactory.getLogger(ConstantValueReader.class);

    private ConstantValueReader() {}

    /**
     * Returns the static fields of {@code clazz} that have a compile-time initial value.
     *
     * @param clazz the class to inspect
     * @return the field names, empty if the class file is not available
     */
    static Set<String> constantFields(Class<?> clazz) {
        if (clazz.isArray() || clazz.isPrimitive()) {
            return Set.of();
        }
        String resource = "/" + clazz.getName().replace('.', '/') + ".class";
        try (InputStream in = clazz.getResourceAsStream(resource)) {
            if (in == null) {
                log.debug("Class file not available for {}", clazz.getName());
                return Set.of();
            }
            return constantFields(in.readAllBytes());
        } catch (IOException e) {
            log.debug("Failed to read class file of {}: {}", clazz.getName(), e.getMessage());
            return Set.of();
        }
    }

    static Set<String> constantFields(byte[] classFile) {
        Set<String> names = new LinkedHashSet<>();
        new ClassReader(classFile).accept(new ClassVisitor(Opcodes.ASM9) {
            @Override
            public FieldVisitor visitField(int access, String name, String descriptor, String signature, Object value) {
                if ((access & Opcodes.ACC_STATIC) != 0 && value != null) {
                    names.add(name);
                }
                return null;
            }
        }, ClassReader.SKIP_CODE | ClassReader.SKIP_DEBUG | ClassReader.SKIP_FRAMES);
        return Set.copyOf(names);
    }
}
