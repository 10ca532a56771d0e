package verifier.model;

import org.junit.jupiter.api.Test;

import verifier.support.FakeObject;

import static org.junit.jupiter.api.Assertions.*;

class ReferenceSlotTest {

    @Test
    void objectField() {
        ReferenceSlot s = ReferenceSlot.field("next", false, FakeObject.of("A"));

        assertTrue(s.isObjectTyped());
        assertFalse(s.isArrayTyped());
        assertFalse(s.isArrayElement());
        assertEquals("::next", s.label());
    }

    @Test
    void arrayField() {
        ReferenceSlot s = ReferenceSlot.field("table", true, null);

        assertTrue(s.isArrayTyped());
        assertFalse(s.isObjectTyped());
        assertEquals("::table", s.label());
    }

    @Test
    void arrayElement() {
        ReferenceSlot s = ReferenceSlot.element(3, null);

        assertTrue(s.isArrayElement());
        assertFalse(s.isObjectTyped());
        assertFalse(s.isArrayTyped());
        assertEquals(" @[3]", s.label());
    }

    @Test
    void originRendering() {
        assertEquals("java.lang.System::bootLayer", new StaticFieldOrigin("java.lang.System", "bootLayer").toString());
        assertThrows(NullPointerException.class, () -> new StaticFieldOrigin(null, "f"));
    }
}
