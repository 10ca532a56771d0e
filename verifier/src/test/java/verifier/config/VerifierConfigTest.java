package verifier.config;

import org.junit.jupiter.api.Test;

import verifier.exclusion.ExclusionCategory;
import verifier.exclusion.ExclusionRegistry;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class VerifierConfigTest {

    @Test
    void defaults() {
        VerifierConfig c = VerifierConfig.DEFAULTS;

        assertTrue(c.enabled());
        assertEquals(AlertLevel.WARNING, c.alertLevel());
        assertTrue(c.includeDefaultExclusions());
        assertTrue(c.additionalExclusions().isEmpty());
    }

    @Test
    void builderSetsValues() {
        VerifierConfig c = VerifierConfig.builder()
                .enabled(false)
                .alertLevel(AlertLevel.DEBUG)
                .includeDefaultExclusions(false)
                .exclude("com.example.Cache", "INSTANCE")
                .build();

        assertFalse(c.enabled());
        assertEquals(AlertLevel.DEBUG, c.alertLevel());
        assertFalse(c.includeDefaultExclusions());
        assertEquals(Set.of("INSTANCE"), c.additionalExclusions().get("com.example.Cache"));
    }

    @Test
    void nullAlertLevelFallsBackToWarning() {
        VerifierConfig c = VerifierConfig.builder().alertLevel(null).build();

        assertEquals(AlertLevel.WARNING, c.alertLevel());
    }

    @Test
    void excludeNormalizesNames() {
        VerifierConfig c = VerifierConfig.builder()
                .exclude(" com/example/Cache ", " A ", "", "B")
                .exclude("com.example.Cache", "C")
                .build();

        assertEquals(Set.of("A", "B", "C"), c.additionalExclusions().get("com.example.Cache"));
    }

    @Test
    void excludeRejectsBlankClassName() {
        assertThrows(IllegalArgumentException.class, () -> VerifierConfig.builder().exclude(" ", "x"));
        assertThrows(IllegalArgumentException.class, () -> VerifierConfig.builder().exclude(null, "x"));
    }

    @Test
    void exclusionRegistryUsesDefaultTable() {
        ExclusionRegistry r = VerifierConfig.DEFAULTS.exclusionRegistry();

        assertTrue(r.isExcluded("java.lang.System", "bootLayer"));
        assertEquals(ExclusionRegistry.defaults().size(), r.size());
    }

    @Test
    void exclusionRegistryMergesConfiguredFields() {
        ExclusionRegistry r = VerifierConfig.builder()
                .exclude("com.example.Cache", "INSTANCE")
                .build()
                .exclusionRegistry();

        assertTrue(r.isExcluded("java.lang.System", "bootLayer"));
        assertTrue(r.isExcluded("com.example.Cache", "INSTANCE"));
        assertEquals(ExclusionCategory.AD_HOC, r.categoryOf("com.example.Cache", "INSTANCE"));
    }

    @Test
    void exclusionRegistryWithoutDefaults() {
        ExclusionRegistry r = VerifierConfig.builder()
                .includeDefaultExclusions(false)
                .exclude("com.example.Cache", "INSTANCE")
                .build()
                .exclusionRegistry();

        assertFalse(r.isExcluded("java.lang.System", "bootLayer"));
        assertTrue(r.isExcluded("com.example.Cache", "INSTANCE"));
        assertEquals(1, r.size());
    }
}
