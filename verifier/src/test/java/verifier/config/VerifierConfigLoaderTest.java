package verifier.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class VerifierConfigLoaderTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void clearSystemProperties() {
        System.clearProperty("verifier.alert.level");
        System.clearProperty("verifier.exclusions.com.example.FromSystem");
    }

    @Test
    void loadFromPropertiesFile() throws IOException {
        Path f = tempDir.resolve("test.properties");
        Files.writeString(f, """
                verifier.enabled=false
                verifier.alert.level=ERROR
                verifier.include.default.exclusions=false
                verifier.exclusions.com.example.Cache=INSTANCE, EMPTY
                """);

        VerifierConfig c = VerifierConfigLoader.loadFromFile(f);

        assertFalse(c.enabled());
        assertEquals(AlertLevel.ERROR, c.alertLevel());
        assertFalse(c.includeDefaultExclusions());
        assertEquals(Set.of("INSTANCE", "EMPTY"), c.additionalExclusions().get("com.example.Cache"));
    }

    @Test
    void loadFromYamlFile() throws IOException {
        Path f = tempDir.resolve("test.yml");
        Files.writeString(f, """
                verifier:
                  enabled: true
                  alert:
                    level: DEBUG
                  include:
                    default:
                      exclusions: true
                """);

        VerifierConfig c = VerifierConfigLoader.loadFromFile(f);

        assertTrue(c.enabled());
        assertEquals(AlertLevel.DEBUG, c.alertLevel());
        assertTrue(c.includeDefaultExclusions());
    }

    @Test
    void yamlExclusionListsAreJoined() throws IOException {
        Path f = tempDir.resolve("test.yaml");
        Files.writeString(f, """
                verifier:
                  exclusions:
                    com.example.Cache: [A, B]
                """);

        VerifierConfig c = VerifierConfigLoader.loadFromFile(f);

        assertEquals(Set.of("A", "B"), c.additionalExclusions().get("com.example.Cache"));
    }

    @Test
    void parseReadsExclusionKeys() {
        Properties props = new Properties();
        props.setProperty("verifier.exclusions.com/example/Cache", "A");
        props.setProperty("verifier.exclusions.", "ignored");

        VerifierConfig c = VerifierConfigLoader.parse(props);

        assertEquals(Set.of("A"), c.additionalExclusions().get("com.example.Cache"));
        assertEquals(1, c.additionalExclusions().size());
    }

    @Test
    void caseInsensitiveValues() throws IOException {
        Path f = tempDir.resolve("test.properties");
        Files.writeString(f, """
                verifier.enabled=FALSE
                verifier.alert.level=debug
                """);

        VerifierConfig c = VerifierConfigLoader.loadFromFile(f);

        assertFalse(c.enabled());
        assertEquals(AlertLevel.DEBUG, c.alertLevel());
    }

    @Test
    void invalidValuesUseDefaults() throws IOException {
        Path f = tempDir.resolve("test.properties");
        Files.writeString(f, """
                verifier.enabled=maybe
                verifier.alert.level=INVALID
                verifier.include.default.exclusions=1
                """);

        VerifierConfig c = VerifierConfigLoader.loadFromFile(f);

        assertTrue(c.enabled());
        assertEquals(AlertLevel.WARNING, c.alertLevel());
        assertTrue(c.includeDefaultExclusions());
    }

    @Test
    void malformedYamlThrows() throws IOException {
        Path f = tempDir.resolve("broken.yml");
        Files.writeString(f, "verifier: [unclosed\n");

        VerifierConfigException e = assertThrows(VerifierConfigException.class, () -> VerifierConfigLoader.loadFromFile(f));
        assertEquals("broken.yml", e.source());
        assertFalse(e.isMissingConfig());
    }

    @Test
    void systemPropertiesOverrideFile() throws IOException {
        Path f = tempDir.resolve("test.properties");
        Files.writeString(f, "verifier.alert.level=ERROR\n");
        System.setProperty("verifier.alert.level", "DEBUG");
        System.setProperty("verifier.exclusions.com.example.FromSystem", "FIELD");

        VerifierConfig c = VerifierConfigLoader.loadFromFile(f);

        assertEquals(AlertLevel.DEBUG, c.alertLevel());
        assertEquals(Set.of("FIELD"), c.additionalExclusions().get("com.example.FromSystem"));
    }

    @Test
    void loadOrDefaultsWithoutClasspathFile() {
        VerifierConfig c = VerifierConfigLoader.loadOrDefaults();

        assertTrue(c.enabled());
        assertEquals(AlertLevel.WARNING, c.alertLevel());
    }

    @Test
    void loadWithoutClasspathFileThrows() {
        VerifierConfigException e = assertThrows(VerifierConfigException.class, VerifierConfigLoader::load);
        assertTrue(e.isMissingConfig());
    }

    @Test
    void nonexistentFileThrows() {
        Path f = tempDir.resolve("nonexistent.properties");
        assertThrows(IOException.class, () -> VerifierConfigLoader.loadFromFile(f));
    }
}
