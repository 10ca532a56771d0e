package verifier;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import verifier.config.VerifierConfig;
import verifier.exclusion.ExclusionRegistry;
import verifier.host.InMemorySnapshotCache;
import verifier.model.StaticFieldOrigin;
import verifier.support.FakeClass;
import verifier.support.FakeClassRegistry;
import verifier.support.FakeField;
import verifier.support.FakeObject;
import verifier.support.RecordingDiagnosticSink;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ArchiveHeapVerifier")
class ArchiveHeapVerifierTest {

    private InMemorySnapshotCache cache;
    private RecordingDiagnosticSink sink;

    @BeforeEach
    void setUp() {
        cache = new InMemorySnapshotCache();
        sink = new RecordingDiagnosticSink();
    }

    private void verify(FakeClass... classes) {
        ArchiveHeapVerifier.verify(FakeClassRegistry.of(classes), cache, VerifierConfig.DEFAULTS, sink);
    }

    @Nested
    @DisplayName("scenarios")
    class Scenarios {

        @Test
        @DisplayName("archived root held by a static field should be reported with a one-line trace")
        void archivedRootInStaticField() {
            FakeClass fooClass = FakeClass.named("com.example.Foo");
            FakeObject foo = FakeObject.of(fooClass);
            fooClass.objectField("archivedFoo", foo);
            cache.addRoot(foo);

            verify(fooClass);

            assertThat(sink.problems()).isEqualTo(1);
            assertThat(sink.findings()).singleElement().satisfies(f -> {
                assertThat(f.origin()).isEqualTo(new StaticFieldOrigin("com.example.Foo", "archivedFoo"));
                assertThat(f.value()).isSameAs(foo);
                assertThat(f.trace()).containsExactly("[ 0] " + foo.identity() + " com/example/Foo");
            });
        }

        @Test
        @DisplayName("System.bootLayer should be exempt by default")
        void bootLayerIsExempt() {
            FakeObject layer = FakeObject.of("java.lang.ModuleLayer");
            FakeClass system = FakeClass.named("java.lang.System").objectField("bootLayer", layer);
            cache.addRoot(layer);

            verify(system);

            assertThat(sink.problems()).isZero();
            assertThat(sink.scannedObjects()).isEqualTo(1);
        }

        @Test
        @DisplayName("enum constants with archived instances should not be reported")
        void archivedEnumConstant() {
            FakeClass color = FakeClass.named("com.example.Color").withArchivedEnumInstances();
            FakeObject red = FakeObject.of(color);
            color.field(FakeField.object("RED", red).asFinal());
            cache.addRoot(red);

            verify(color);

            assertThat(sink.problems()).isZero();
        }

        @Test
        @DisplayName("null static field should not be reported")
        void nullStaticField() {
            FakeClass cls = FakeClass.named("com.example.Lazy").objectField("instance", null);
            cache.addRoot(FakeObject.of("com.example.Lazy"));

            verify(cls);

            assertThat(sink.problems()).isZero();
            assertThat(sink.statistics().fieldsIndexed()).isZero();
        }

        @Test
        @DisplayName("string held by a non-literal static field should be traced from the string table")
        void stringRootIsTracedFromStringTable() {
            FakeObject name = FakeObject.string();
            FakeClass cls = FakeClass.named("com.example.Names")
                    .field(FakeField.object("DEFAULT", name).asFinal());
            cache.addRoot(name);

            verify(cls);

            assertThat(sink.findings()).singleElement().satisfies(f -> assertThat(f.trace()).containsExactly(
                    "[ 0] (shared string table)",
                    "[ 1] " + name.identity() + " java/lang/String"));
        }

        @Test
        @DisplayName("literal string constant should not be reported")
        void literalStringConstant() {
            FakeObject name = FakeObject.string();
            FakeClass cls = FakeClass.named("com.example.Names")
                    .field(FakeField.object("DEFAULT", name).asFinal().withCompileTimeInitialValue());
            cache.addRoot(name);

            verify(cls);

            assertThat(sink.problems()).isZero();
        }

        @Test
        @DisplayName("root class fields should never be reported")
        void rootClassFields() {
            FakeClass module = FakeClass.named("com.example.ArchivedModuleGraph").rootClass();
            FakeObject graph = FakeObject.of(module);
            FakeField field = FakeField.object("archivedModuleGraph", graph);
            module.field(field);
            cache.addRoot(graph);

            verify(module);

            assertThat(sink.problems()).isZero();
            assertThat(field.reads()).isZero();
        }
    }

    @Nested
    @DisplayName("check")
    class Check {

        @Test
        @DisplayName("should report every archived object that is a static field value")
        void shouldReportEveryHit() {
            FakeObject a = FakeObject.of("com.example.A");
            FakeObject b = FakeObject.of("com.example.B");
            FakeObject c = FakeObject.of("com.example.C");
            FakeObject holder = FakeObject.of("com.example.Holder").field("a", a).field("c", c);
            FakeClass statics = FakeClass.named("com.example.Statics")
                    .objectField("A", a)
                    .objectField("B", b)
                    .objectField("C", c);
            cache.addRoot(holder);
            cache.add(a, holder);
            cache.add(c, holder);

            verify(statics);

            assertThat(sink.scannedObjects()).isEqualTo(3);
            assertThat(sink.problems()).isEqualTo(2);
            assertThat(sink.findings()).extracting(f -> f.origin().fieldName()).containsExactly("A", "C");
            assertThat(sink.findings().get(1).trace()).containsExactly(
                    "[ 0] " + holder.identity() + " com/example/Holder::c",
                    "[ 1] " + c.identity() + " com/example/C");
        }

        @Test
        @DisplayName("should produce the same report on repeated runs")
        void shouldBeRepeatable() {
            FakeObject bar = FakeObject.of("com.example.Bar");
            FakeObject foo = FakeObject.of("com.example.Foo").field("bar", bar);
            FakeClass barClass = FakeClass.named("com.example.Bar").objectField("bar", bar);
            cache.addRoot(foo);
            cache.add(bar, foo);

            verify(barClass);
            List<String> first = List.copyOf(sink.lines());
            sink = new RecordingDiagnosticSink();
            verify(barClass);

            assertThat(sink.lines()).isEqualTo(first);
            assertThat(sink.problems()).isEqualTo(1);
        }

        @Test
        @DisplayName("should report one summary")
        void shouldReportSummary() {
            cache.addRoot(FakeObject.of("com.example.A"));

            verify(FakeClass.named("com.example.Empty"));

            assertThat(sink.summaries()).isEqualTo(1);
            assertThat(sink.archivedObjects()).isEqualTo(1);
            assertThat(sink.statistics().classesVisited()).isEqualTo(1);
        }

        @Test
        @DisplayName("second check should be rejected")
        void secondCheckShouldThrow() {
            ArchiveHeapVerifier verifier = new ArchiveHeapVerifier(
                    FakeClassRegistry.of(), ExclusionRegistry.defaults(), sink);
            verifier.check(cache);

            assertThatThrownBy(() -> verifier.check(cache))
                    .isInstanceOf(IllegalStateException.class);
        }
    }

    @Test
    @DisplayName("disabled configuration should skip verification entirely")
    void disabledShouldDoNothing() {
        FakeClass fooClass = FakeClass.named("com.example.Foo");
        FakeObject foo = FakeObject.of(fooClass);
        fooClass.objectField("archivedFoo", foo);
        cache.addRoot(foo);

        ArchiveHeapVerifier.verify(FakeClassRegistry.of(fooClass), cache,
                VerifierConfig.builder().enabled(false).build(), sink);

        assertThat(sink.summaries()).isZero();
        assertThat(sink.statistics()).isNull();
        assertThat(sink.findings()).isEmpty();
    }

    @Test
    @DisplayName("configured exclusions should suppress a finding")
    void configuredExclusion() {
        FakeClass fooClass = FakeClass.named("com.example.Foo");
        FakeObject foo = FakeObject.of(fooClass);
        fooClass.objectField("archivedFoo", foo);
        cache.addRoot(foo);

        ArchiveHeapVerifier.verify(FakeClassRegistry.of(fooClass), cache,
                VerifierConfig.builder().exclude("com.example.Foo", "archivedFoo").build(), sink);

        assertThat(sink.problems()).isZero();
        assertThat(sink.summaries()).isEqualTo(1);
    }
}
