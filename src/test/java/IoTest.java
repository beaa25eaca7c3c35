import org.io.SampleSource;
import org.io.json.JsonSampleSource;
import org.io.json.SampleFormat;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.model.LabeledExample;
import org.model.Sample;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * A single test file that covers:
 * - SampleFormat
 * - JsonSampleSource (parsing, validation, caching, attribute order)
 */
public class IoTest {

    private static JsonSampleSource.InputStreamSupplier text(String json) {
        return () -> new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8));
    }

    private static JsonSampleSource<String> source(String json) {
        return JsonSampleSource.ofText("test", text(json));
    }

    // ----------------------------
    // SampleFormat tests
    // ----------------------------
    @Nested
    class SampleFormatTests {

        @Test
        void rejectsBlankOrEqualFields() {
            assertThrows(IllegalArgumentException.class, () -> new SampleFormat(null, "label"));
            assertThrows(IllegalArgumentException.class, () -> new SampleFormat("features", " "));
            assertThrows(IllegalArgumentException.class, () -> new SampleFormat("x", "x"));
        }

        @Test
        void defaultsUseFeaturesAndLabel() {
            SampleFormat f = SampleFormat.defaults();
            assertEquals("features", f.featuresField());
            assertEquals("label", f.labelField());
        }
    }

    // ----------------------------
    // Parsing
    // ----------------------------
    @Nested
    class Parsing {

        private static final String VALID = """
                [
                  { "features": { "sunny": true, "temp": 21, "wind": 3.5, "city": "Haifa" }, "label": 1 },
                  { "features": { "sunny": false, "temp": 12, "wind": 0.0, "city": "" }, "label": 0, "note": {"x": [1, 2]} }
                ]
                """;

        @Test
        void readsValuesOfEveryShape() {
            Sample<String, String> s = source(VALID).load();

            assertEquals(2, s.size());
            LabeledExample<String, String> first = s.get(0);
            assertEquals("1", first.label());
            assertEquals(Boolean.TRUE, first.example().require("sunny"));
            assertEquals(21, ((Number) first.example().require("temp")).intValue());
            assertEquals(3.5, (Double) first.example().require("wind"), 0.0);
            assertEquals("Haifa", first.example().require("city"));

            assertEquals("0", s.get(1).label());
            assertEquals("", s.get(1).example().require("city"));
        }

        @Test
        void attributesFollowFirstObjectOrder() {
            SampleSource<String> src = source(VALID);
            assertEquals(List.of("sunny", "temp", "wind", "city"), src.attributes());
        }

        @Test
        void labelsMayBeStringsOrBooleans() {
            String json = """
                    [
                      { "features": { "a": true }, "label": "yes" },
                      { "features": { "a": false }, "label": true }
                    ]
                    """;
            Sample<String, String> s = source(json).load();
            assertEquals("yes", s.get(0).label());
            assertEquals("true", s.get(1).label());
        }

        @Test
        void customFormatAndLabelParser() {
            String json = """
                    [ { "x": { "a": true }, "y": "7" } ]
                    """;
            JsonSampleSource<Integer> src =
                    new JsonSampleSource<>("custom", text(json), new SampleFormat("x", "y"), Integer::parseInt);

            assertEquals(7, src.load().first().label());
        }
    }

    // ----------------------------
    // Validation
    // ----------------------------
    @Nested
    class Validation {

        @Test
        void rootMustBeArray() {
            assertThrows(IllegalArgumentException.class, () -> source("{\"features\": {}}").load());
        }

        @Test
        void elementsMustBeObjects() {
            assertThrows(IllegalArgumentException.class, () -> source("[1, 2]").load());
        }

        @Test
        void emptyArrayIsRejected() {
            assertThrows(IllegalArgumentException.class, () -> source("[]").load());
        }

        @Test
        void missingOrEmptyFeaturesAreRejected() {
            assertThrows(IllegalArgumentException.class, () -> source("[{\"label\": 1}]").load());
            assertThrows(IllegalArgumentException.class, () -> source("[{\"features\": {}, \"label\": 1}]").load());
            assertThrows(IllegalArgumentException.class, () -> source("[{\"features\": [true], \"label\": 1}]").load());
        }

        @Test
        void missingLabelIsRejected() {
            assertThrows(IllegalArgumentException.class, () -> source("[{\"features\": {\"a\": true}}]").load());
            assertThrows(IllegalArgumentException.class,
                    () -> source("[{\"features\": {\"a\": true}, \"label\": null}]").load());
        }

        @Test
        void nullOrNestedFeatureValuesAreRejected() {
            assertThrows(IllegalArgumentException.class,
                    () -> source("[{\"features\": {\"a\": null}, \"label\": 1}]").load());
            assertThrows(IllegalArgumentException.class,
                    () -> source("[{\"features\": {\"a\": {\"b\": 1}}, \"label\": 1}]").load());
        }

        @Test
        void inconsistentAttributeSetsAreRejected() {
            String json = """
                    [
                      { "features": { "a": true, "b": true }, "label": 1 },
                      { "features": { "a": true }, "label": 0 }
                    ]
                    """;
            IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> source(json).load());
            assertTrue(ex.getMessage().contains("Inconsistent attributes"));
        }

        @Test
        void sameAttributesInOtherOrderAreAccepted() {
            String json = """
                    [
                      { "features": { "a": true, "b": false }, "label": 1 },
                      { "features": { "b": true, "a": false }, "label": 0 }
                    ]
                    """;
            SampleSource<String> src = source(json);
            assertEquals(2, src.load().size());
            assertEquals(List.of("a", "b"), src.attributes());
        }

        @Test
        void ioFailureIsWrapped() {
            JsonSampleSource<String> broken = JsonSampleSource.ofText("broken", () -> {
                throw new IOException("disk on fire");
            });
            UncheckedIOException ex = assertThrows(UncheckedIOException.class, broken::load);
            assertTrue(ex.getMessage().contains("broken"));
        }

        @Test
        void ctorRejectsMissingParts() {
            assertThrows(IllegalArgumentException.class, () -> JsonSampleSource.ofText(" ", text("[]")));
            assertThrows(NullPointerException.class, () -> JsonSampleSource.ofText("x", null));
        }
    }

    // ----------------------------
    // Caching + files
    // ----------------------------
    @Nested
    class CachingAndFiles {

        @TempDir
        Path tempDir;

        @Test
        void loadsOnceAndReturnsSameInstance() {
            AtomicInteger opens = new AtomicInteger();
            String json = "[{\"features\": {\"a\": true}, \"label\": 1}]";
            JsonSampleSource<String> src = JsonSampleSource.ofText("counted", () -> {
                opens.incrementAndGet();
                return new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8));
            });

            Sample<String, String> s1 = src.load();
            Sample<String, String> s2 = src.load();
            src.attributes();

            assertSame(s1, s2);
            assertEquals(1, opens.get());
        }

        @Test
        void readsFromFile() throws IOException {
            Path file = tempDir.resolve("sample.json");
            Files.writeString(file, """
                    [
                      { "features": { "a": true }, "label": 1 },
                      { "features": { "a": false }, "label": 0 }
                    ]
                    """, StandardCharsets.UTF_8);

            JsonSampleSource<String> src = JsonSampleSource.ofText(file.toString(), () -> Files.newInputStream(file));
            assertEquals(2, src.load().size());
            assertEquals(file.toString(), src.sourceName());
        }
    }
}
