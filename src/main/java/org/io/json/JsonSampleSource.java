package org.io.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.io.SampleSource;
import org.model.LabeledExample;
import org.model.Sample;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.*;
import java.util.function.Function;

/**
 * JSON implementation of SampleSource.
 *
 * Expected JSON shape: array of objects
 * [
 *   { "features": { "a": true, "b": false }, "label": 1 },
 *   { "features": { "a": false, "b": true }, "label": 0 }
 * ]
 *
 * Feature values may be booleans, numbers or strings. Labels are read as text and
 * handed to the label parser (so 1, "1" and true become "1", "1" and "true").
 */
public final class JsonSampleSource<L> implements SampleSource<L> {

    private final InputStreamSupplier streamSupplier;
    private final SampleFormat format;
    private final Function<String, L> labelParser;
    private final String sourceName;

    // Cached after first load
    private volatile Sample<String, L> cached;
    private volatile List<String> cachedAttributes;

    private final Object lock = new Object();

    public JsonSampleSource(String sourceName,
                            InputStreamSupplier streamSupplier,
                            SampleFormat format,
                            Function<String, L> labelParser) {

        if (sourceName == null || sourceName.isBlank()) {
            throw new IllegalArgumentException("sourceName must be non-empty");
        }
        this.sourceName = sourceName;
        this.streamSupplier = Objects.requireNonNull(streamSupplier, "streamSupplier must not be null");
        this.format = Objects.requireNonNull(format, "format must not be null");
        this.labelParser = Objects.requireNonNull(labelParser, "labelParser must not be null");
    }

    /**
     * Convenience: default format, labels kept as their JSON text.
     */
    public static JsonSampleSource<String> ofText(String sourceName, InputStreamSupplier streamSupplier) {
        return new JsonSampleSource<>(sourceName, streamSupplier, SampleFormat.defaults(), Function.identity());
    }

    @Override
    public Sample<String, L> load() {
        Sample<String, L> local = cached;
        if (local != null) {
            return local;
        }

        synchronized (lock) {
            if (cached != null) {
                return cached;
            }
            Loaded<L> loaded = loadOnce();
            this.cachedAttributes = loaded.attributes;
            this.cached = loaded.sample;
            return this.cached;
        }
    }

    @Override
    public List<String> attributes() {
        load();
        return cachedAttributes;
    }

    public String sourceName() {
        return sourceName;
    }

    private Loaded<L> loadOnce() {
        ObjectMapper mapper = new ObjectMapper();
        JsonFactory factory = mapper.getFactory();

        List<LabeledExample<String, L>> result = new ArrayList<>();
        List<String> attributes = null;

        try (InputStream in = streamSupplier.open();
             JsonParser p = factory.createParser(in)) {

            // Expect start array
            if (p.nextToken() != JsonToken.START_ARRAY) {
                throw new IllegalArgumentException("JSON must start with an array of objects");
            }

            int index = 0;
            while (p.nextToken() != JsonToken.END_ARRAY) {
                if (p.currentToken() != JsonToken.START_OBJECT) {
                    throw new IllegalArgumentException("Expected an object inside the array at index " + index);
                }

                Map<String, Object> features = null;
                String rawLabel = null;

                while (p.nextToken() != JsonToken.END_OBJECT) {
                    String field = p.currentName();
                    p.nextToken(); // move to value

                    if (format.featuresField().equals(field)) {
                        features = readFeatures(p, index);
                    } else if (format.labelField().equals(field)) {
                        rawLabel = p.getValueAsString(null);
                    } else {
                        // Skip unknown fields cleanly
                        p.skipChildren();
                    }
                }

                // Validate features
                if (features == null) {
                    throw new IllegalArgumentException(
                            "Missing features field '" + format.featuresField() + "' at index " + index
                    );
                }
                if (features.isEmpty()) {
                    throw new IllegalArgumentException("Features must not be empty at index " + index);
                }

                if (attributes == null) {
                    attributes = List.copyOf(features.keySet());
                } else if (!new HashSet<>(attributes).equals(features.keySet())) {
                    throw new IllegalArgumentException(
                            "Inconsistent attributes in '" + sourceName + "': expected " + attributes +
                                    " but got " + features.keySet() + " at index " + index
                    );
                }

                // Validate label
                if (rawLabel == null || rawLabel.isBlank()) {
                    throw new IllegalArgumentException(
                            "Missing/blank label field '" + format.labelField() + "' at index " + index
                    );
                }
                L label = labelParser.apply(rawLabel);
                if (label == null) {
                    throw new IllegalArgumentException("Parsed label is null for raw label: " + rawLabel);
                }

                result.add(LabeledExample.of(features, label));
                index++;
            }

            if (result.isEmpty()) {
                throw new IllegalArgumentException("JSON array is empty in '" + sourceName + "'");
            }

            return new Loaded<>(Sample.of(result), attributes);

        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read JSON sample '" + sourceName + "'", e);
        }
    }

    private static Map<String, Object> readFeatures(JsonParser p, int index) throws IOException {
        if (p.currentToken() != JsonToken.START_OBJECT) {
            throw new IllegalArgumentException("Features field must be a JSON object at index " + index);
        }

        Map<String, Object> out = new LinkedHashMap<>();
        while (p.nextToken() != JsonToken.END_OBJECT) {
            String name = p.currentName();
            JsonToken value = p.nextToken();

            Object parsed = switch (value) {
                case VALUE_TRUE -> Boolean.TRUE;
                case VALUE_FALSE -> Boolean.FALSE;
                case VALUE_NUMBER_INT -> p.getNumberValue();
                case VALUE_NUMBER_FLOAT -> p.getDoubleValue();
                case VALUE_STRING -> p.getText();
                default -> throw new IllegalArgumentException(
                        "Feature '" + name + "' must be a boolean, number or string at index " + index
                );
            };

            if (out.put(name, parsed) != null) {
                throw new IllegalArgumentException("Duplicate feature '" + name + "' at index " + index);
            }
        }
        return out;
    }

    private record Loaded<L>(Sample<String, L> sample, List<String> attributes) { }

    /**
     * Simple functional interface so callers can provide:
     * - a file stream
     * - a classpath resource stream
     * - an in-memory stream (tests)
     */
    @FunctionalInterface
    public interface InputStreamSupplier {
        InputStream open() throws IOException;
    }
}
