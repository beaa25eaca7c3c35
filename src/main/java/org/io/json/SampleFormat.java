package org.io.json;

/**
 * Describes where the attribute values and the label are stored in each JSON object.
 * Example object:
 * { "features": { "a": true, "b": false }, "label": 1 }
 */
public record SampleFormat(String featuresField, String labelField) {

    public SampleFormat {
        if (featuresField == null || featuresField.isBlank()) {
            throw new IllegalArgumentException("featuresField must be non-empty");
        }
        if (labelField == null || labelField.isBlank()) {
            throw new IllegalArgumentException("labelField must be non-empty");
        }
        if (featuresField.equals(labelField)) {
            throw new IllegalArgumentException("featuresField and labelField must differ");
        }
    }

    public static SampleFormat defaults() {
        return new SampleFormat("features", "label");
    }
}
