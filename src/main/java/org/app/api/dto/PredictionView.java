package org.app.api.dto;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One training example as seen by the trained tree.
 *
 * @param features  raw attribute values
 * @param label     the training label
 * @param expected  whether the label equals the truth label
 * @param predicted the tree's verdict
 */
public record PredictionView(Map<String, Object> features, String label, boolean expected, boolean predicted) {
    public PredictionView {
        Objects.requireNonNull(features, "features must not be null");
        Objects.requireNonNull(label, "label must not be null");
        features = Collections.unmodifiableMap(new LinkedHashMap<>(features));
    }

    public boolean correct() {
        return expected == predicted;
    }
}
