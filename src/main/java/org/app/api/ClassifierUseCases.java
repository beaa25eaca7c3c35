package org.app.api;

import org.app.api.dto.AttributeGainView;
import org.app.api.dto.PredictionView;
import org.app.api.dto.TreeSummary;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Application boundary consumed by the demo driver (or any other front end).
 * Keeps callers independent from the model/split/tree packages.
 */
public interface ClassifierUseCases {

    /** Loads a JSON sample file; drops any previously trained tree. */
    void load(Path samplePath);

    /** Loads the sample bundled on the classpath. */
    void loadDefault();

    boolean isLoaded();

    /** Attribute ids of the loaded sample, in file order (this order decides ties). */
    List<String> attributes();

    int sampleSize();

    /** Gain of every attribute over the whole loaded sample for the given truth label. */
    List<AttributeGainView> attributeGains(String truthLabel);

    /**
     * Trains a tree on the loaded sample.
     *
     * @param truthLabel label treated as the positive class
     */
    TreeSummary train(String truthLabel);

    boolean isTrained();

    String currentTruthLabel();

    boolean predict(Map<String, Object> features);

    List<PredictionView> trainingPredictions();

    /** Share of training examples the tree classifies as their label says, in [0, 1]. */
    double trainingAccuracy();

    String renderTree();
}
