package org.app;

import org.app.api.ClassifierUseCases;
import org.app.api.dto.AttributeGainView;
import org.app.api.dto.PredictionView;
import org.app.api.dto.TreeSummary;
import org.app.service.ClassifierApplicationService;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Command-line demo: loads a sample (the bundled one, or the JSON file given as first argument),
 * trains a tree and prints it together with the prediction for every training example.
 *
 * Usage: DecisionTreeDemo [sample.json] [truthLabel]
 */
public final class DecisionTreeDemo {

    private static final String DEFAULT_TRUTH_LABEL = "1";

    private DecisionTreeDemo() {
    }

    public static void main(String[] args) {
        ClassifierUseCases app = new ClassifierApplicationService();

        if (args.length > 0) {
            app.load(Path.of(args[0]));
        } else {
            app.loadDefault();
        }
        String truthLabel = args.length > 1 ? args[1] : DEFAULT_TRUTH_LABEL;

        System.out.println("=== Gain per attribute (truth label " + truthLabel + ") ===");
        for (AttributeGainView g : app.attributeGains(truthLabel)) {
            System.out.printf(Locale.ROOT, "%-12s %.6f%n", g.attribute(), g.gain());
        }
        System.out.println();

        TreeSummary summary = app.train(truthLabel);
        System.out.println("=== Tree (depth " + summary.depth() + ", " + summary.leaves() + " leaves) ===");
        System.out.print(app.renderTree());
        System.out.println();

        System.out.println("=== Predictions ===");
        for (PredictionView p : app.trainingPredictions()) {
            System.out.println(p.features() + " label=" + p.label() + " -> " + p.predicted());
        }
        System.out.printf(Locale.ROOT, "%nTraining accuracy: %.2f%n", app.trainingAccuracy());
    }
}
