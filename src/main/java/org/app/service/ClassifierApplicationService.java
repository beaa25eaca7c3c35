package org.app.service;

import org.app.api.ClassifierUseCases;
import org.app.api.dto.AttributeGainView;
import org.app.api.dto.PredictionView;
import org.app.api.dto.TreeSummary;
import org.io.SampleSource;
import org.io.json.JsonSampleSource;
import org.io.json.SampleFormat;
import org.model.Example;
import org.model.LabeledExample;
import org.model.Sample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.split.AttributeSelector;
import org.split.AttributeTests;
import org.split.TestGenerator;
import org.tree.DecisionTreeBuilder;
import org.tree.InductionConfig;
import org.tree.Node;
import org.tree.TreeRenderer;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.function.Function;

/** Default application service used by the demo driver through ClassifierUseCases. */
public final class ClassifierApplicationService implements ClassifierUseCases {

    private static final Logger LOG = LoggerFactory.getLogger(ClassifierApplicationService.class);

    static final String DEFAULT_SAMPLE_RESOURCE = "sample_dataset.json";

    private static final Function<String, String> LABEL_PARSER = s -> s;

    private final SampleFormat format;
    private final TestGenerator<String> generator;
    private final DecisionTreeBuilder builder;

    private Sample<String, String> sample;
    private List<String> attributes = List.of();
    private Node<String> tree;
    private String truthLabel;

    public ClassifierApplicationService() {
        this(SampleFormat.defaults(), AttributeTests.truthy(), InductionConfig.defaults());
    }

    public ClassifierApplicationService(SampleFormat format, TestGenerator<String> generator, InductionConfig config) {
        this.format = Objects.requireNonNull(format, "format must not be null");
        this.generator = Objects.requireNonNull(generator, "generator must not be null");
        this.builder = new DecisionTreeBuilder(Objects.requireNonNull(config, "config must not be null"));
    }

    @Override
    public void load(Path samplePath) {
        Objects.requireNonNull(samplePath, "samplePath must not be null");
        if (!Files.isRegularFile(samplePath)) {
            throw new IllegalArgumentException("Sample file does not exist: " + samplePath.toAbsolutePath());
        }
        loadFrom(new JsonSampleSource<>(samplePath.toString(), () -> Files.newInputStream(samplePath), format, LABEL_PARSER));
    }

    @Override
    public void loadDefault() {
        loadResource(DEFAULT_SAMPLE_RESOURCE);
    }

    void loadResource(String resourcePath) {
        if (getClass().getClassLoader().getResource(resourcePath) == null) {
            throw new IllegalStateException("Missing sample resource: " + resourcePath);
        }
        loadFrom(new JsonSampleSource<>(resourcePath, () -> openResource(resourcePath), format, LABEL_PARSER));
    }

    private InputStream openResource(String resourcePath) {
        InputStream in = getClass().getClassLoader().getResourceAsStream(resourcePath);
        if (in == null) {
            throw new IllegalStateException("Missing sample resource: " + resourcePath);
        }
        return in;
    }

    private void loadFrom(SampleSource<String> source) {
        Sample<String, String> loaded = source.load();

        this.sample = loaded;
        this.attributes = source.attributes();
        this.tree = null;
        this.truthLabel = null;

        LOG.info("Loaded {} examples with attributes {}", loaded.size(), attributes);
    }

    @Override
    public boolean isLoaded() { return sample != null; }

    @Override
    public List<String> attributes() { ensureLoaded(); return attributes; }

    @Override
    public int sampleSize() { ensureLoaded(); return sample.size(); }

    @Override
    public List<AttributeGainView> attributeGains(String truthLabel) {
        ensureLoaded();
        requireLabel(truthLabel);
        return AttributeSelector.rankAttributes(sample, attributes, generator, truthLabel).stream()
                .map(g -> new AttributeGainView(g.attribute(), g.gain()))
                .toList();
    }

    @Override
    public TreeSummary train(String truthLabel) {
        ensureLoaded();
        requireLabel(truthLabel);

        Node<String> root = builder.build(sample, attributes, generator, truthLabel);
        this.tree = root;
        this.truthLabel = truthLabel;

        TreeSummary summary = new TreeSummary(root.attribute(), root.depth(), root.leafCount());
        LOG.info("Trained tree for truth label '{}': root='{}', depth={}, leaves={}",
                truthLabel, summary.rootAttribute(), summary.depth(), summary.leaves());
        return summary;
    }

    @Override
    public boolean isTrained() { return tree != null; }

    @Override
    public String currentTruthLabel() { ensureTrained(); return truthLabel; }

    @Override
    public boolean predict(Map<String, Object> features) {
        ensureTrained();
        Objects.requireNonNull(features, "features must not be null");
        return tree.predict(Example.of(features));
    }

    @Override
    public List<PredictionView> trainingPredictions() {
        ensureTrained();
        List<PredictionView> out = new ArrayList<>(sample.size());
        for (LabeledExample<String, String> pair : sample) {
            out.add(new PredictionView(
                    pair.example().asMap(),
                    pair.label(),
                    pair.hasLabel(truthLabel),
                    tree.predict(pair.example())
            ));
        }
        return out;
    }

    @Override
    public double trainingAccuracy() {
        List<PredictionView> predictions = trainingPredictions();
        long correct = predictions.stream().filter(PredictionView::correct).count();
        return (double) correct / predictions.size();
    }

    @Override
    public String renderTree() {
        ensureTrained();
        return TreeRenderer.render(tree);
    }

    private static void requireLabel(String truthLabel) {
        if (truthLabel == null || truthLabel.isBlank()) {
            throw new IllegalArgumentException("truthLabel must be non-empty");
        }
    }

    private void ensureLoaded() {
        if (sample == null) {
            throw new IllegalStateException("No sample loaded");
        }
    }

    private void ensureTrained() {
        if (tree == null) {
            throw new IllegalStateException("No tree trained");
        }
    }
}
