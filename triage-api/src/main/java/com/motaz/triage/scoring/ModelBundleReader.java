package com.motaz.triage.scoring;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads and validates a model bundle. A bundle that fails validation is
 * rejected with an {@link IllegalStateException}.
 */
public class ModelBundleReader {

    private final ObjectMapper objectMapper = JsonMapper.builder()
            .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .build();

    public ModelBundle read(byte[] bundleBytes) {
        ModelBundle bundle;
        try {
            bundle = objectMapper.readValue(bundleBytes, ModelBundle.class);
        } catch (IOException e) {
            throw new IllegalStateException("Model bundle is not readable: " + e.getMessage(), e);
        }
        validate(bundle);
        return bundle;
    }

    public AutoencoderScorer load(byte[] bundleBytes) {
        ModelBundle bundle = read(bundleBytes);
        List<DenseLayer> layers = new ArrayList<>();
        for (LayerSpec spec : bundle.getLayers()) {
            layers.add(new DenseLayer(spec.getWeights(), spec.getBias(), spec.getActivation()));
        }
        FeatureSchema schema = new FeatureSchema(bundle.getFeatures());
        return new AutoencoderScorer(new FeatureCodec(schema), new AutoencoderNetwork(layers),
                bundle.getThreshold(), bundle.getThresholdPercentile());
    }

    void validate(ModelBundle bundle) {
        if (bundle.getFeatures() == null || bundle.getFeatures().isEmpty()) {
            throw new IllegalStateException("Model bundle has no features");
        }
        for (FeatureSpec feature : bundle.getFeatures()) {
            if (feature.getName() == null || feature.getName().isBlank() || feature.getType() == null) {
                throw new IllegalStateException("Model bundle has a feature without name or type");
            }
            if (!(feature.getScale() > 0) || !Double.isFinite(feature.getScale())) {
                throw new IllegalStateException("Feature '" + feature.getName() + "' has non-positive scale");
            }
        }
        if (!(bundle.getThreshold() >= 0) || !Double.isFinite(bundle.getThreshold())) {
            throw new IllegalStateException("Model bundle threshold must be a non-negative number");
        }
        if (bundle.getLayers() == null || bundle.getLayers().isEmpty()) {
            throw new IllegalStateException("Model bundle has no layers");
        }
        int width = bundle.getFeatures().size();
        for (int l = 0; l < bundle.getLayers().size(); l++) {
            LayerSpec layer = bundle.getLayers().get(l);
            if (layer.getWeights() == null || layer.getWeights().length == 0 || layer.getBias() == null
                    || layer.getActivation() == null) {
                throw new IllegalStateException("Layer " + l + " is incomplete");
            }
            if (layer.getBias().length != layer.getWeights().length) {
                throw new IllegalStateException("Layer " + l + " bias length " + layer.getBias().length
                        + " does not match " + layer.getWeights().length + " outputs");
            }
            for (double[] row : layer.getWeights()) {
                if (row == null || row.length != width) {
                    throw new IllegalStateException("Layer " + l + " expects input width " + width);
                }
            }
            width = layer.getWeights().length;
        }
        if (width != bundle.getFeatures().size()) {
            throw new IllegalStateException("Output width " + width + " does not reconstruct "
                    + bundle.getFeatures().size() + " features");
        }
    }
}
