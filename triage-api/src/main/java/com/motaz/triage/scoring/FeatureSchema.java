package com.motaz.triage.scoring;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;

/** Ordered feature list of a model bundle. Column i of every feature vector is feature i. */
public class FeatureSchema {

    private final List<FeatureSpec> features;

    public FeatureSchema(List<FeatureSpec> features) {
        this.features = List.copyOf(features);
    }

    public int size() {
        return features.size();
    }

    public FeatureSpec get(int index) {
        return features.get(index);
    }

    public List<FeatureSpec> features() {
        return features;
    }

    public List<String> names() {
        return features.stream().map(FeatureSpec::getName).toList();
    }

    public String joinedNames() {
        return String.join(",", names());
    }

    public String hash() {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(joinedNames().getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
