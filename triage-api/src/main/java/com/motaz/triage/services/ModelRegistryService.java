package com.motaz.triage.services;

import com.motaz.triage.exception.ModelUnavailableException;
import com.motaz.triage.model.entities.ModelRegistryEntity;
import com.motaz.triage.repositories.ModelRegistryRepository;
import com.motaz.triage.scoring.AutoencoderScorer;
import com.motaz.triage.scoring.ModelBundleReader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the frozen autoencoder shared by all scoring threads. The scorer is
 * loaded once at startup from the latest model registry row; an empty
 * registry is seeded from {@code anomaly.model.bundle-location}.
 */
@Slf4j
@Service
public class ModelRegistryService {

    private final ModelRegistryRepository modelRegistryRepository;
    private final ResourceLoader resourceLoader;
    private final String bundleLocation;
    private final ModelBundleReader bundleReader = new ModelBundleReader();
    private final AtomicReference<AutoencoderScorer> activeScorer = new AtomicReference<>();

    public ModelRegistryService(ModelRegistryRepository modelRegistryRepository,
                                ResourceLoader resourceLoader,
                                @Value("${anomaly.model.bundle-location:}") String bundleLocation) {
        this.modelRegistryRepository = modelRegistryRepository;
        this.resourceLoader = resourceLoader;
        this.bundleLocation = bundleLocation;
    }

    public void loadActiveModel() {
        Optional<ModelRegistryEntity> latest = modelRegistryRepository.findLatestModel();
        try {
            if (latest.isPresent()) {
                activate(latest.get());
            } else if (bundleLocation != null && !bundleLocation.isBlank()) {
                activate(registerBundle(readBundle(bundleLocation), "seeded from " + bundleLocation));
            } else {
                log.warn("Model registry is empty and no bundle location is configured, scoring is unavailable");
            }
        } catch (IOException | IllegalStateException e) {
            log.error("Autoencoder bundle rejected, scoring is unavailable", e);
        }
    }

    /**
     * Validates and stores a bundle as the newest registry row. The running
     * scorer is not swapped; the bundle becomes active on the next startup.
     */
    public ModelRegistryEntity registerBundle(byte[] bundleBytes, String notes) {
        AutoencoderScorer scorer = bundleReader.load(bundleBytes);
        ModelRegistryEntity entity = new ModelRegistryEntity();
        entity.setFeatureSchema(scorer.schema().joinedNames());
        entity.setSchemaHash(scorer.schema().hash());
        entity.setThreshold(scorer.getThreshold());
        entity.setThresholdPercentile(scorer.getThresholdPercentile());
        entity.setNotes(notes);
        entity.setModelBytes(bundleBytes);
        ModelRegistryEntity saved = modelRegistryRepository.save(entity);
        log.info("Registered autoencoder bundle {} with {} features", saved.getId(), scorer.schema().size());
        return saved;
    }

    public AutoencoderScorer requireScorer() {
        AutoencoderScorer scorer = activeScorer.get();
        if (scorer == null) {
            throw new ModelUnavailableException("No autoencoder model is loaded");
        }
        return scorer;
    }

    public boolean isAvailable() {
        return activeScorer.get() != null;
    }

    private void activate(ModelRegistryEntity entity) {
        AutoencoderScorer scorer = bundleReader.load(entity.getModelBytes());
        activeScorer.set(scorer);
        log.info("Loaded autoencoder model {} ({} features, threshold {})", entity.getId(),
                scorer.schema().size(), scorer.getThreshold());
    }

    private byte[] readBundle(String location) throws IOException {
        Resource resource = resourceLoader.getResource(location);
        try (InputStream in = resource.getInputStream()) {
            return in.readAllBytes();
        }
    }
}
