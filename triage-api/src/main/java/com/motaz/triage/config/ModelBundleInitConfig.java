package com.motaz.triage.config;

import com.motaz.triage.services.ModelRegistryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class ModelBundleInitConfig {

    private final ModelRegistryService modelRegistryService;

    @Bean
    ApplicationRunner loadModelApplicationRunner() {
        return args -> {
            modelRegistryService.loadActiveModel();
            log.info("autoencoder available: {}", modelRegistryService.isAvailable());
        };
    }

}
