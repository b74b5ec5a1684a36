package com.assetdna.tracker.service.hierarchy;

import com.assetdna.tracker.model.AssetType;
import com.assetdna.tracker.model.AssetTypeDefinition;
import com.assetdna.tracker.repository.AssetTypeDefinitionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * Seeds the {@code asset_types} collection from {@link AssetType} on startup.
 * Existing rows are rewritten when their label or rank drifted from the enum.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class AssetTypeInitializer implements CommandLineRunner {

    private final AssetTypeDefinitionRepository typeRepository;

    @Override
    public void run(String... args) {
        log.info("Initializing asset types...");
        int written = 0;
        for (AssetType type : AssetType.values()) {
            AssetTypeDefinition expected = AssetTypeDefinition.of(type);
            boolean current = typeRepository.findById(type.getCode())
                    .map(expected::equals)
                    .orElse(false);
            if (!current) {
                typeRepository.save(expected);
                log.info("Initialized asset type {} (rank {})", type.getLabel(), type.getRank());
                written++;
            }
        }
        log.info("Asset types initialized: {} of {} written", written, AssetType.values().length);
    }
}
