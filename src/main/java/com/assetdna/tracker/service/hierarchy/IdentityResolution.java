package com.assetdna.tracker.service.hierarchy;

import com.assetdna.tracker.model.Asset;

import java.util.Optional;

/**
 * Identity chosen for a record: either an existing asset to update or a freshly minted one.
 */
public record IdentityResolution(String assetId, String urn, Asset existing) {

    public boolean isCreation() {
        return existing == null;
    }

    public Optional<Asset> existingAsset() {
        return Optional.ofNullable(existing);
    }
}
