package com.assetdna.tracker.exception;

public class AssetNotFoundException extends AssetDnaException {

    public AssetNotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }

    public static AssetNotFoundException forId(String assetId) {
        return new AssetNotFoundException("Asset not found with id: " + assetId);
    }
}
