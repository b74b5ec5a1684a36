package com.assetdna.tracker.exception;

public class OrphanAssetException extends AssetDnaException {

    public OrphanAssetException(String message) {
        super(ErrorCode.ORPHAN_ASSET, message);
    }
}
