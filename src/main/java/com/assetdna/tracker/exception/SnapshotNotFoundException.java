package com.assetdna.tracker.exception;

public class SnapshotNotFoundException extends AssetDnaException {

    public SnapshotNotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }
}
