package com.assetdna.tracker.exception;

public class InvalidHierarchyException extends AssetDnaException {

    public InvalidHierarchyException(String message) {
        super(ErrorCode.INVALID_HIERARCHY, message);
    }
}
