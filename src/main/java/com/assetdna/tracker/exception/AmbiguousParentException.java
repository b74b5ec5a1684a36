package com.assetdna.tracker.exception;

public class AmbiguousParentException extends AssetDnaException {

    public AmbiguousParentException(String message) {
        super(ErrorCode.AMBIGUOUS_PARENT, message);
    }
}
