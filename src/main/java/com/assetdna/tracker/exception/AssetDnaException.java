package com.assetdna.tracker.exception;

import lombok.Getter;

/**
 * Base type for every failure the registry reports to callers.
 */
@Getter
public abstract class AssetDnaException extends RuntimeException {

    private final ErrorCode errorCode;

    protected AssetDnaException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected AssetDnaException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
