package com.assetdna.tracker.exception;

public class NonMonotonicSnapshotException extends AssetDnaException {

    public NonMonotonicSnapshotException(String message) {
        super(ErrorCode.NON_MONOTONIC_SNAPSHOT, message);
    }

    public NonMonotonicSnapshotException(String message, Throwable cause) {
        super(ErrorCode.NON_MONOTONIC_SNAPSHOT, message, cause);
    }
}
