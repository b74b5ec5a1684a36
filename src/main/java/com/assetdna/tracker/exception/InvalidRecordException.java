package com.assetdna.tracker.exception;

public class InvalidRecordException extends AssetDnaException {

    public InvalidRecordException(String message) {
        super(ErrorCode.INVALID_RECORD, message);
    }

    public InvalidRecordException(String message, Throwable cause) {
        super(ErrorCode.INVALID_RECORD, message, cause);
    }
}
