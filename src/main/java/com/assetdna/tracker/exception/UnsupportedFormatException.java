package com.assetdna.tracker.exception;

public class UnsupportedFormatException extends AssetDnaException {

    public UnsupportedFormatException(String message) {
        super(ErrorCode.UNSUPPORTED_FORMAT, message);
    }
}
