package com.assetdna.tracker.exception;

public class DuplicateBomItemException extends AssetDnaException {

    public DuplicateBomItemException(String message) {
        super(ErrorCode.DUPLICATE_BOM_ITEM, message);
    }
}
