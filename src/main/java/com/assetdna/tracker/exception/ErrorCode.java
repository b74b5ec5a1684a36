package com.assetdna.tracker.exception;

public enum ErrorCode {
    INVALID_HIERARCHY,
    ORPHAN_ASSET,
    CYCLIC_HIERARCHY,
    AMBIGUOUS_PARENT,
    DUPLICATE_BOM_ITEM,
    NON_MONOTONIC_SNAPSHOT,
    NOT_FOUND,
    INVALID_RECORD,
    UNSUPPORTED_FORMAT
}
