package com.assetdna.tracker.exception;

import lombok.Getter;

import java.util.List;

/**
 * Raised when parent references inside one batch form a cycle. Aborts the whole batch.
 */
@Getter
public class CyclicHierarchyException extends AssetDnaException {

    private final List<String> cycle;

    public CyclicHierarchyException(List<String> cycle) {
        super(ErrorCode.CYCLIC_HIERARCHY, "Cyclic parent references in batch: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }
}
