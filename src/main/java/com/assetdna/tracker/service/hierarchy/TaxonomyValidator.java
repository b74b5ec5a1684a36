package com.assetdna.tracker.service.hierarchy;

import com.assetdna.tracker.exception.InvalidHierarchyException;
import com.assetdna.tracker.model.AssetType;
import org.springframework.stereotype.Component;

/**
 * Checks parent/child type compatibility against the fixed taxonomy.
 *
 * A child must sit strictly below its parent: {@code rank(child) > rank(parent)}. Equal ranks are
 * rejected, so a Hardware CI cannot hold a Software CI; a Configuration Item (rank 5) is the
 * natural parent of the rank-6 leaf variants. Levels may be skipped and any type may be a root.
 */
@Component
public class TaxonomyValidator {

    public int rank(AssetType type) {
        return type.getRank();
    }

    public boolean isCompatible(AssetType parentType, AssetType childType) {
        if (parentType == null) {
            return true;
        }
        return rank(childType) > rank(parentType);
    }

    /**
     * @return always {@code true}
     * @throws InvalidHierarchyException when the child would sit at or above its parent
     */
    public boolean validate(AssetType parentType, AssetType childType) {
        if (isCompatible(parentType, childType)) {
            return true;
        }
        String reason = rank(childType) == rank(parentType)
                ? "same-rank nesting is not allowed"
                : "child rank is above parent rank";
        throw new InvalidHierarchyException(String.format(
                "'%s' (rank %d) cannot be placed under '%s' (rank %d): %s",
                childType.getLabel(), rank(childType), parentType.getLabel(), rank(parentType), reason));
    }
}
