package com.vidnyan.attackgraph.domain.language;

/**
 * Association between two asset types.
 * The left field names the left assets as seen from the right side, and vice versa.
 */
public record Association(
    String name,
    String leftAsset,
    String leftField,
    String rightAsset,
    String rightField
) {

    /**
     * Check if the association touches the given asset type directly.
     */
    public boolean involves(String assetType) {
        return leftAsset.equals(assetType) || rightAsset.equals(assetType);
    }
}
