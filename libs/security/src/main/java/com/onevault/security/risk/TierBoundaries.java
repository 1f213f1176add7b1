package com.onevault.security.risk;

/**
 * Upper score bounds (inclusive) of the first three tiers; anything above {@code elevatedMax} is
 * {@link AccessTier#DENIED}. Bounds must be strictly increasing within [0, 100].
 */
public record TierBoundaries(double fullMax, double standardMax, double elevatedMax) {

    public TierBoundaries {
        if (!(0.0 <= fullMax && fullMax < standardMax && standardMax < elevatedMax && elevatedMax < 100.0)) {
            throw new IllegalArgumentException(
                    "tier boundaries must satisfy 0 <= full < standard < elevated < 100, got %s/%s/%s"
                            .formatted(fullMax, standardMax, elevatedMax));
        }
    }

    public static TierBoundaries defaults() {
        return new TierBoundaries(20, 50, 80);
    }

    public AccessTier tierFor(double score) {
        if (score <= fullMax) {
            return AccessTier.FULL;
        }
        if (score <= standardMax) {
            return AccessTier.STANDARD;
        }
        if (score <= elevatedMax) {
            return AccessTier.ELEVATED;
        }
        return AccessTier.DENIED;
    }
}
