package org.synphot.core;

/**
 * Options for merging two wavelength sets.
 */
public class MergeOptions {
    public static final double DEFAULT_THRESHOLD = 1e-12;

    private double threshold = DEFAULT_THRESHOLD;
    private boolean descending;
    private boolean overlapOnly;

    public static MergeOptions defaults() {
        return new MergeOptions();
    }

    /**
     * Points closer than this to their successor are dropped.
     */
    public double getThreshold() { return threshold; }
    public MergeOptions threshold(double threshold) {
        if (!(threshold >= 0) || Double.isInfinite(threshold)) {
            throw new SynphotException(threshold + " is not a valid merge threshold");
        }
        this.threshold = threshold;
        return this;
    }

    public boolean isDescending() { return descending; }
    public MergeOptions descending(boolean descending) {
        this.descending = descending;
        return this;
    }

    /**
     * Keep only the wavelengths inside the range common to both sets.
     */
    public boolean isOverlapOnly() { return overlapOnly; }
    public MergeOptions overlapOnly(boolean overlapOnly) {
        this.overlapOnly = overlapOnly;
        return this;
    }
}
