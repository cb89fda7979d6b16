package org.janelia.graftmask.threshold;

import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Tunable parameters of the automatic threshold algorithms.
 */
public class MaskThresholdParams {
    private double sigmaStdFactor = SigmaThresholdAlgorithm.DEFAULT_STD_FACTOR;
    private int adaptiveBlockSize = AdaptiveThresholdAlgorithm.DEFAULT_BLOCK_SIZE;
    private double adaptiveSensitivity = AdaptiveThresholdAlgorithm.DEFAULT_SENSITIVITY;
    private int histogramBins = AbstractHistogramThresholdAlgorithm.DEFAULT_NBINS;

    public double getSigmaStdFactor() {
        return sigmaStdFactor;
    }

    public MaskThresholdParams setSigmaStdFactor(double sigmaStdFactor) {
        this.sigmaStdFactor = sigmaStdFactor;
        return this;
    }

    public int getAdaptiveBlockSize() {
        return adaptiveBlockSize;
    }

    public MaskThresholdParams setAdaptiveBlockSize(int adaptiveBlockSize) {
        this.adaptiveBlockSize = adaptiveBlockSize;
        return this;
    }

    public double getAdaptiveSensitivity() {
        return adaptiveSensitivity;
    }

    public MaskThresholdParams setAdaptiveSensitivity(double adaptiveSensitivity) {
        this.adaptiveSensitivity = adaptiveSensitivity;
        return this;
    }

    public int getHistogramBins() {
        return histogramBins;
    }

    public MaskThresholdParams setHistogramBins(int histogramBins) {
        this.histogramBins = histogramBins;
        return this;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("sigmaStdFactor", sigmaStdFactor)
                .append("adaptiveBlockSize", adaptiveBlockSize)
                .append("adaptiveSensitivity", adaptiveSensitivity)
                .append("histogramBins", histogramBins)
                .toString();
    }
}
