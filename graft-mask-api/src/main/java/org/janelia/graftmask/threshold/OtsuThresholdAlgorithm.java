package org.janelia.graftmask.threshold;

import java.util.function.IntPredicate;

import ij.process.AutoThresholder;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.DoubleType;
import org.janelia.graftmask.image.FrameStackProjections;
import org.janelia.graftmask.image.IntensityHistogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Otsu threshold of the peak activity normalized by each pixel's mean activity.
 * The level maximizes the between-class variance of the histogram and the bins above it are selected.
 */
public class OtsuThresholdAlgorithm extends AbstractHistogramThresholdAlgorithm {

    private static final Logger LOG = LoggerFactory.getLogger(OtsuThresholdAlgorithm.class);

    public static final String NAME = "otsu";

    public OtsuThresholdAlgorithm() {
        this(DEFAULT_NBINS);
    }

    public OtsuThresholdAlgorithm(int nbins) {
        super(nbins);
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    protected <T extends RealType<T>> Img<DoubleType> computeActivityImage(RandomAccessibleInterval<T> frameStack) {
        return FrameStackProjections.maxMeanNormalized(frameStack, FrameStackProjections.mean(frameStack));
    }

    @Override
    protected IntPredicate selectForegroundBins(IntensityHistogram histogram) {
        int level = new AutoThresholder().getThreshold(AutoThresholder.Method.Otsu, histogram.getCounts());
        LOG.debug("Otsu level: bin {} of {} ({})", level, histogram.getNBins(), histogram.getBinUpperValue(level));
        return bin -> bin > level;
    }
}
