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
 * Triangle threshold of the temporal mean image.
 * The level is the bin farthest below the line drawn from the histogram peak to the end of the longer tail.
 * The pixels on the tail side of the level are selected, which works well when the objects of interest
 * only produce a weak peak.
 */
public class TriangleThresholdAlgorithm extends AbstractHistogramThresholdAlgorithm {

    private static final Logger LOG = LoggerFactory.getLogger(TriangleThresholdAlgorithm.class);

    public static final String NAME = "triangle";

    public TriangleThresholdAlgorithm() {
        this(DEFAULT_NBINS);
    }

    public TriangleThresholdAlgorithm(int nbins) {
        super(nbins);
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    protected <T extends RealType<T>> Img<DoubleType> computeActivityImage(RandomAccessibleInterval<T> frameStack) {
        return FrameStackProjections.mean(frameStack);
    }

    @Override
    protected IntPredicate selectForegroundBins(IntensityHistogram histogram) {
        int[] counts = histogram.getCounts();
        boolean tailAbovePeak = isTailAbovePeak(counts);
        int level = new AutoThresholder().getThreshold(AutoThresholder.Method.Triangle, counts);
        LOG.debug("Triangle level: bin {} of {} with the tail {} the peak",
                level, counts.length, tailAbovePeak ? "above" : "below");
        // for a tail above the peak the level is the first bin of the tail, otherwise it is the last one
        return tailAbovePeak ? bin -> bin >= level : bin -> bin <= level;
    }

    /**
     * Compare the distances from the histogram peak to the empty bins just outside the occupied range,
     * which is how the triangle method decides the side of the tail.
     */
    static boolean isTailAbovePeak(int[] counts) {
        int firstBin = -1;
        int lastBin = -1;
        int peakBin = 0;
        for (int i = 0; i < counts.length; i++) {
            if (counts[i] > 0) {
                if (firstBin < 0) firstBin = i;
                lastBin = i;
            }
            if (counts[i] > counts[peakBin]) peakBin = i;
        }
        int lowEnd = Math.max(firstBin - 1, 0);
        int highEnd = Math.min(lastBin + 1, counts.length - 1);
        return peakBin - lowEnd < highEnd - peakBin;
    }
}
