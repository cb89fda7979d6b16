package org.janelia.graftmask.threshold;

import java.util.function.IntPredicate;

import javax.annotation.Nonnull;

import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.logic.BitType;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.DoubleType;
import org.janelia.graftmask.image.IntensityHistogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Global threshold selected from the histogram of a 2D activity image derived from the frame stack.
 */
public abstract class AbstractHistogramThresholdAlgorithm implements MaskThresholdAlgorithm {

    private static final Logger LOG = LoggerFactory.getLogger(AbstractHistogramThresholdAlgorithm.class);

    public static final int DEFAULT_NBINS = 256;

    private final int nbins;

    protected AbstractHistogramThresholdAlgorithm(int nbins) {
        if (nbins < 2) {
            throw new IllegalArgumentException("The number of histogram bins must be at least 2 - current value is " + nbins);
        }
        this.nbins = nbins;
    }

    public int getNBins() {
        return nbins;
    }

    @Override
    public <T extends RealType<T>> Img<BitType> computeMask(@Nonnull RandomAccessibleInterval<T> frameStack) {
        Img<DoubleType> activityImage = computeActivityImage(frameStack);
        Img<BitType> mask = ArrayImgs.bits(activityImage.dimensionsAsLongArray());
        IntensityHistogram histogram = IntensityHistogram.create(activityImage, nbins);
        if (!histogram.hasRange()) {
            LOG.info("No {} threshold for a constant activity image - return an empty mask", getName());
            return mask;
        }
        IntPredicate foregroundBins = selectForegroundBins(histogram);
        if (foregroundBins == null) {
            LOG.info("The {} threshold could not split the activity histogram - return an empty mask", getName());
            return mask;
        }
        Cursor<DoubleType> activityCursor = activityImage.cursor();
        Cursor<BitType> maskCursor = mask.cursor();
        while (maskCursor.hasNext()) {
            int bin = histogram.getBin(activityCursor.next().get());
            maskCursor.next().set(bin >= 0 && foregroundBins.test(bin));
        }
        return mask;
    }

    /**
     * @return a cols x rows image whose histogram is thresholded
     */
    protected abstract <T extends RealType<T>> Img<DoubleType> computeActivityImage(RandomAccessibleInterval<T> frameStack);

    /**
     * @return a predicate that is true for the bins that belong to the foreground or null if the histogram cannot be split.
     */
    protected abstract IntPredicate selectForegroundBins(IntensityHistogram histogram);
}
