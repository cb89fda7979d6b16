package org.janelia.graftmask.threshold;

import javax.annotation.Nonnull;

import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.logic.BitType;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.view.Views;
import org.janelia.graftmask.image.FrameStackProjections;

/**
 * Marks the pixels whose activity rises above <code>mean + stdFactor * std</code> at least once,
 * where the mean and the standard deviation are computed over the time axis of each pixel.
 */
public class SigmaThresholdAlgorithm implements MaskThresholdAlgorithm {

    public static final String NAME = "sigma";
    public static final double DEFAULT_STD_FACTOR = 2;

    private final double stdFactor;

    public SigmaThresholdAlgorithm() {
        this(DEFAULT_STD_FACTOR);
    }

    public SigmaThresholdAlgorithm(double stdFactor) {
        this.stdFactor = stdFactor;
    }

    @Override
    public String getName() {
        return NAME;
    }

    public double getStdFactor() {
        return stdFactor;
    }

    @Override
    public <T extends RealType<T>> Img<BitType> computeMask(@Nonnull RandomAccessibleInterval<T> frameStack) {
        Img<DoubleType> mean = FrameStackProjections.mean(frameStack);
        Img<DoubleType> std = FrameStackProjections.std(frameStack, mean);

        Img<DoubleType> threshold = ArrayImgs.doubles(mean.dimensionsAsLongArray());
        Cursor<DoubleType> thresholdCursor = threshold.cursor();
        Cursor<DoubleType> meanCursor = mean.cursor();
        Cursor<DoubleType> stdCursor = std.cursor();
        while (thresholdCursor.hasNext()) {
            thresholdCursor.next().set(meanCursor.next().get() + stdFactor * stdCursor.next().get());
        }

        Img<BitType> mask = ArrayImgs.bits(mean.dimensionsAsLongArray());
        long nFrames = frameStack.dimension(2);
        for (long t = 0; t < nFrames; t++) {
            Cursor<T> frameCursor = Views.flatIterable(FrameStackProjections.frameSlice(frameStack, t)).cursor();
            Cursor<DoubleType> tCursor = threshold.cursor();
            Cursor<BitType> maskCursor = mask.cursor();
            while (maskCursor.hasNext()) {
                BitType maskPixel = maskCursor.next();
                double th = tCursor.next().get();
                if (frameCursor.next().getRealDouble() > th) {
                    maskPixel.set(true);
                }
            }
        }
        return mask;
    }
}
