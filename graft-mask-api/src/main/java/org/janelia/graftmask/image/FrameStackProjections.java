package org.janelia.graftmask.image;

import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.view.Views;

/**
 * Per pixel statistics along the time axis of a cols x rows x time frame stack.
 * All projections are cols x rows double images.
 */
public class FrameStackProjections {

    static final int TIME_AXIS = 2;

    public static <T extends RealType<T>> Img<DoubleType> mean(RandomAccessibleInterval<T> frameStack) {
        checkFrameStack(frameStack);
        Img<DoubleType> sum = createProjection(frameStack);
        long nFrames = frameStack.dimension(TIME_AXIS);
        for (long t = 0; t < nFrames; t++) {
            accumulate(frameSlice(frameStack, t), sum);
        }
        for (DoubleType s : sum) {
            s.set(s.get() / nFrames);
        }
        return sum;
    }

    /**
     * Sample standard deviation (normalized by N - 1) around the given per pixel mean.
     * A stack with a single frame has a zero standard deviation everywhere.
     */
    public static <T extends RealType<T>> Img<DoubleType> std(RandomAccessibleInterval<T> frameStack,
                                                              RandomAccessibleInterval<DoubleType> mean) {
        checkFrameStack(frameStack);
        Img<DoubleType> sumSq = createProjection(frameStack);
        long nFrames = frameStack.dimension(TIME_AXIS);
        if (nFrames < 2) {
            return sumSq;
        }
        for (long t = 0; t < nFrames; t++) {
            Cursor<T> frameCursor = Views.flatIterable(frameSlice(frameStack, t)).cursor();
            Cursor<DoubleType> meanCursor = Views.flatIterable(mean).cursor();
            Cursor<DoubleType> sumSqCursor = sumSq.cursor();
            while (sumSqCursor.hasNext()) {
                double d = frameCursor.next().getRealDouble() - meanCursor.next().get();
                DoubleType s = sumSqCursor.next();
                s.set(s.get() + d * d);
            }
        }
        for (DoubleType s : sumSq) {
            s.set(Math.sqrt(s.get() / (nFrames - 1)));
        }
        return sumSq;
    }

    /**
     * Peak of each pixel's activity relative to its own mean, i.e. max over time of value / mean.
     * Pixels with a zero mean have a zero relative activity and pixels without any valid value are NaN.
     */
    public static <T extends RealType<T>> Img<DoubleType> maxMeanNormalized(RandomAccessibleInterval<T> frameStack,
                                                                            RandomAccessibleInterval<DoubleType> mean) {
        checkFrameStack(frameStack);
        Img<DoubleType> peak = createProjection(frameStack);
        for (DoubleType p : peak) {
            p.set(Double.NEGATIVE_INFINITY);
        }
        long nFrames = frameStack.dimension(TIME_AXIS);
        for (long t = 0; t < nFrames; t++) {
            Cursor<T> frameCursor = Views.flatIterable(frameSlice(frameStack, t)).cursor();
            Cursor<DoubleType> meanCursor = Views.flatIterable(mean).cursor();
            Cursor<DoubleType> peakCursor = peak.cursor();
            while (peakCursor.hasNext()) {
                double m = meanCursor.next().get();
                double v = frameCursor.next().getRealDouble();
                double normalized = m == 0 ? 0 : v / m;
                DoubleType p = peakCursor.next();
                if (normalized > p.get()) {
                    p.set(normalized);
                }
            }
        }
        for (DoubleType p : peak) {
            if (p.get() == Double.NEGATIVE_INFINITY) {
                // no frame had a valid value
                p.set(Double.NaN);
            }
        }
        return peak;
    }

    public static <T extends RealType<T>> RandomAccessibleInterval<T> frameSlice(RandomAccessibleInterval<T> frameStack, long t) {
        return Views.hyperSlice(frameStack, TIME_AXIS, frameStack.min(TIME_AXIS) + t);
    }

    public static void checkFrameStack(RandomAccessibleInterval<?> frameStack) {
        if (frameStack.numDimensions() != 3) {
            throw new IllegalArgumentException("Expected a cols x rows x time frame stack but the image shape is "
                    + ImageAccessUtils.shapeAsString(frameStack));
        }
        if (frameStack.dimension(TIME_AXIS) == 0) {
            throw new IllegalArgumentException("Frame stack has no frames");
        }
    }

    private static Img<DoubleType> createProjection(RandomAccessibleInterval<?> frameStack) {
        return ArrayImgs.doubles(frameStack.dimension(0), frameStack.dimension(1));
    }

    private static <T extends RealType<T>> void accumulate(RandomAccessibleInterval<T> frame, Img<DoubleType> acc) {
        Cursor<T> frameCursor = Views.flatIterable(frame).cursor();
        Cursor<DoubleType> accCursor = acc.cursor();
        while (accCursor.hasNext()) {
            DoubleType a = accCursor.next();
            a.set(a.get() + frameCursor.next().getRealDouble());
        }
    }
}
