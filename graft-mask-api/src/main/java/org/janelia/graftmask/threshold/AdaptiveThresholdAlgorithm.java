package org.janelia.graftmask.threshold;

import javax.annotation.Nonnull;

import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.algorithm.neighborhood.Neighborhood;
import net.imglib2.algorithm.neighborhood.RectangleShape;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.logic.BitType;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.view.Views;
import org.janelia.graftmask.image.FrameStackProjections;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Local threshold of the temporal mean image. A pixel is selected if its mean activity is above
 * the mean of its blockSize x blockSize neighborhood scaled by <code>0.6 + (1 - sensitivity)</code>.
 * Neighborhoods are clipped at the image borders.
 */
public class AdaptiveThresholdAlgorithm implements MaskThresholdAlgorithm {

    private static final Logger LOG = LoggerFactory.getLogger(AdaptiveThresholdAlgorithm.class);

    public static final String NAME = "adaptive";
    public static final int DEFAULT_BLOCK_SIZE = 25;
    public static final double DEFAULT_SENSITIVITY = 0.5;

    private final int blockSize;
    private final double sensitivity;

    public AdaptiveThresholdAlgorithm() {
        this(DEFAULT_BLOCK_SIZE, DEFAULT_SENSITIVITY);
    }

    public AdaptiveThresholdAlgorithm(int blockSize, double sensitivity) {
        if (blockSize <= 0 || blockSize % 2 == 0) {
            throw new IllegalArgumentException("Block size must be an odd positive integer - current value is " + blockSize);
        }
        if (sensitivity < 0 || sensitivity > 1) {
            throw new IllegalArgumentException("Sensitivity must be in the [0, 1] range - current value is " + sensitivity);
        }
        this.blockSize = blockSize;
        this.sensitivity = sensitivity;
    }

    @Override
    public String getName() {
        return NAME;
    }

    public int getBlockSize() {
        return blockSize;
    }

    public double getSensitivity() {
        return sensitivity;
    }

    @Override
    public <T extends RealType<T>> Img<BitType> computeMask(@Nonnull RandomAccessibleInterval<T> frameStack) {
        Img<DoubleType> meanImage = FrameStackProjections.mean(frameStack);
        long width = meanImage.dimension(0);
        long height = meanImage.dimension(1);
        double scale = 0.6 + (1 - sensitivity);
        int radius = blockSize / 2;
        LOG.debug("Adaptive threshold of a {}x{} image using a {} block and a {} scale factor",
                width, height, blockSize, scale);

        // pixels outside the image add nothing to the block sum and are not counted
        RandomAccessibleInterval<Neighborhood<DoubleType>> blocks = Views.interval(
                new RectangleShape(radius, false).neighborhoodsRandomAccessible(Views.extendZero(meanImage)),
                meanImage);
        Img<BitType> mask = ArrayImgs.bits(width, height);
        Cursor<Neighborhood<DoubleType>> blockCursor = Views.flatIterable(blocks).localizingCursor();
        Cursor<DoubleType> meanCursor = meanImage.cursor();
        Cursor<BitType> maskCursor = mask.cursor();
        while (maskCursor.hasNext()) {
            Neighborhood<DoubleType> block = blockCursor.next();
            double value = meanCursor.next().get();
            double blockSum = 0;
            for (DoubleType v : block) {
                blockSum += v.get();
            }
            long x = blockCursor.getLongPosition(0);
            long y = blockCursor.getLongPosition(1);
            long nBlockPixels = (Math.min(x + radius, width - 1) - Math.max(x - radius, 0) + 1)
                    * (Math.min(y + radius, height - 1) - Math.max(y - radius, 0) + 1);
            maskCursor.next().set(value > blockSum / nBlockPixels * scale);
        }
        return mask;
    }
}
