package org.janelia.graftmask.threshold;

import javax.annotation.Nonnull;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.type.logic.BitType;
import net.imglib2.type.numeric.RealType;

/**
 * Automatic threshold that derives a pixels-of-interest mask directly from the intensities of a frame stack.
 */
public interface MaskThresholdAlgorithm {

    /**
     * @return the name under which the algorithm can be selected.
     */
    String getName();

    /**
     * @param frameStack cols x rows x time stack
     * @return a cols x rows mask in which the pixels of interest are set
     */
    <T extends RealType<T>> Img<BitType> computeMask(@Nonnull RandomAccessibleInterval<T> frameStack);
}
