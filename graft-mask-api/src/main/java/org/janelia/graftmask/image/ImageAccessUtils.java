package org.janelia.graftmask.image;

import java.util.Arrays;

import net.imglib2.Cursor;
import net.imglib2.Dimensions;
import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgFactory;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.BooleanType;
import net.imglib2.type.NativeType;
import net.imglib2.type.logic.BitType;
import net.imglib2.type.numeric.RealType;
import net.imglib2.util.Util;
import net.imglib2.view.Views;

public class ImageAccessUtils {

    public static String shapeAsString(Dimensions dimensions) {
        return Arrays.toString(dimensions.dimensionsAsLongArray());
    }

    /**
     * @return a sample of the image pixel type. The image must not be empty.
     */
    public static Object getPixelType(RandomAccessibleInterval<?> img) {
        return Util.getTypeFromInterval(img);
    }

    /**
     * Create a cols x rows bit mask from a row-major array of rows.
     */
    public static Img<BitType> createMask(boolean[][] rows) {
        int nRows = rows.length;
        int nCols = rows[0].length;
        Img<BitType> mask = ArrayImgs.bits(nCols, nRows);
        RandomAccess<BitType> maskAccess = mask.randomAccess();
        for (int r = 0; r < nRows; r++) {
            if (rows[r].length != nCols) {
                throw new IllegalArgumentException("Mask row " + r + " has " + rows[r].length + " columns instead of " + nCols);
            }
            maskAccess.setPosition(r, 1);
            for (int c = 0; c < nCols; c++) {
                maskAccess.setPosition(c, 0);
                maskAccess.get().set(rows[r][c]);
            }
        }
        return mask;
    }

    /**
     * Drop trailing singleton dimensions so that a single plane 3D mask can be used as a 2D mask.
     */
    public static <B> RandomAccessibleInterval<B> dropTrailingSingletonDimensions(RandomAccessibleInterval<B> img) {
        RandomAccessibleInterval<B> res = img;
        while (res.numDimensions() > 2 && res.dimension(res.numDimensions() - 1) == 1) {
            int d = res.numDimensions() - 1;
            res = Views.hyperSlice(res, d, res.min(d));
        }
        return res;
    }

    public static long countForeground(RandomAccessibleInterval<? extends BooleanType<?>> mask) {
        long n = 0;
        for (BooleanType<?> pixel : Views.flatIterable(mask)) {
            if (pixel.get()) {
                n++;
            }
        }
        return n;
    }

    /**
     * Select the pixels marked in the mask from every time point of the given data.
     * The last data axis is time; the other axes are iterated in flat (row-major) order and must
     * contain the same number of pixels as the mask.
     *
     * @param mask 2D mask
     * @param data pixels x time or cols x rows x time data
     * @return a maskPixels x time image; an empty mask gives an image with no rows
     */
    public static <T extends NativeType<T> & RealType<T>> RandomAccessibleInterval<T> selectMaskedPixels(
            RandomAccessibleInterval<? extends BooleanType<?>> mask,
            RandomAccessibleInterval<T> data) {
        int timeAxis = data.numDimensions() - 1;
        long nFrames = data.dimension(timeAxis);
        long nMaskedPixels = countForeground(mask);
        ArrayImgFactory<T> maskedDataFactory = new ArrayImgFactory<>(Util.getTypeFromInterval(data));
        if (nMaskedPixels == 0) {
            return Views.interval(maskedDataFactory.create(1, nFrames), new long[]{0, 0}, new long[]{-1, nFrames - 1});
        }
        Img<T> maskedData = maskedDataFactory.create(nMaskedPixels, nFrames);
        RandomAccess<T> maskedDataAccess = maskedData.randomAccess();
        for (long t = 0; t < nFrames; t++) {
            Cursor<? extends BooleanType<?>> maskCursor = Views.flatIterable(mask).cursor();
            Cursor<T> frameCursor = Views.flatIterable(Views.hyperSlice(data, timeAxis, data.min(timeAxis) + t)).cursor();
            maskedDataAccess.setPosition(t, 1);
            long pixelIndex = 0;
            while (maskCursor.hasNext()) {
                boolean selected = maskCursor.next().get();
                T framePixel = frameCursor.next();
                if (selected) {
                    maskedDataAccess.setPosition(pixelIndex++, 0);
                    maskedDataAccess.get().set(framePixel);
                }
            }
        }
        return maskedData;
    }
}
