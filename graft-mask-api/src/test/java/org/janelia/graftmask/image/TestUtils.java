package org.janelia.graftmask.image;

import java.util.Random;

import net.imglib2.Cursor;
import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.BooleanType;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.view.Views;
import org.janelia.graftmask.mask.MaskSpec;

import static org.junit.Assert.assertArrayEquals;

public class TestUtils {

    /**
     * @param frames values indexed as frames[t][row][col]
     * @return a cols x rows x time stack
     */
    public static Img<DoubleType> createFrameStack(double[][][] frames) {
        int nFrames = frames.length;
        int nRows = frames[0].length;
        int nCols = frames[0][0].length;
        Img<DoubleType> stack = ArrayImgs.doubles(nCols, nRows, nFrames);
        RandomAccess<DoubleType> stackAccess = stack.randomAccess();
        for (int t = 0; t < nFrames; t++) {
            for (int r = 0; r < nRows; r++) {
                for (int c = 0; c < nCols; c++) {
                    stackAccess.setPosition(new long[]{c, r, t});
                    stackAccess.get().set(frames[t][r][c]);
                }
            }
        }
        return stack;
    }

    /**
     * Frame stack filled with a constant background plus uniform noise in [0, noise).
     */
    public static Img<DoubleType> createNoisyFrameStack(int nRows, int nCols, int nFrames, double background, double noise, long seed) {
        Random random = new Random(seed);
        Img<DoubleType> stack = ArrayImgs.doubles(nCols, nRows, nFrames);
        for (DoubleType pixel : stack) {
            pixel.set(background + noise * random.nextDouble());
        }
        return stack;
    }

    public static void setPixel(Img<DoubleType> stack, int row, int col, int t, double value) {
        RandomAccess<DoubleType> stackAccess = stack.randomAccess();
        stackAccess.setPosition(new long[]{col, row, t});
        stackAccess.get().set(value);
    }

    /**
     * @return the mask as a row-major array, i.e. rows[r][c]
     */
    public static boolean[][] maskAsRows(RandomAccessibleInterval<? extends BooleanType<?>> mask) {
        boolean[][] rows = new boolean[(int) mask.dimension(1)][(int) mask.dimension(0)];
        Cursor<? extends BooleanType<?>> maskCursor = Views.flatIterable(mask).localizingCursor();
        while (maskCursor.hasNext()) {
            boolean v = maskCursor.next().get();
            rows[maskCursor.getIntPosition(1) - (int) mask.min(1)][maskCursor.getIntPosition(0) - (int) mask.min(0)] = v;
        }
        return rows;
    }

    @SuppressWarnings("unchecked")
    public static boolean[][] maskAsRows(MaskSpec maskSpec) {
        return maskAsRows((RandomAccessibleInterval<? extends BooleanType<?>>) ((MaskSpec.ExplicitMask) maskSpec).getMask());
    }

    /**
     * @return a pixels x time image as values[pixel][t]
     */
    public static <T extends RealType<T>> double[][] pixelsOverTime(RandomAccessibleInterval<T> img) {
        double[][] values = new double[(int) img.dimension(0)][(int) img.dimension(1)];
        RandomAccess<T> imgAccess = img.randomAccess();
        for (int p = 0; p < values.length; p++) {
            for (int t = 0; t < values[p].length; t++) {
                imgAccess.setPosition(new long[]{img.min(0) + p, img.min(1) + t});
                values[p][t] = imgAccess.get().getRealDouble();
            }
        }
        return values;
    }

    public static <T extends RealType<T>> void assertPixelsOverTime(double[][] expected, RandomAccessibleInterval<T> actual) {
        assertArrayEquals(new long[]{expected.length, expected[0].length}, actual.dimensionsAsLongArray());
        double[][] actualValues = pixelsOverTime(actual);
        for (int p = 0; p < expected.length; p++) {
            assertArrayEquals("Pixel " + p, expected[p], actualValues[p], 0);
        }
    }

    public static long countSet(boolean[][] rows) {
        long n = 0;
        for (boolean[] row : rows) {
            for (boolean v : row) {
                if (v) n++;
            }
        }
        return n;
    }
}
