package org.janelia.graftmask.image;

import java.util.Arrays;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.algorithm.stats.ComputeMinMax;
import net.imglib2.converter.Converter;
import net.imglib2.converter.Converters;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.view.Views;

/**
 * Fixed size histogram of real pixel values. The bins evenly cover the [min, max] range of the values
 * the histogram was built from; the max value falls in the last bin. NaN and infinite values are not counted.
 */
public class IntensityHistogram {

    public static <T extends RealType<T>> IntensityHistogram create(RandomAccessibleInterval<T> img, int nbins) {
        double finiteValue = Double.NaN;
        for (T pixel : Views.flatIterable(img)) {
            if (Double.isFinite(pixel.getRealDouble())) {
                finiteValue = pixel.getRealDouble();
                break;
            }
        }
        if (Double.isNaN(finiteValue)) {
            // nothing to count
            return new IntensityHistogram(nbins, 0, 0);
        }
        // non finite values are not counted so they must not extend the range either
        double replacement = finiteValue;
        Converter<T, DoubleType> finiteValues = (T in, DoubleType out) -> {
            double v = in.getRealDouble();
            out.set(Double.isFinite(v) ? v : replacement);
        };
        DoubleType min = new DoubleType();
        DoubleType max = new DoubleType();
        ComputeMinMax.computeMinMax(Converters.convert(img, finiteValues, new DoubleType()), min, max);

        IntensityHistogram histogram = new IntensityHistogram(nbins, min.get(), max.get());
        for (T pixel : Views.flatIterable(img)) {
            histogram.add(pixel.getRealDouble());
        }
        return histogram;
    }

    private final int[] counts;
    private final double minValue;
    private final double maxValue;
    private long total;

    IntensityHistogram(int nbins, double minValue, double maxValue) {
        if (nbins < 2) {
            throw new IllegalArgumentException("A histogram needs at least 2 bins - requested " + nbins);
        }
        this.counts = new int[nbins];
        this.minValue = minValue;
        this.maxValue = maxValue;
        this.total = 0;
    }

    void add(double val) {
        int bin = getBin(val);
        if (bin >= 0) {
            ++counts[bin];
            ++total;
        }
    }

    /**
     * @return the bin of the value or -1 if the value is not finite or the histogram has no range.
     */
    public int getBin(double val) {
        if (!Double.isFinite(val) || !hasRange()) {
            return -1;
        }
        if (val <= minValue) {
            return 0;
        }
        if (val >= maxValue) {
            return counts.length - 1;
        }
        int bin = (int) ((val - minValue) / (maxValue - minValue) * counts.length);
        return Math.min(bin, counts.length - 1);
    }

    /**
     * @return true if the values span a non empty range; a constant image cannot be split by a threshold.
     */
    public boolean hasRange() {
        return maxValue > minValue;
    }

    public int getNBins() {
        return counts.length;
    }

    public int getCount(int bin) {
        return counts[bin];
    }

    public int[] getCounts() {
        return Arrays.copyOf(counts, counts.length);
    }

    public long getTotal() {
        return total;
    }

    /**
     * @return the value at the upper edge of the bin.
     */
    public double getBinUpperValue(int bin) {
        return minValue + (maxValue - minValue) * (bin + 1) / counts.length;
    }
}
