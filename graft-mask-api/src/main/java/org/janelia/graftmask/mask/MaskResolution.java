package org.janelia.graftmask.mask;

import javax.annotation.Nullable;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.RealType;
import org.apache.commons.lang3.builder.ToStringBuilder;
import org.janelia.graftmask.image.ImageAccessUtils;

/**
 * Outcome of a mask resolution: the updated parameters and, when the mask could be applied,
 * the maskPixels x time data.
 *
 * @param <T> data pixel type
 */
public class MaskResolution<T extends RealType<T>> {

    private final MaskParams params;
    private final RandomAccessibleInterval<T> maskedData;
    private final MaskDataLayout dataLayout;
    private final String warning;

    MaskResolution(MaskParams params,
                   @Nullable RandomAccessibleInterval<T> maskedData,
                   @Nullable MaskDataLayout dataLayout,
                   @Nullable String warning) {
        this.params = params;
        this.maskedData = maskedData;
        this.dataLayout = dataLayout;
        this.warning = warning;
    }

    public MaskParams getParams() {
        return params;
    }

    public boolean hasMaskedData() {
        return maskedData != null;
    }

    @Nullable
    public RandomAccessibleInterval<T> getMaskedData() {
        return maskedData;
    }

    /**
     * @return the layout the input data was matched against or null if no reconciliation took place.
     */
    @Nullable
    public MaskDataLayout getDataLayout() {
        return dataLayout;
    }

    public boolean hasWarning() {
        return warning != null;
    }

    @Nullable
    public String getWarning() {
        return warning;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("params", params)
                .append("maskedData", maskedData == null ? null : ImageAccessUtils.shapeAsString(maskedData))
                .append("dataLayout", dataLayout)
                .append("warning", warning)
                .toString();
    }
}
