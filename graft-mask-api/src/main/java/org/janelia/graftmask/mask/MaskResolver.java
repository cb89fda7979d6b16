package org.janelia.graftmask.mask;

import java.util.Map;

import javax.annotation.Nonnull;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.type.BooleanType;
import net.imglib2.type.NativeType;
import net.imglib2.type.logic.BitType;
import net.imglib2.type.numeric.RealType;
import net.imglib2.view.Views;
import org.apache.commons.lang3.Validate;
import org.janelia.graftmask.image.ImageAccessUtils;
import org.janelia.graftmask.threshold.MaskThresholdAlgorithm;
import org.janelia.graftmask.threshold.MaskThresholdAlgorithmFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the mask field of the parameters against the imaging data.
 * <p>
 * A named method computes a mask from the cols x rows x time frame stack and stores it in the parameters
 * without applying it - the caller applies the stored mask in a subsequent pass.
 * An explicit mask is validated and applied to the data, which may be a full frame stack,
 * a flattened (rows * cols) x time stack or data that has already been masked.
 * </p>
 * The resolver keeps no state between calls, so one instance can be shared as long as every caller
 * owns its parameters.
 */
public class MaskResolver {

    private static final Logger LOG = LoggerFactory.getLogger(MaskResolver.class);

    private final Map<String, MaskThresholdAlgorithm> thresholdAlgorithms;

    public MaskResolver() {
        this(MaskThresholdAlgorithmFactory.createDefaultAlgorithms());
    }

    /**
     * @param thresholdAlgorithms threshold algorithms keyed by their lower case names
     */
    public MaskResolver(@Nonnull Map<String, MaskThresholdAlgorithm> thresholdAlgorithms) {
        Validate.notNull(thresholdAlgorithms, "Threshold algorithms cannot be null");
        this.thresholdAlgorithms = thresholdAlgorithms;
    }

    /**
     * Resolve the mask from params against data. The params are updated in place.
     *
     * @param params mask parameters
     * @param data cols x rows x time or pixels x time data; it is never modified
     * @return the resolution that holds the updated params and the maskPixels x time data if the mask was applied
     * @throws InvalidMaskTypeException if an explicit mask is not boolean
     * @throws UnsupportedMaskDimensionalityException if an explicit mask has more than one plane
     * @throws MaskDataSizeMismatchException if an explicit mask cannot be reconciled with the data
     * @throws UnsupportedDataDimensionalityException if a threshold method is requested for data that is not a frame stack
     */
    public <T extends NativeType<T> & RealType<T>> MaskResolution<T> resolve(@Nonnull MaskParams params,
                                                                          @Nonnull RandomAccessibleInterval<T> data) {
        Validate.notNull(params, "Mask params cannot be null");
        Validate.notNull(data, "Data cannot be null");
        MaskSpec maskSpec = params.getMask();
        if (maskSpec instanceof MaskSpec.NamedMethod) {
            return applyThresholdMethod(params, (MaskSpec.NamedMethod) maskSpec, data);
        } else if (maskSpec instanceof MaskSpec.ExplicitMask) {
            return applyExplicitMask(params, (MaskSpec.ExplicitMask) maskSpec, data);
        } else {
            LOG.debug("No mask set - nothing to resolve");
            return new MaskResolution<>(params, null, null, null);
        }
    }

    private <T extends NativeType<T> & RealType<T>> MaskResolution<T> applyThresholdMethod(MaskParams params,
                                                                                        MaskSpec.NamedMethod namedMethod,
                                                                                        RandomAccessibleInterval<T> data) {
        MaskThresholdAlgorithm thresholdAlgorithm = thresholdAlgorithms.get(namedMethod.getNormalizedName());
        if (thresholdAlgorithm == null) {
            String warning = String.format("Selection for mask '%s' not recognized.%n" +
                            "Currently only supports the following options for pre-computed masks: %s",
                    namedMethod.getName(), String.join(", ", thresholdAlgorithms.keySet()));
            LOG.warn(warning);
            params.setMask(MaskSpec.unset());
            return new MaskResolution<>(params, null, null, warning);
        }
        if (data.numDimensions() != 3) {
            throw new UnsupportedDataDimensionalityException(thresholdAlgorithm.getName(), ImageAccessUtils.shapeAsString(data));
        }
        long startTime = System.currentTimeMillis();
        Img<BitType> mask = thresholdAlgorithm.computeMask(data);
        params.setMask(MaskSpec.explicit(mask))
                .setNRows((int) mask.dimension(1))
                .setNCols((int) mask.dimension(0));
        LOG.info("Computed {} mask with {} pixels out of {}x{} in {}s",
                thresholdAlgorithm.getName(),
                ImageAccessUtils.countForeground(mask),
                params.getNRows(), params.getNCols(),
                (System.currentTimeMillis() - startTime) / 1000.);
        return new MaskResolution<>(params, null, null, null);
    }

    private <T extends NativeType<T> & RealType<T>> MaskResolution<T> applyExplicitMask(MaskParams params,
                                                                                     MaskSpec.ExplicitMask explicitMask,
                                                                                     RandomAccessibleInterval<T> data) {
        if (explicitMask.isEmpty()) {
            LOG.debug("Empty mask - nothing to resolve");
            return new MaskResolution<>(params, null, null, null);
        }
        RandomAccessibleInterval<?> maskImage = explicitMask.getMask();
        Object maskPixelType = ImageAccessUtils.getPixelType(maskImage);
        if (!(maskPixelType instanceof BooleanType)) {
            throw new InvalidMaskTypeException(maskPixelType);
        }
        RandomAccessibleInterval<? extends BooleanType<?>> mask = asMaskPlane(maskImage);

        // the params are only updated once the mask was reconciled with the data
        int nRows = (int) mask.dimension(1);
        int nCols = (int) mask.dimension(0);
        long nMaskedPixels = ImageAccessUtils.countForeground(mask);

        MaskDataLayout dataLayout;
        RandomAccessibleInterval<T> maskedData;
        if (data.numDimensions() == 3 && data.dimension(0) == nCols && data.dimension(1) == nRows) {
            LOG.info("Select {} mask pixels from {} frame stack", nMaskedPixels, ImageAccessUtils.shapeAsString(data));
            dataLayout = MaskDataLayout.FRAME_STACK;
            maskedData = ImageAccessUtils.selectMaskedPixels(mask, data);
        } else if (data.numDimensions() == 2 && data.dimension(0) == (long) nRows * nCols) {
            LOG.info("Select {} mask pixels from {} flattened stack", nMaskedPixels, ImageAccessUtils.shapeAsString(data));
            dataLayout = MaskDataLayout.FLATTENED;
            maskedData = ImageAccessUtils.selectMaskedPixels(mask, data);
        } else if (data.numDimensions() == 2 && data.dimension(0) == nMaskedPixels) {
            LOG.info("Data {} already has the {} mask pixels", ImageAccessUtils.shapeAsString(data), nMaskedPixels);
            dataLayout = MaskDataLayout.PRE_MASKED;
            maskedData = data;
        } else {
            throw new MaskDataSizeMismatchException(
                    ImageAccessUtils.shapeAsString(maskImage), nRows, nCols, ImageAccessUtils.shapeAsString(data));
        }
        params.setNRows(nRows).setNCols(nCols);
        return new MaskResolution<>(params, maskedData, dataLayout, null);
    }

    @SuppressWarnings("unchecked")
    private RandomAccessibleInterval<? extends BooleanType<?>> asMaskPlane(RandomAccessibleInterval<?> maskImage) {
        RandomAccessibleInterval<?> maskPlane = ImageAccessUtils.dropTrailingSingletonDimensions(maskImage);
        if (maskPlane.numDimensions() > 2) {
            throw new UnsupportedMaskDimensionalityException(ImageAccessUtils.shapeAsString(maskImage));
        } else if (maskPlane.numDimensions() == 1) {
            // a single row
            maskPlane = Views.addDimension(maskPlane, 0, 0);
        }
        return (RandomAccessibleInterval<? extends BooleanType<?>>) maskPlane;
    }
}
