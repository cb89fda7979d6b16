package org.janelia.graftmask.mask;

public class MaskDataSizeMismatchException extends MaskResolutionException {
    public MaskDataSizeMismatchException(String maskShape, int nRows, int nCols, String dataShape) {
        super(String.format("Sizes of mask and data input do not match.%nMask: %s (rows=%d, cols=%d)%nData size: %s",
                maskShape, nRows, nCols, dataShape));
    }
}
