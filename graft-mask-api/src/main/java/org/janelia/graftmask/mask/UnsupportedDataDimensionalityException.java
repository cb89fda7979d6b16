package org.janelia.graftmask.mask;

public class UnsupportedDataDimensionalityException extends MaskResolutionException {
    public UnsupportedDataDimensionalityException(String methodName, String dataShape) {
        super("Threshold method '" + methodName + "' requires a cols x rows x time frame stack but data shape is " + dataShape);
    }
}
