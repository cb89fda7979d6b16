package org.janelia.graftmask.mask;

public class UnsupportedMaskDimensionalityException extends MaskResolutionException {
    public UnsupportedMaskDimensionalityException(String maskShape) {
        super("3D mask not supported - mask shape: " + maskShape);
    }
}
