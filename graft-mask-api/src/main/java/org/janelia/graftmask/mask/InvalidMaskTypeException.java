package org.janelia.graftmask.mask;

public class InvalidMaskTypeException extends MaskResolutionException {
    public InvalidMaskTypeException(Object pixelType) {
        super("Mask not binary - mask must be boolean but its pixel type is "
                + (pixelType == null ? "unknown" : pixelType.getClass().getSimpleName()));
    }
}
