package org.janelia.graftmask.mask;

/**
 * Data layouts the resolver knows how to reconcile with a 2D mask.
 */
public enum MaskDataLayout {
    /** nCols x nRows x time */
    FRAME_STACK,
    /** (nRows * nCols) x time */
    FLATTENED,
    /** maskPixels x time - the mask has already been applied */
    PRE_MASKED
}
