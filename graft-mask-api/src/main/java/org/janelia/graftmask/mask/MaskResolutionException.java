package org.janelia.graftmask.mask;

/**
 * Base class for the unrecoverable mask resolution failures.
 */
public class MaskResolutionException extends RuntimeException {
    public MaskResolutionException(String message) {
        super(message);
    }
}
