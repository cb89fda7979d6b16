package org.janelia.graftmask.mask;

import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * The mask related fields of the GraFT parameters. The mask resolver updates these in place.
 */
public class MaskParams {

    private MaskSpec mask = MaskSpec.unset();
    private int nRows;
    private int nCols;

    public MaskSpec getMask() {
        return mask;
    }

    public MaskParams setMask(MaskSpec mask) {
        this.mask = mask == null ? MaskSpec.unset() : mask;
        return this;
    }

    public int getNRows() {
        return nRows;
    }

    public MaskParams setNRows(int nRows) {
        this.nRows = nRows;
        return this;
    }

    public int getNCols() {
        return nCols;
    }

    public MaskParams setNCols(int nCols) {
        this.nCols = nCols;
        return this;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("mask", mask)
                .append("nRows", nRows)
                .append("nCols", nCols)
                .toString();
    }
}
