package org.janelia.graftmask.mask;

import javax.annotation.Nonnull;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.util.Intervals;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.apache.commons.lang3.builder.ToStringBuilder;
import org.janelia.graftmask.image.ImageAccessUtils;

/**
 * What the caller asked for in the mask field of the parameters: the name of an automatic
 * threshold method, an explicit mask image, or nothing at all.
 */
public abstract class MaskSpec {

    private static final MaskSpec UNSET = new Unset();

    public static MaskSpec unset() {
        return UNSET;
    }

    /**
     * Only a missing name leaves the mask unset; any other name, blank ones included, is resolved as a method name.
     */
    public static MaskSpec named(String methodName) {
        return methodName == null ? UNSET : new NamedMethod(methodName);
    }

    public static MaskSpec explicit(RandomAccessibleInterval<?> mask) {
        return mask == null ? UNSET : new ExplicitMask(mask);
    }

    /**
     * Create an explicit mask from a row-major boolean array, i.e. <code>rows[r][c]</code>.
     */
    public static MaskSpec explicit(boolean[][] rows) {
        if (rows == null || rows.length == 0 || rows[0].length == 0) {
            return UNSET;
        }
        return new ExplicitMask(ImageAccessUtils.createMask(rows));
    }

    MaskSpec() {
    }

    public boolean isUnset() {
        return false;
    }

    public static final class Unset extends MaskSpec {
        private Unset() {
        }

        @Override
        public boolean isUnset() {
            return true;
        }

        @Override
        public String toString() {
            return "Unset";
        }
    }

    public static final class NamedMethod extends MaskSpec {
        private final String name;

        private NamedMethod(@Nonnull String name) {
            this.name = name;
        }

        public String getName() {
            return name;
        }

        /**
         * @return the trimmed, lower case method name used for the algorithm lookup.
         */
        public String getNormalizedName() {
            return StringUtils.lowerCase(StringUtils.trim(name));
        }

        @Override
        public String toString() {
            return new ToStringBuilder(this)
                    .append("name", name)
                    .toString();
        }
    }

    public static final class ExplicitMask extends MaskSpec {
        private final RandomAccessibleInterval<?> mask;

        private ExplicitMask(@Nonnull RandomAccessibleInterval<?> mask) {
            Validate.notNull(mask, "Mask image cannot be null");
            this.mask = mask;
        }

        public RandomAccessibleInterval<?> getMask() {
            return mask;
        }

        public boolean isEmpty() {
            return Intervals.numElements(mask) == 0;
        }

        @Override
        public String toString() {
            return new ToStringBuilder(this)
                    .append("shape", ImageAccessUtils.shapeAsString(mask))
                    .toString();
        }
    }
}
