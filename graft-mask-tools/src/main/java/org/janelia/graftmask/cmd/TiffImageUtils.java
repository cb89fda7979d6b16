package org.janelia.graftmask.cmd;

import java.nio.file.Files;
import java.nio.file.Path;

import com.google.common.base.Preconditions;

import ij.ImagePlus;
import ij.io.FileSaver;
import ij.io.Opener;
import ij.process.ImageConverter;
import ij.process.StackConverter;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.converter.Converters;
import net.imglib2.img.Img;
import net.imglib2.img.display.imagej.ImageJFunctions;
import net.imglib2.type.BooleanType;
import net.imglib2.type.logic.BitType;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.integer.UnsignedByteType;
import net.imglib2.type.numeric.real.FloatType;
import org.janelia.graftmask.image.ImageAccessUtils;

/**
 * Reads and writes TIFF images with ImageJ and wraps them as imglib2 images.
 * ImageJ x and y become the first two imglib2 axes and the slices become the third.
 */
class TiffImageUtils {

    /**
     * Read the data stack. A multi-slice TIFF is read as a cols x rows x frames stack and a single plane
     * TIFF as a 2D image, which is how flattened or already masked pixels x frames data is stored.
     */
    static Img<FloatType> readDataImage(Path imagePath) {
        ImagePlus imp = openImage(imagePath);
        if (imp.getBitDepth() != 32) {
            if (imp.getStackSize() > 1) {
                new StackConverter(imp).convertToGray32();
            } else {
                new ImageConverter(imp).convertToGray32();
            }
        }
        return ImageJFunctions.wrapFloat(imp);
    }

    /**
     * Read a mask image. Only 8-bit images with 0 and a single foreground value (1 or 255) are read
     * as boolean masks; anything else is returned with its intensities so that it gets rejected as
     * a non binary mask.
     */
    static RandomAccessibleInterval<?> readMaskImage(Path imagePath) {
        ImagePlus imp = openImage(imagePath);
        if (imp.getBitDepth() != 8) {
            return readDataImage(imagePath);
        }
        Img<UnsignedByteType> maskImg = ImageJFunctions.wrapByte(imp);
        if (!hasOnlyBinaryValues(maskImg)) {
            return readDataImage(imagePath);
        }
        return Converters.convert(
                (RandomAccessibleInterval<UnsignedByteType>) maskImg,
                (UnsignedByteType s, BitType t) -> t.set(s.get() != 0),
                new BitType());
    }

    static <B extends BooleanType<?>> void writeMaskImage(RandomAccessibleInterval<B> mask, Path imagePath) {
        Preconditions.checkArgument(mask.numDimensions() == 2, "Mask must be 2D but is %s", ImageAccessUtils.shapeAsString(mask));
        ImagePlus maskImp = ImageJFunctions.wrapUnsignedByte(
                mask,
                (B s, UnsignedByteType t) -> t.set(s.get() ? 255 : 0),
                "mask");
        saveAsTiff(new ImagePlus("mask", maskImp.getProcessor()), imagePath);
    }

    /**
     * Write a 2D image, such as the pixels x frames matrix, as a 32-bit float TIFF.
     */
    static <T extends RealType<T>> void writeFloatImage(RandomAccessibleInterval<T> img, Path imagePath) {
        Preconditions.checkArgument(img.numDimensions() == 2, "Image must be 2D but is %s", ImageAccessUtils.shapeAsString(img));
        ImagePlus dataImp = ImageJFunctions.wrapFloat(
                img,
                (T s, FloatType t) -> t.set(s.getRealFloat()),
                "data");
        saveAsTiff(new ImagePlus("data", dataImp.getProcessor()), imagePath);
    }

    private static ImagePlus openImage(Path imagePath) {
        Preconditions.checkArgument(Files.exists(imagePath), "Image file %s does not exist", imagePath);
        ImagePlus imp = new Opener().openImage(imagePath.toString());
        if (imp == null) {
            throw new IllegalArgumentException("Could not open image " + imagePath);
        }
        return imp;
    }

    private static boolean hasOnlyBinaryValues(Img<UnsignedByteType> img) {
        int foreground = 0;
        for (UnsignedByteType pixel : img) {
            int v = pixel.get();
            if (v == 0) {
                continue;
            }
            if (foreground == 0 && (v == 1 || v == 255)) {
                foreground = v;
            } else if (v != foreground) {
                return false;
            }
        }
        return true;
    }

    private static void saveAsTiff(ImagePlus imp, Path imagePath) {
        if (!new FileSaver(imp).saveAsTiff(imagePath.toString())) {
            throw new IllegalStateException("Error writing " + imagePath);
        }
    }
}
