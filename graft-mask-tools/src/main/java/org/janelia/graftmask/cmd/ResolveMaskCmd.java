package org.janelia.graftmask.cmd;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.type.BooleanType;
import net.imglib2.type.numeric.real.FloatType;
import org.apache.commons.lang3.StringUtils;
import org.janelia.graftmask.image.ImageAccessUtils;
import org.janelia.graftmask.mask.MaskParams;
import org.janelia.graftmask.mask.MaskResolution;
import org.janelia.graftmask.mask.MaskResolver;
import org.janelia.graftmask.mask.MaskSpec;
import org.janelia.graftmask.threshold.MaskThresholdAlgorithmFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command to resolve a mask against a TIFF frame stack and write the mask and the masked pixels.
 */
class ResolveMaskCmd extends AbstractCmd {

    private static final Logger LOG = LoggerFactory.getLogger(ResolveMaskCmd.class);

    static final String MASK_FILENAME = "mask.tif";
    static final String MASKED_DATA_FILENAME = "masked-data.tif";
    static final String SUMMARY_FILENAME = "mask-resolution.json";

    @Parameters(commandDescription = "Resolve a named threshold method or a mask image against the imaging data")
    static class ResolveMaskArgs extends AbstractCmdArgs {
        @Parameter(names = {"--input", "-i"}, required = true,
                description = "TIFF image with the cols x rows x frames stack or the pixels x frames matrix")
        String inputFileName;

        @Parameter(names = {"--mask", "-m"}, required = true,
                description = "Threshold method name (sigma, adaptive, otsu, triangle) or a binary TIFF mask")
        String mask;

        @Parameter(names = {"--outputDir", "-od"}, description = "Output directory")
        String outputDir = ".";

        ResolveMaskArgs(CommonArgs commonArgs) {
            super(commonArgs);
        }

        @Override
        List<String> validate() {
            List<String> errors = new ArrayList<>();
            if (StringUtils.isBlank(inputFileName)) {
                errors.add("Input image is required");
            }
            if (StringUtils.isBlank(mask)) {
                errors.add("Mask method or mask image is required");
            }
            return errors;
        }

        /**
         * A value with a TIFF extension or a path separator names a mask image; anything else is a method name,
         * even if a file with that name happens to exist in the working directory.
         */
        boolean isMaskFile() {
            String lowerCaseMask = StringUtils.lowerCase(mask);
            return StringUtils.endsWithAny(lowerCaseMask, ".tif", ".tiff")
                    || StringUtils.containsAny(mask, '/', File.separatorChar);
        }
    }

    private final ResolveMaskArgs args;
    private final ObjectMapper mapper;

    ResolveMaskCmd(String commandName, CommonArgs commonArgs) {
        super(commandName);
        this.args = new ResolveMaskArgs(commonArgs);
        this.mapper = new ObjectMapper()
                .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    @Override
    ResolveMaskArgs getArgs() {
        return args;
    }

    @Override
    void execute() {
        Path outputDir = Paths.get(args.outputDir);
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Error creating output directory " + outputDir, e);
        }
        MaskResolver maskResolver = new MaskResolver(MaskThresholdAlgorithmFactory.createAlgorithms(getThresholdParams()));
        Img<FloatType> data = TiffImageUtils.readDataImage(Paths.get(args.inputFileName));
        LOG.info("Read {} data from {}", ImageAccessUtils.shapeAsString(data), args.inputFileName);

        MaskParams maskParams = new MaskParams().setMask(
                args.isMaskFile()
                        ? MaskSpec.explicit(TiffImageUtils.readMaskImage(Paths.get(args.mask)))
                        : MaskSpec.named(args.mask));
        MaskResolution<FloatType> resolution = maskResolver.resolve(maskParams, data);
        boolean computedMask = !args.isMaskFile() && !maskParams.getMask().isUnset();
        if (computedMask) {
            // the computed mask is only stored in the params so apply it in a second pass
            resolution = maskResolver.resolve(maskParams, data);
        }
        writeResults(resolution, outputDir);
    }

    private void writeResults(MaskResolution<FloatType> resolution, Path outputDir) {
        MaskResolutionSummary summary = new MaskResolutionSummary();
        summary.input = args.inputFileName;
        summary.mask = args.mask;
        summary.nRows = resolution.getParams().getNRows();
        summary.nCols = resolution.getParams().getNCols();
        summary.warning = resolution.getWarning();
        if (resolution.getDataLayout() != null) {
            summary.dataLayout = resolution.getDataLayout().name();
        }

        MaskSpec maskSpec = resolution.getParams().getMask();
        if (maskSpec instanceof MaskSpec.ExplicitMask && !((MaskSpec.ExplicitMask) maskSpec).isEmpty()) {
            RandomAccessibleInterval<? extends BooleanType<?>> mask = getMaskPlane((MaskSpec.ExplicitMask) maskSpec);
            summary.selectedPixels = ImageAccessUtils.countForeground(mask);
            Path maskPath = outputDir.resolve(MASK_FILENAME);
            TiffImageUtils.writeMaskImage(mask, maskPath);
            LOG.info("Wrote mask to {}", maskPath);
        }
        if (resolution.hasMaskedData()) {
            summary.maskedDataShape = ImageAccessUtils.shapeAsString(resolution.getMaskedData());
            if (resolution.getMaskedData().dimension(0) == 0) {
                LOG.warn("Mask selected no pixels - no masked data written");
            } else {
                Path maskedDataPath = outputDir.resolve(MASKED_DATA_FILENAME);
                TiffImageUtils.writeFloatImage(resolution.getMaskedData(), maskedDataPath);
                LOG.info("Wrote {} masked data to {}", summary.maskedDataShape, maskedDataPath);
            }
        }
        Path summaryPath = outputDir.resolve(SUMMARY_FILENAME);
        try {
            mapper.writeValue(summaryPath.toFile(), summary);
        } catch (IOException e) {
            throw new UncheckedIOException("Error writing " + summaryPath, e);
        }
    }

    @SuppressWarnings("unchecked")
    private RandomAccessibleInterval<? extends BooleanType<?>> getMaskPlane(MaskSpec.ExplicitMask explicitMask) {
        // the resolver has already checked the mask type and that it has a single plane
        return (RandomAccessibleInterval<? extends BooleanType<?>>) ImageAccessUtils.dropTrailingSingletonDimensions(explicitMask.getMask());
    }

    static class MaskResolutionSummary {
        public String input;
        public String mask;
        public int nRows;
        public int nCols;
        public Long selectedPixels;
        public String dataLayout;
        public String maskedDataShape;
        public String warning;
    }
}
