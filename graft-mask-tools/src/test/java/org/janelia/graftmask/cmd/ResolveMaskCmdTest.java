package org.janelia.graftmask.cmd;

import java.io.File;
import java.io.IOException;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import ij.ImagePlus;
import ij.ImageStack;
import ij.io.FileSaver;
import ij.io.Opener;
import ij.process.ByteProcessor;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;
import ij.process.ShortProcessor;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;

public class ResolveMaskCmdTest {

    private static final int N_ROWS = 3;
    private static final int N_COLS = 4;
    private static final int N_FRAMES = 5;

    @Rule
    public TemporaryFolder testFolder = new TemporaryFolder();

    private File outputDir;

    @Before
    public void setUp() {
        outputDir = new File(testFolder.getRoot(), "output");
    }

    @Test
    public void explicitMaskSelectsPixelsFromFrameStack() throws IOException {
        File stackFile = writeIndexedStack();
        ByteProcessor maskProcessor = new ByteProcessor(N_COLS, N_ROWS);
        maskProcessor.set(1, 0, 255);
        maskProcessor.set(3, 2, 255);
        File maskFile = writeImage(new ImagePlus("mask", maskProcessor), "input-mask.tif");

        int exitCode = GraftMaskApp.run("resolveMask",
                "--input", stackFile.getAbsolutePath(),
                "--mask", maskFile.getAbsolutePath(),
                "--outputDir", outputDir.getAbsolutePath());

        assertEquals(0, exitCode);
        JsonNode summary = readSummary();
        assertEquals(N_ROWS, summary.get("nRows").asInt());
        assertEquals(N_COLS, summary.get("nCols").asInt());
        assertEquals(2, summary.get("selectedPixels").asLong());
        assertEquals("FRAME_STACK", summary.get("dataLayout").asText());
        assertFalse(summary.has("warning"));

        ImagePlus maskedData = openOutput(ResolveMaskCmd.MASKED_DATA_FILENAME);
        assertEquals(2, maskedData.getWidth());
        assertEquals(N_FRAMES, maskedData.getHeight());
        ImageProcessor maskedDataProcessor = maskedData.getProcessor();
        for (int t = 0; t < N_FRAMES; t++) {
            assertEquals(10 + t, maskedDataProcessor.getf(0, t), 1e-6);
            assertEquals(230 + t, maskedDataProcessor.getf(1, t), 1e-6);
        }
        ImagePlus mask = openOutput(ResolveMaskCmd.MASK_FILENAME);
        assertEquals(255, mask.getProcessor().get(1, 0));
        assertEquals(0, mask.getProcessor().get(0, 0));
    }

    @Test
    public void sixteenBitStackIsReadAsFloat() throws IOException {
        ImageStack stack = new ImageStack(N_COLS, N_ROWS);
        for (int t = 0; t < N_FRAMES; t++) {
            ShortProcessor frame = new ShortProcessor(N_COLS, N_ROWS);
            for (int r = 0; r < N_ROWS; r++) {
                for (int c = 0; c < N_COLS; c++) {
                    frame.set(c, r, 1000 * r + 10 * c + t);
                }
            }
            stack.addSlice(frame);
        }
        File stackFile = writeImage(new ImagePlus("stack", stack), "short-stack.tif");
        ByteProcessor maskProcessor = new ByteProcessor(N_COLS, N_ROWS);
        maskProcessor.set(2, 1, 1);
        File maskFile = writeImage(new ImagePlus("mask", maskProcessor), "binary-mask.tif");

        int exitCode = GraftMaskApp.run("resolveMask",
                "--input", stackFile.getAbsolutePath(),
                "--mask", maskFile.getAbsolutePath(),
                "--outputDir", outputDir.getAbsolutePath());

        assertEquals(0, exitCode);
        assertEquals(1, readSummary().get("selectedPixels").asLong());
        ImagePlus maskedData = openOutput(ResolveMaskCmd.MASKED_DATA_FILENAME);
        assertEquals(32, maskedData.getBitDepth());
        for (int t = 0; t < N_FRAMES; t++) {
            assertEquals(1020 + t, maskedData.getProcessor().getf(0, t), 1e-6);
        }
    }

    @Test
    public void namedMethodMaskIsComputedAndApplied() throws IOException {
        int nRows = 8;
        int nCols = 10;
        int nFrames = 50;
        ImageStack stack = new ImageStack(nCols, nRows);
        for (int t = 0; t < nFrames; t++) {
            FloatProcessor frame = new FloatProcessor(nCols, nRows);
            for (int r = 0; r < nRows; r++) {
                for (int c = 0; c < nCols; c++) {
                    // a full number of periods keeps every trace within sqrt(2) std of its mean
                    frame.setf(c, r, (float) (100 + 5 * Math.sin(2 * Math.PI * t / 10 + r + c)));
                }
            }
            if (t == 30) {
                frame.setf(2, 1, 1000);
            }
            stack.addSlice(frame);
        }
        File stackFile = writeImage(new ImagePlus("stack", stack), "stack.tif");

        int exitCode = GraftMaskApp.run("resolveMask",
                "--input", stackFile.getAbsolutePath(),
                "--mask", "Sigma",
                "--outputDir", outputDir.getAbsolutePath());

        assertEquals(0, exitCode);
        JsonNode summary = readSummary();
        assertEquals(nRows, summary.get("nRows").asInt());
        assertEquals(nCols, summary.get("nCols").asInt());
        assertEquals(1, summary.get("selectedPixels").asLong());
        assertEquals("FRAME_STACK", summary.get("dataLayout").asText());
        ImagePlus mask = openOutput(ResolveMaskCmd.MASK_FILENAME);
        assertEquals(255, mask.getProcessor().get(2, 1));
        ImagePlus maskedData = openOutput(ResolveMaskCmd.MASKED_DATA_FILENAME);
        assertEquals(1, maskedData.getWidth());
        assertEquals(nFrames, maskedData.getHeight());
        assertEquals(1000, maskedData.getProcessor().getf(0, 30), 1e-6);
    }

    @Test
    public void unrecognizedMethodIsReportedAsWarning() throws IOException {
        File stackFile = writeIndexedStack();

        int exitCode = GraftMaskApp.run("resolveMask",
                "--input", stackFile.getAbsolutePath(),
                "--mask", "watershed",
                "--outputDir", outputDir.getAbsolutePath());

        assertEquals(0, exitCode);
        JsonNode summary = readSummary();
        assertTrue(summary.get("warning").asText().contains("'watershed'"));
        assertFalse(new File(outputDir, ResolveMaskCmd.MASK_FILENAME).exists());
        assertFalse(new File(outputDir, ResolveMaskCmd.MASKED_DATA_FILENAME).exists());
    }

    @Test
    public void mismatchedMaskFails() throws IOException {
        File stackFile = writeIndexedStack();
        ByteProcessor maskProcessor = new ByteProcessor(N_COLS + 1, N_ROWS);
        maskProcessor.set(0, 0, 255);
        File maskFile = writeImage(new ImagePlus("mask", maskProcessor), "wide-mask.tif");

        int exitCode = GraftMaskApp.run("resolveMask",
                "--input", stackFile.getAbsolutePath(),
                "--mask", maskFile.getAbsolutePath(),
                "--outputDir", outputDir.getAbsolutePath());

        assertEquals(2, exitCode);
        assertFalse(new File(outputDir, ResolveMaskCmd.SUMMARY_FILENAME).exists());
    }

    @Test
    public void nonBinaryMaskFails() throws IOException {
        File stackFile = writeIndexedStack();
        ByteProcessor maskProcessor = new ByteProcessor(N_COLS, N_ROWS);
        maskProcessor.set(0, 0, 255);
        maskProcessor.set(1, 0, 17);
        File maskFile = writeImage(new ImagePlus("mask", maskProcessor), "gray-mask.tif");

        int exitCode = GraftMaskApp.run("resolveMask",
                "--input", stackFile.getAbsolutePath(),
                "--mask", maskFile.getAbsolutePath(),
                "--outputDir", outputDir.getAbsolutePath());

        assertEquals(2, exitCode);
    }

    @Test
    public void maskArgumentIsFileOnlyWithTiffExtensionOrPath() {
        ResolveMaskCmd.ResolveMaskArgs args = new ResolveMaskCmd.ResolveMaskArgs(new CommonArgs());
        args.mask = "otsu";
        assertFalse(args.isMaskFile());
        args.mask = "Triangle";
        assertFalse(args.isMaskFile());
        args.mask = "mask.TIF";
        assertTrue(args.isMaskFile());
        args.mask = "mask.tiff";
        assertTrue(args.isMaskFile());
        args.mask = "masks/roi";
        assertTrue(args.isMaskFile());
        args.mask = new File(testFolder.getRoot(), "roi").getAbsolutePath();
        assertTrue(args.isMaskFile());
    }

    @Test
    public void methodNameIsUsedEvenIfSuchFileExists() throws IOException {
        File stackFile = writeIndexedStack();
        File otsuFile = new File("otsu");
        boolean created = otsuFile.createNewFile();
        try {
            int exitCode = GraftMaskApp.run("resolveMask",
                    "--input", stackFile.getAbsolutePath(),
                    "--mask", "otsu",
                    "--outputDir", outputDir.getAbsolutePath());

            assertEquals(0, exitCode);
            JsonNode summary = readSummary();
            assertFalse(summary.has("warning"));
            assertEquals(N_ROWS, summary.get("nRows").asInt());
            assertEquals(N_COLS, summary.get("nCols").asInt());
        } finally {
            if (created) {
                otsuFile.delete();
            }
        }
    }

    @Test
    public void missingRequiredArgument() {
        assertEquals(1, GraftMaskApp.run("resolveMask", "--mask", "otsu"));
    }

    @Test
    public void unknownCommand() {
        assertEquals(1, GraftMaskApp.run("segment"));
    }

    /**
     * A cols x rows x frames stack where pixel (row, col) at frame t is 100 * row + 10 * col + t.
     */
    private File writeIndexedStack() throws IOException {
        ImageStack stack = new ImageStack(N_COLS, N_ROWS);
        for (int t = 0; t < N_FRAMES; t++) {
            FloatProcessor frame = new FloatProcessor(N_COLS, N_ROWS);
            for (int r = 0; r < N_ROWS; r++) {
                for (int c = 0; c < N_COLS; c++) {
                    frame.setf(c, r, 100 * r + 10 * c + t);
                }
            }
            stack.addSlice(frame);
        }
        return writeImage(new ImagePlus("stack", stack), "indexed-stack.tif");
    }

    private File writeImage(ImagePlus imp, String name) throws IOException {
        File imageFile = new File(testFolder.getRoot(), name);
        boolean saved = imp.getStackSize() > 1
                ? new FileSaver(imp).saveAsTiffStack(imageFile.getAbsolutePath())
                : new FileSaver(imp).saveAsTiff(imageFile.getAbsolutePath());
        if (!saved) {
            throw new IOException("Could not write " + imageFile);
        }
        return imageFile;
    }

    private ImagePlus openOutput(String name) {
        ImagePlus imp = new Opener().openImage(new File(outputDir, name).getAbsolutePath());
        assertNotNull(name, imp);
        return imp;
    }

    private JsonNode readSummary() throws IOException {
        return new ObjectMapper().readTree(new File(outputDir, ResolveMaskCmd.SUMMARY_FILENAME));
    }
}
