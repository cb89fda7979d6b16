package org.janelia.graftmask.threshold;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory for the table of named threshold algorithms used by the mask resolver.
 */
public class MaskThresholdAlgorithmFactory {

    private static final Logger LOG = LoggerFactory.getLogger(MaskThresholdAlgorithmFactory.class);

    public static Map<String, MaskThresholdAlgorithm> createDefaultAlgorithms() {
        return createAlgorithms(new MaskThresholdParams());
    }

    /**
     * Create the sigma, adaptive, otsu and triangle algorithms, keyed by their lower case names.
     *
     * @param params algorithm parameters
     * @return an unmodifiable, ordered name to algorithm table
     */
    public static Map<String, MaskThresholdAlgorithm> createAlgorithms(MaskThresholdParams params) {
        LOG.info("Create mask threshold algorithms with {}", params);
        Map<String, MaskThresholdAlgorithm> algorithms = new LinkedHashMap<>();
        register(algorithms, new SigmaThresholdAlgorithm(params.getSigmaStdFactor()));
        register(algorithms, new AdaptiveThresholdAlgorithm(params.getAdaptiveBlockSize(), params.getAdaptiveSensitivity()));
        register(algorithms, new OtsuThresholdAlgorithm(params.getHistogramBins()));
        register(algorithms, new TriangleThresholdAlgorithm(params.getHistogramBins()));
        return Collections.unmodifiableMap(algorithms);
    }

    private static void register(Map<String, MaskThresholdAlgorithm> algorithms, MaskThresholdAlgorithm algorithm) {
        algorithms.put(algorithm.getName().toLowerCase(), algorithm);
    }
}
