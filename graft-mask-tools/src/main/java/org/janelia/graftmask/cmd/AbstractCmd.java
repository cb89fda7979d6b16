package org.janelia.graftmask.cmd;

import org.apache.commons.lang3.StringUtils;
import org.janelia.graftmask.config.Config;
import org.janelia.graftmask.config.ConfigProvider;
import org.janelia.graftmask.threshold.MaskThresholdParams;

abstract class AbstractCmd {

    private final String commandName;
    private Config config;

    AbstractCmd(String commandName) {
        this.commandName = commandName;
        this.config = null;
    }

    public String getCommandName() {
        return commandName;
    }

    abstract AbstractCmdArgs getArgs();

    boolean matches(String commandName) {
        return StringUtils.isNotBlank(commandName) && StringUtils.equals(this.commandName, commandName);
    }

    abstract void execute();

    Config getConfig() {
        if (config == null) {
            config = ConfigProvider.getInstance()
                    .fromDefaultResources()
                    .fromFile(getArgs().getConfigFileName())
                    .get();
        }
        return config;
    }

    MaskThresholdParams getThresholdParams() {
        MaskThresholdParams defaults = new MaskThresholdParams();
        Config config = getConfig();
        return new MaskThresholdParams()
                .setSigmaStdFactor(config.getDoublePropertyValue("Sigma.StdFactor", defaults.getSigmaStdFactor()))
                .setAdaptiveBlockSize(config.getIntegerPropertyValue("Adaptive.BlockSize", defaults.getAdaptiveBlockSize()))
                .setAdaptiveSensitivity(config.getDoublePropertyValue("Adaptive.Sensitivity", defaults.getAdaptiveSensitivity()))
                .setHistogramBins(config.getIntegerPropertyValue("Histogram.Bins", defaults.getHistogramBins()));
    }
}
