package org.janelia.graftmask.cmd;

import java.io.Serializable;

import com.beust.jcommander.Parameter;

class CommonArgs implements Serializable {

    @Parameter(names = "--config", description = "Properties file that overrides the default threshold settings")
    String configFileName;

    @Parameter(names = {"-h", "--help"}, description = "Display the help message", help = true, arity = 0)
    boolean displayHelpMessage = false;
}
