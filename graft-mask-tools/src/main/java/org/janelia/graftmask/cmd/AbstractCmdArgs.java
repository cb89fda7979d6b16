package org.janelia.graftmask.cmd;

import java.io.Serializable;
import java.util.Collections;
import java.util.List;

import com.beust.jcommander.ParametersDelegate;

class AbstractCmdArgs implements Serializable {

    @ParametersDelegate
    final CommonArgs commonArgs;

    AbstractCmdArgs(CommonArgs commonArgs) {
        this.commonArgs = commonArgs;
    }

    String getConfigFileName() {
        return commonArgs.configFileName;
    }

    List<String> validate() {
        return Collections.emptyList();
    }
}
