package org.janelia.graftmask.cmd;

import java.util.Arrays;
import java.util.List;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;

import org.apache.commons.lang3.StringUtils;
import org.janelia.graftmask.mask.MaskResolutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line entry point.
 */
public class GraftMaskApp {

    private static final Logger LOG = LoggerFactory.getLogger(GraftMaskApp.class);

    static class MainArgs {
        @Parameter(names = {"-h", "--help"}, description = "Display the help message", help = true, arity = 0)
        boolean displayHelpMessage = false;
    }

    public static void main(String[] argv) {
        int exitCode = run(argv);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    static int run(String... argv) {
        MainArgs mainArgs = new MainArgs();
        CommonArgs commonArgs = new CommonArgs();
        List<AbstractCmd> cmds = Arrays.asList(
                new ResolveMaskCmd("resolveMask", commonArgs)
        );
        JCommander.Builder cmdlineBuilder = JCommander.newBuilder()
                .programName(GraftMaskApp.class.getSimpleName())
                .addObject(mainArgs);
        cmds.forEach(cmd -> cmdlineBuilder.addCommand(cmd.getCommandName(), cmd.getArgs()));
        JCommander cmdline = cmdlineBuilder.build();

        try {
            cmdline.parse(argv);
        } catch (ParameterException e) {
            LOG.error("Invalid command line: {}", e.getMessage());
            cmdline.usage();
            return 1;
        }

        String parsedCommand = cmdline.getParsedCommand();
        if (mainArgs.displayHelpMessage || StringUtils.isBlank(parsedCommand)) {
            cmdline.usage();
            return mainArgs.displayHelpMessage ? 0 : 1;
        }
        if (commonArgs.displayHelpMessage) {
            cmdline.usage(parsedCommand);
            return 0;
        }
        AbstractCmd cmd = cmds.stream()
                .filter(c -> c.matches(parsedCommand))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Invalid command: " + parsedCommand));
        List<String> validationErrors = cmd.getArgs().validate();
        if (!validationErrors.isEmpty()) {
            LOG.error("Invalid arguments for {}: {}", parsedCommand, validationErrors);
            cmdline.usage(parsedCommand);
            return 1;
        }
        try {
            cmd.execute();
            return 0;
        } catch (MaskResolutionException | IllegalArgumentException e) {
            LOG.error("{} failed: {}", parsedCommand, e.getMessage());
            return 2;
        }
    }
}
