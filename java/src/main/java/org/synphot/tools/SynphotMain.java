package org.synphot.tools;

import ch.qos.logback.classic.Level;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.synphot.config.SynphotConfig;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Main entry point for the synthetic photometry command-line tools.
 */
@Command(
    name = "synphot",
    mixinStandardHelpOptions = true,
    version = "Synphot Tools 1.0.0",
    description = "Spectrum arithmetic, renormalization and passband statistics",
    subcommands = {
        InfoCommand.class,
        StatsCommand.class,
        CalcCommand.class,
        RenormCommand.class,
        RedshiftCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class SynphotMain implements Runnable {

    @Spec
    private CommandSpec spec;

    private boolean verbose;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new SynphotMain()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public void run() {
        // When called without subcommand, show help
        CommandLine.usage(this, System.out);
    }

    @Option(names = {"-v", "--verbose"}, description = "Enable debug logging")
    public void setVerbose(boolean verbose) {
        this.verbose = verbose;
        if (verbose) {
            Logger logger = LoggerFactory.getLogger("org.synphot");
            if (logger instanceof ch.qos.logback.classic.Logger) {
                ((ch.qos.logback.classic.Logger) logger).setLevel(Level.DEBUG);
            }
        }
    }

    @Option(names = {"--config"}, description = "YAML file overriding the default thresholds")
    public void setConfig(Path configFile) {
        if (configFile == null) return;
        try {
            SynphotConfig.setDefault(SynphotConfig.load(configFile));
        } catch (IOException | IllegalArgumentException e) {
            throw new ParameterException(spec.commandLine(), "Cannot load config: " + e.getMessage(), e);
        }
    }

    public boolean isVerbose() {
        return verbose;
    }
}
