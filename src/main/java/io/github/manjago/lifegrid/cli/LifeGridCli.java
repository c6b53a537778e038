package io.github.manjago.lifegrid.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * LifeGrid command line.
 *
 * Usage:
 *   lifegrid run [options]   - Run a simulation
 *   lifegrid info            - Show version and default configuration
 */
@Command(
    name = "lifegrid",
    description = "Grid organism simulation - energy, density, decay and evolving reproduction",
    mixinStandardHelpOptions = true,
    version = "LifeGrid 1.0.0",
    subcommands = {
        RunCommand.class,
        InfoCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class LifeGridCli implements Runnable {

    @Override
    public void run() {
        // No subcommand: show help
        CommandLine.usage(this, System.out);
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new LifeGridCli())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
