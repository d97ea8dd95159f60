package io.quakeflow;

import io.quakeflow.commands.ExtractCommand;
import io.quakeflow.commands.QualityCheckCommand;
import io.quakeflow.commands.RunCommand;
import io.quakeflow.commands.TransformCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * QuakeFlow entry point.
 *
 * Subcommands:
 * - extract: interval download from USGS (or mock)
 * - quality-check: validate a dataset
 * - transform: feature engineering to Parquet
 * - run: all of the above, with whole-pipeline retries
 */
@Command(
        name = "quakeflow",
        description = "Earthquake extraction, quality gate and feature pipeline.",
        mixinStandardHelpOptions = true,
        version = "quakeflow 1.0.0",
        subcommands = {
                ExtractCommand.class,
                QualityCheckCommand.class,
                TransformCommand.class,
                RunCommand.class
        })
public class QuakeFlowApp implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    public static void main(String[] args) {
        System.exit(new CommandLine(new QuakeFlowApp()).execute(args));
    }
}
