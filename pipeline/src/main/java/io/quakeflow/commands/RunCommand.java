package io.quakeflow.commands;

import io.quakeflow.pipeline.PipelineOrchestrator;
import io.quakeflow.pipeline.PipelineRunResult;
import io.quakeflow.utils.ConfigLoader;
import io.quakeflow.utils.PipelineConfig;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

/**
 * CLI for the {@code run} command: Extract, Gate and Transform in one go.
 * Exits 0 on DONE and 1 on ABORTED.
 */
@Command(
        name = "run",
        description = "Run the full extraction, quality gate and transform pipeline.",
        mixinStandardHelpOptions = true)
public class RunCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Option(names = "--start-year", paramLabel = "YEAR", description = "First year to fetch")
    private Integer startYear;

    @Option(names = "--end-year", paramLabel = "YEAR", description = "Last year to fetch (inclusive)")
    private Integer endYear;

    @Option(names = "--minmagnitude", paramLabel = "MAG", description = "Minimum magnitude filter")
    private Double minMagnitude;

    @Option(names = "--use-mock", description = "Serve a fixed mock event instead of calling the API")
    private boolean useMock;

    @Override
    public Integer call() {
        PipelineConfig.Builder b = ConfigLoader.fromEnvironment().toBuilder();
        if (startYear != null) b.startYear(startYear);
        if (endYear != null) b.endYear(endYear);
        if (minMagnitude != null) b.minMagnitude(minMagnitude);
        if (useMock) b.mock(true);

        PipelineRunResult result = PipelineOrchestrator.fromConfig(b.build()).run();
        spec.commandLine().getOut().println(result.describe());
        spec.commandLine().getOut().flush();
        return result.exitCode();
    }
}
