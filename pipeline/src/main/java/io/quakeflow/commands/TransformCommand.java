package io.quakeflow.commands;

import io.quakeflow.exceptions.DataIntegrityError;
import io.quakeflow.functions.FeatureTransformer;
import io.quakeflow.models.FeatureTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(
        name = "transform",
        description = "Build the feature table from a GeoJSON file and write it as Parquet.",
        mixinStandardHelpOptions = true)
public class TransformCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(TransformCommand.class);

    @Spec
    private CommandSpec spec;

    @Option(names = "--input", required = true, paramLabel = "FILE", description = "Raw GeoJSON input")
    private Path input;

    @Option(names = "--output", required = true, paramLabel = "FILE", description = "Parquet output")
    private Path output;

    @Override
    public Integer call() {
        try {
            FeatureTable table = new FeatureTransformer().transformFile(input, output);
            spec.commandLine().getOut().printf("Wrote %d rows x %d columns to %s%n",
                    table.size(), table.getColumns().size(), output);
            return 0;
        } catch (IOException | DataIntegrityError e) {
            LOG.error("Transform failed for {}", input, e);
            spec.commandLine().getErr().println("ERROR: " + e.getMessage());
            return 1;
        }
    }
}
