package io.quakeflow.commands;

import io.quakeflow.models.QualityReport;
import io.quakeflow.models.RawDataset;
import io.quakeflow.quality.QualityGate;
import io.quakeflow.quality.QualityGateConfig;
import io.quakeflow.serialization.DatasetFormat;
import io.quakeflow.serialization.DatasetReaders;
import io.quakeflow.serialization.JsonSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI for the {@code quality-check} command.
 *
 * <p>Loads a GeoJSON or Parquet dataset, runs the quality gate and prints
 * the report. Exits 0 when every check passed, otherwise 1 unless
 * {@code --no-fail} is given. Errors while loading the dataset follow the
 * same rule.
 */
@Command(
        name = "quality-check",
        description = "Validate an earthquake dataset before it is transformed.",
        mixinStandardHelpOptions = true)
public class QualityCheckCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(QualityCheckCommand.class);

    @Spec
    private CommandSpec spec;

    @Option(names = "--input", required = true, paramLabel = "FILE",
            description = "Dataset to validate")
    private Path input;

    @Option(names = "--format", defaultValue = "geojson", paramLabel = "FORMAT",
            description = "Input format: geojson or parquet (default: ${DEFAULT-VALUE})")
    private String format;

    @Option(names = "--no-fail",
            description = "Exit 0 even when checks fail or the check cannot run")
    private boolean noFail;

    @Option(names = "--min-rows", defaultValue = "100", paramLabel = "N",
            description = "Minimum row count (default: ${DEFAULT-VALUE})")
    private int minRows;

    @Option(names = "--null-threshold", defaultValue = "0.01", paramLabel = "RATIO",
            description = "Maximum share of nulls per core column (default: ${DEFAULT-VALUE})")
    private double nullThreshold;

    @Option(names = "--report-json", paramLabel = "FILE",
            description = "Also write the report as JSON")
    private Path reportJson;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        QualityReport report;
        try {
            DatasetFormat datasetFormat = DatasetFormat.fromString(format);
            RawDataset dataset = DatasetReaders.read(input, datasetFormat);
            QualityGateConfig config = QualityGateConfig.defaults()
                    .withMinRows(minRows)
                    .withNullThreshold(nullThreshold);
            report = new QualityGate(config).check(dataset);
            if (reportJson != null) {
                new JsonSerializer<QualityReport>().write(report, reportJson);
                LOG.info("Report written to {}", reportJson);
            }
        } catch (Exception e) {
            LOG.error("Quality check could not run on {}", input, e);
            err.println("ERROR: " + e.getMessage());
            err.flush();
            return noFail ? 0 : 1;
        }

        out.println(report.render());
        out.flush();

        if (report.isPassed() || noFail) {
            return 0;
        }
        return 1;
    }
}
