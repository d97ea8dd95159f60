package io.quakeflow.pipeline;

import io.quakeflow.exceptions.ExtractionFailedException;
import io.quakeflow.exceptions.QualityGateFailedException;
import io.quakeflow.extract.IntervalExtractor;
import io.quakeflow.functions.FeatureTransformer;
import io.quakeflow.models.ExtractionResult;
import io.quakeflow.models.QualityReport;
import io.quakeflow.models.RawDataset;
import io.quakeflow.quality.QualityGate;
import io.quakeflow.serialization.DatasetFormat;
import io.quakeflow.serialization.DatasetReaders;
import io.quakeflow.utils.PipelineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Adapts the extractor, gate and transformer to {@link PipelineStage}.
 * Each adapter only moves file locations around; the work stays in the
 * wrapped component.
 */
public final class PipelineStages {

    private static final Logger LOG = LoggerFactory.getLogger(PipelineStages.class);

    static final String PROCESSED_PREFIX = "earthquakes_processed_";
    private static final DateTimeFormatter DATE_STAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd").withZone(ZoneOffset.UTC);

    private PipelineStages() {}

    /**
     * Runs a merged extraction over the configured range and returns the
     * combined GeoJSON file. The input is ignored; the extractor already
     * knows its output directory.
     */
    public static PipelineStage extraction(IntervalExtractor extractor, PipelineConfig config) {
        return input -> {
            ExtractionResult result = extractor.extract(config.getStartYear(), config.getEndYear(),
                    config.getIntervalYears(), config.getMinMagnitude(), true);
            return result.getMergedGeoJson().orElseThrow(() -> new ExtractionFailedException(
                    "Extraction produced no combined output", result.getSummary()));
        };
    }

    /**
     * Loads the dataset, runs the gate and prints the report. A failing report
     * is escalated here, not inside the gate. Returns the input unchanged.
     */
    public static PipelineStage gate(QualityGate gate) {
        return input -> {
            RawDataset dataset = DatasetReaders.read(input, DatasetFormat.GEOJSON);
            QualityReport report = gate.check(dataset);
            LOG.info("\n{}", report.render());
            if (!report.isPassed()) {
                throw new QualityGateFailedException(report);
            }
            return input;
        };
    }

    /**
     * Writes {@code earthquakes_processed_<yyyyMMdd>.parquet} into the
     * processed directory.
     */
    public static PipelineStage transform(FeatureTransformer transformer, Path processedDir, Clock clock) {
        return input -> {
            Path output = processedDir.resolve(PROCESSED_PREFIX + DATE_STAMP.format(clock.instant()) + ".parquet");
            transformer.transformFile(input, output);
            return output;
        };
    }
}
