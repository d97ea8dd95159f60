package io.quakeflow.quality;

import io.quakeflow.models.CheckResult;
import io.quakeflow.models.QualityReport;
import io.quakeflow.models.RawDataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the enabled checks in fixed order (row count, nulls, schema, ranges)
 * and aggregates them into a {@link QualityReport}. Every enabled check runs
 * regardless of earlier failures. The gate only reads the dataset; the same
 * input always yields an equal report.
 */
public class QualityGate {

    private static final Logger LOG = LoggerFactory.getLogger(QualityGate.class);

    private final List<QualityCheck> checks;

    public QualityGate(QualityGateConfig config) {
        List<QualityCheck> all = List.of(
                new RowCountCheck(config.getMinRows()),
                new NullRatioCheck(config.getNullThreshold()),
                new SchemaCheck(),
                new RangeCheck());
        this.checks = new ArrayList<>();
        for (QualityCheck check : all) {
            if (config.isEnabled(check.name())) {
                checks.add(check);
            }
        }
    }

    public QualityGate() {
        this(QualityGateConfig.defaults());
    }

    public QualityReport check(RawDataset dataset) {
        Map<String, CheckResult> results = new LinkedHashMap<>();
        for (QualityCheck check : checks) {
            CheckResult result = check.run(dataset);
            results.put(check.name(), result);
            if (result.isPassed()) {
                LOG.debug("Check {} passed", check.name());
            } else {
                LOG.warn("Check {} failed: {}", check.name(), result.getViolations());
            }
        }

        QualityReport report = new QualityReport(dataset.getSource(), dataset.size(), results);
        LOG.info("Quality gate on {} ({} rows): {}", dataset.getSource(), dataset.size(),
                report.isPassed() ? "PASSED" : "FAILED");
        return report;
    }
}
