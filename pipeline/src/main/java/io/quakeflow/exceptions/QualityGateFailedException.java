package io.quakeflow.exceptions;

import io.quakeflow.models.QualityReport;

/**
 * Escalation of a failing {@link QualityReport} into a stage failure.
 * The gate itself never throws this; its callers do.
 */
public class QualityGateFailedException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient QualityReport report;

    public QualityGateFailedException(QualityReport report) {
        super(String.format("Data quality check failed: %d violation(s): %s",
                report.getViolations().size(), report.getViolations()));
        this.report = report;
    }

    public QualityReport getReport() {
        return report;
    }
}
