package io.quakeflow.models;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable verdict of one quality gate invocation.
 * Checks keep declaration order; the aggregate violation list follows it.
 */
public final class QualityReport {

    private static final String RULE = "=".repeat(60);

    @JsonProperty("source")
    private final String source;

    @JsonProperty("row_count")
    private final int rowCount;

    @JsonProperty("checks")
    private final Map<String, CheckResult> checks;

    @JsonProperty("passed")
    private final boolean passed;

    @JsonProperty("violations")
    private final List<String> violations;

    public QualityReport(String source, int rowCount, Map<String, CheckResult> checks) {
        this.source = source;
        this.rowCount = rowCount;
        this.checks = Collections.unmodifiableMap(new LinkedHashMap<>(checks));

        List<String> all = new ArrayList<>();
        boolean ok = true;
        for (CheckResult result : checks.values()) {
            if (!result.isPassed()) {
                ok = false;
                all.addAll(result.getViolations());
            }
        }
        this.passed = ok;
        this.violations = Collections.unmodifiableList(all);
    }

    public String getSource() { return source; }
    public int getRowCount() { return rowCount; }
    public Map<String, CheckResult> getChecks() { return checks; }
    public boolean isPassed() { return passed; }
    public List<String> getViolations() { return violations; }

    /** Multi-line, human-readable rendering for logs and CLI output. */
    public String render() {
        String nl = System.lineSeparator();
        StringBuilder sb = new StringBuilder();
        sb.append(RULE).append(nl)
                .append("DATA QUALITY CHECK RESULTS").append(nl)
                .append(RULE).append(nl)
                .append("Source: ").append(source).append(nl)
                .append(String.format("Rows: %,d", rowCount)).append(nl)
                .append(nl)
                .append("Overall Status: ").append(passed ? "PASSED" : "FAILED").append(nl)
                .append(nl)
                .append("Check Details:").append(nl);

        for (Map.Entry<String, CheckResult> entry : checks.entrySet()) {
            CheckResult result = entry.getValue();
            sb.append("  [").append(result.isPassed() ? "PASS" : "FAIL").append("] ")
                    .append(entry.getKey()).append(nl);
            if (!result.isPassed()) {
                for (String violation : result.getViolations()) {
                    sb.append("    - ").append(violation).append(nl);
                }
            } else if (result.getMessage() != null) {
                sb.append("    ").append(result.getMessage()).append(nl);
            }
        }

        if (!violations.isEmpty()) {
            sb.append(nl).append("All Violations:").append(nl);
            for (int i = 0; i < violations.size(); i++) {
                sb.append("  ").append(i + 1).append(". ").append(violations.get(i)).append(nl);
            }
        }
        sb.append(RULE);
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof QualityReport)) return false;
        QualityReport that = (QualityReport) o;
        return rowCount == that.rowCount
                && passed == that.passed
                && Objects.equals(source, that.source)
                && checks.equals(that.checks)
                && violations.equals(that.violations);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, rowCount, checks, passed, violations);
    }

    @Override
    public String toString() {
        return String.format("QualityReport{passed=%b, rows=%d, violations=%d}",
                passed, rowCount, violations.size());
    }
}
