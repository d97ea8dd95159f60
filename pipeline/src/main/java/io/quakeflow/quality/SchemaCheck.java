package io.quakeflow.quality;

import io.quakeflow.models.CheckResult;
import io.quakeflow.models.RawDataset;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Verifies that core columns exist and hold numbers: magnitude, longitude and
 * latitude must be float-compatible, time must be an integral epoch value.
 * Missing values are left to {@link NullRatioCheck}.
 */
public class SchemaCheck implements QualityCheck {

    public static final String NAME = "schema";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public CheckResult run(RawDataset dataset) {
        List<String> violations = new ArrayList<>();

        List<String> missingColumns = new ArrayList<>();
        for (String column : CORE_COLUMNS) {
            if (!dataset.hasColumn(column)) {
                missingColumns.add(column);
            }
        }
        if (!missingColumns.isEmpty()) {
            violations.add("Missing required columns: " + missingColumns);
        }

        for (String column : CORE_COLUMNS) {
            if (!dataset.hasColumn(column)) {
                continue;
            }
            boolean integral = column.equals("time");
            long bad = 0;
            Object firstBad = null;
            for (Object value : dataset.column(column)) {
                if (QualityCheck.isMissing(value)) {
                    continue;
                }
                boolean ok = integral ? isIntegral(value) : value instanceof Number;
                if (!ok) {
                    bad++;
                    if (firstBad == null) {
                        firstBad = value;
                    }
                }
            }
            if (bad > 0) {
                violations.add(String.format("Column '%s' has %d value(s) of wrong type (first: %s '%s'), expected %s",
                        column, bad, firstBad.getClass().getSimpleName(), firstBad,
                        integral ? "integer epoch milliseconds" : "float"));
            }
        }
        return CheckResult.of(violations);
    }

    static boolean isIntegral(Object value) {
        if (value instanceof Long || value instanceof Integer
                || value instanceof Short || value instanceof Byte
                || value instanceof BigInteger) {
            return true;
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).stripTrailingZeros().scale() <= 0;
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            return !Double.isInfinite(d) && d == Math.rint(d);
        }
        return false;
    }
}
