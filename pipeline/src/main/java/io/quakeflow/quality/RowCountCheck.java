package io.quakeflow.quality;

import io.quakeflow.models.CheckResult;
import io.quakeflow.models.RawDataset;

import java.util.List;

public class RowCountCheck implements QualityCheck {

    public static final String NAME = "row_count";

    private final int minRows;

    public RowCountCheck(int minRows) {
        this.minRows = minRows;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public CheckResult run(RawDataset dataset) {
        int count = dataset.size();
        if (count < minRows) {
            return CheckResult.of(List.of(String.format(
                    "Row count (%d) is below minimum threshold (%d)", count, minRows)));
        }
        return CheckResult.passed(String.format("Row count check passed: %d rows", count));
    }
}
