package io.quakeflow.quality;

import io.quakeflow.models.CheckResult;
import io.quakeflow.models.RawDataset;

import java.util.List;

/**
 * One independently reportable check in the quality gate.
 * Implementations must not mutate the dataset.
 */
public interface QualityCheck {

    /** Core attributes every dataset must carry. */
    List<String> CORE_COLUMNS = List.of("magnitude", "time", "longitude", "latitude");

    String name();

    CheckResult run(RawDataset dataset);

    /** Null, or a floating-point NaN (how columnar readers encode missing). */
    static boolean isMissing(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof Double) {
            return ((Double) value).isNaN();
        }
        if (value instanceof Float) {
            return ((Float) value).isNaN();
        }
        return false;
    }
}
