package io.quakeflow.functions;

import io.quakeflow.models.FeatureRow;
import io.quakeflow.utils.TimeUtils;

import java.util.List;

/**
 * Hours since the previous event and the magnitudes of the previous three
 * events. The first row gets time_since_last = 0; a lag with too little
 * history stays null. Only earlier rows are read.
 */
public class LagFeatureFunction implements FeatureFunction {

    @Override
    public void apply(List<FeatureRow> rows) {
        for (int i = 0; i < rows.size(); i++) {
            FeatureRow row = rows.get(i);
            row.setTimeSinceLast(i == 0
                    ? 0.0
                    : TimeUtils.hoursBetween(rows.get(i - 1).getTime(), row.getTime()));
            row.setMagLag1(lag(rows, i, 1));
            row.setMagLag2(lag(rows, i, 2));
            row.setMagLag3(lag(rows, i, 3));
        }
    }

    private static Double lag(List<FeatureRow> rows, int index, int k) {
        return index >= k ? rows.get(index - k).getMagnitude() : null;
    }
}
