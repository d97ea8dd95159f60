package io.quakeflow.serialization;

import io.quakeflow.models.FeatureRow;
import org.apache.avro.LogicalTypes;
import org.apache.avro.Schema;
import org.apache.avro.SchemaBuilder;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;

/**
 * Avro schema of the feature table written to Parquet.
 * Field order matches {@link FeatureRow#COLUMNS}.
 */
public final class FeatureSchema {

    private FeatureSchema() {}

    public static final Schema FEATURE_ROW_SCHEMA;

    static {
        Schema timestampMillis = LogicalTypes.timestampMillis().addToSchema(Schema.create(Schema.Type.LONG));

        FEATURE_ROW_SCHEMA = SchemaBuilder.record("FeatureRow")
                .namespace("io.quakeflow")
                .fields()
                // Event
                .requiredString("id")
                .requiredDouble("magnitude")
                .name("time").type(timestampMillis).noDefault()
                .requiredString("place")
                .requiredDouble("longitude")
                .requiredDouble("latitude")
                .optionalDouble("depth")
                .requiredString("mag_type")
                .requiredString("event_type")
                .requiredString("status")
                .requiredInt("tsunami")
                .optionalInt("significance")
                .optionalDouble("gap")
                .optionalDouble("dmin")
                .optionalDouble("rms")
                .optionalInt("nst")
                // Calendar
                .requiredInt("year")
                .requiredInt("month")
                .requiredInt("day")
                .requiredInt("hour")
                .requiredInt("day_of_week")
                .requiredInt("day_of_year")
                .requiredInt("week_of_year")
                // Cyclical
                .requiredDouble("hour_sin")
                .requiredDouble("hour_cos")
                .requiredDouble("month_sin")
                .requiredDouble("month_cos")
                .requiredDouble("day_of_week_sin")
                .requiredDouble("day_of_week_cos")
                // Lag
                .requiredDouble("time_since_last")
                .optionalDouble("mag_lag1")
                .optionalDouble("mag_lag2")
                .optionalDouble("mag_lag3")
                // Rolling
                .requiredDouble("mag_rolling_24h")
                .requiredDouble("mag_rolling_7d")
                .requiredDouble("mag_rolling_30d")
                .requiredInt("count_rolling_24h")
                .requiredInt("count_rolling_7d")
                .optionalDouble("mag_std_24h")
                // Location
                .requiredDouble("abs_latitude")
                .requiredInt("pacific_ring")
                .endRecord();
    }

    public static GenericRecord toRecord(FeatureRow row) {
        GenericRecord record = new GenericData.Record(FEATURE_ROW_SCHEMA);
        record.put("id", nonNull(row.getId()));
        record.put("magnitude", row.getMagnitude());
        record.put("time", row.getTime());
        record.put("place", nonNull(row.getPlace()));
        record.put("longitude", row.getLongitude());
        record.put("latitude", row.getLatitude());
        record.put("depth", row.getDepth());
        record.put("mag_type", nonNull(row.getMagType()));
        record.put("event_type", nonNull(row.getEventType()));
        record.put("status", nonNull(row.getStatus()));
        record.put("tsunami", row.getTsunami());
        record.put("significance", row.getSignificance());
        record.put("gap", row.getGap());
        record.put("dmin", row.getDmin());
        record.put("rms", row.getRms());
        record.put("nst", row.getNst());
        record.put("year", row.getYear());
        record.put("month", row.getMonth());
        record.put("day", row.getDay());
        record.put("hour", row.getHour());
        record.put("day_of_week", row.getDayOfWeek());
        record.put("day_of_year", row.getDayOfYear());
        record.put("week_of_year", row.getWeekOfYear());
        record.put("hour_sin", row.getHourSin());
        record.put("hour_cos", row.getHourCos());
        record.put("month_sin", row.getMonthSin());
        record.put("month_cos", row.getMonthCos());
        record.put("day_of_week_sin", row.getDayOfWeekSin());
        record.put("day_of_week_cos", row.getDayOfWeekCos());
        record.put("time_since_last", row.getTimeSinceLast());
        record.put("mag_lag1", row.getMagLag1());
        record.put("mag_lag2", row.getMagLag2());
        record.put("mag_lag3", row.getMagLag3());
        record.put("mag_rolling_24h", row.getMagRolling24h());
        record.put("mag_rolling_7d", row.getMagRolling7d());
        record.put("mag_rolling_30d", row.getMagRolling30d());
        record.put("count_rolling_24h", row.getCountRolling24h());
        record.put("count_rolling_7d", row.getCountRolling7d());
        record.put("mag_std_24h", row.getMagStd24h());
        record.put("abs_latitude", row.getAbsLatitude());
        record.put("pacific_ring", row.getPacificRing());
        return record;
    }

    private static String nonNull(String value) {
        return value == null ? "" : value;
    }
}
