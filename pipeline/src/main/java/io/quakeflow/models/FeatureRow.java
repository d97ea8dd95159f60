package io.quakeflow.models;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One row of the feature table: the cleaned event fields plus calendar,
 * cyclical, lag, rolling-window and location features.
 * Lag values and the 24h standard deviation stay null when history is
 * insufficient.
 */
public class FeatureRow {

    /** Column names in output order. Matches {@code FeatureSchema}. */
    public static final List<String> COLUMNS = List.of(
            "id", "magnitude", "time", "place", "longitude", "latitude", "depth",
            "mag_type", "event_type", "status", "tsunami", "significance",
            "gap", "dmin", "rms", "nst",
            "year", "month", "day", "hour", "day_of_week", "day_of_year", "week_of_year",
            "hour_sin", "hour_cos", "month_sin", "month_cos", "day_of_week_sin", "day_of_week_cos",
            "time_since_last", "mag_lag1", "mag_lag2", "mag_lag3",
            "mag_rolling_24h", "mag_rolling_7d", "mag_rolling_30d",
            "count_rolling_24h", "count_rolling_7d", "mag_std_24h",
            "abs_latitude", "pacific_ring");

    // Event fields
    @JsonProperty("id") private String id;
    @JsonProperty("magnitude") private Double magnitude;
    @JsonProperty("time") private Long time;
    @JsonProperty("place") private String place;
    @JsonProperty("longitude") private Double longitude;
    @JsonProperty("latitude") private Double latitude;
    @JsonProperty("depth") private Double depth;
    @JsonProperty("mag_type") private String magType;
    @JsonProperty("event_type") private String eventType;
    @JsonProperty("status") private String status;
    @JsonProperty("tsunami") private int tsunami;
    @JsonProperty("significance") private Integer significance;
    @JsonProperty("gap") private Double gap;
    @JsonProperty("dmin") private Double dmin;
    @JsonProperty("rms") private Double rms;
    @JsonProperty("nst") private Integer nst;

    // Calendar
    @JsonProperty("year") private int year;
    @JsonProperty("month") private int month;
    @JsonProperty("day") private int day;
    @JsonProperty("hour") private int hour;
    @JsonProperty("day_of_week") private int dayOfWeek; // 0 = Monday
    @JsonProperty("day_of_year") private int dayOfYear;
    @JsonProperty("week_of_year") private int weekOfYear; // ISO week

    // Cyclical encodings
    @JsonProperty("hour_sin") private double hourSin;
    @JsonProperty("hour_cos") private double hourCos;
    @JsonProperty("month_sin") private double monthSin;
    @JsonProperty("month_cos") private double monthCos;
    @JsonProperty("day_of_week_sin") private double dayOfWeekSin;
    @JsonProperty("day_of_week_cos") private double dayOfWeekCos;

    // Lag
    @JsonProperty("time_since_last") private double timeSinceLast; // hours
    @JsonProperty("mag_lag1") private Double magLag1;
    @JsonProperty("mag_lag2") private Double magLag2;
    @JsonProperty("mag_lag3") private Double magLag3;

    // Rolling windows
    @JsonProperty("mag_rolling_24h") private double magRolling24h;
    @JsonProperty("mag_rolling_7d") private double magRolling7d;
    @JsonProperty("mag_rolling_30d") private double magRolling30d;
    @JsonProperty("count_rolling_24h") private int countRolling24h;
    @JsonProperty("count_rolling_7d") private int countRolling7d;
    @JsonProperty("mag_std_24h") private Double magStd24h;

    // Location
    @JsonProperty("abs_latitude") private double absLatitude;
    @JsonProperty("pacific_ring") private int pacificRing;

    public FeatureRow() {}

    public static FeatureRow fromEvent(Event event) {
        FeatureRow row = new FeatureRow();
        row.id = event.getId();
        row.magnitude = event.getMagnitude();
        row.time = event.getTime();
        row.place = event.getPlace();
        row.longitude = event.getLongitude();
        row.latitude = event.getLatitude();
        row.depth = event.getDepth();
        row.magType = event.getMagType();
        row.eventType = event.getEventType();
        row.status = event.getStatus();
        row.tsunami = event.getTsunami();
        row.significance = event.getSignificance();
        row.gap = event.getGap();
        row.dmin = event.getDmin();
        row.rms = event.getRms();
        row.nst = event.getNst();
        return row;
    }

    public boolean hasCoreAttributes() {
        return magnitude != null && time != null && longitude != null && latitude != null;
    }

    /**
     * Numeric value of a column by name, or null when the column is null or
     * not numeric.
     */
    public Double numericValue(String column) {
        switch (column) {
            case "magnitude": return magnitude;
            case "time": return time == null ? null : time.doubleValue();
            case "longitude": return longitude;
            case "latitude": return latitude;
            case "depth": return depth;
            case "tsunami": return (double) tsunami;
            case "significance": return significance == null ? null : significance.doubleValue();
            case "gap": return gap;
            case "dmin": return dmin;
            case "rms": return rms;
            case "nst": return nst == null ? null : nst.doubleValue();
            case "year": return (double) year;
            case "month": return (double) month;
            case "day": return (double) day;
            case "hour": return (double) hour;
            case "day_of_week": return (double) dayOfWeek;
            case "day_of_year": return (double) dayOfYear;
            case "week_of_year": return (double) weekOfYear;
            case "hour_sin": return hourSin;
            case "hour_cos": return hourCos;
            case "month_sin": return monthSin;
            case "month_cos": return monthCos;
            case "day_of_week_sin": return dayOfWeekSin;
            case "day_of_week_cos": return dayOfWeekCos;
            case "time_since_last": return timeSinceLast;
            case "mag_lag1": return magLag1;
            case "mag_lag2": return magLag2;
            case "mag_lag3": return magLag3;
            case "mag_rolling_24h": return magRolling24h;
            case "mag_rolling_7d": return magRolling7d;
            case "mag_rolling_30d": return magRolling30d;
            case "count_rolling_24h": return (double) countRolling24h;
            case "count_rolling_7d": return (double) countRolling7d;
            case "mag_std_24h": return magStd24h;
            case "abs_latitude": return absLatitude;
            case "pacific_ring": return (double) pacificRing;
            default: return null;
        }
    }

    // --- Getters ---
    public String getId() { return id; }
    public Double getMagnitude() { return magnitude; }
    public Long getTime() { return time; }
    public String getPlace() { return place; }
    public Double getLongitude() { return longitude; }
    public Double getLatitude() { return latitude; }
    public Double getDepth() { return depth; }
    public String getMagType() { return magType; }
    public String getEventType() { return eventType; }
    public String getStatus() { return status; }
    public int getTsunami() { return tsunami; }
    public Integer getSignificance() { return significance; }
    public Double getGap() { return gap; }
    public Double getDmin() { return dmin; }
    public Double getRms() { return rms; }
    public Integer getNst() { return nst; }
    public int getYear() { return year; }
    public int getMonth() { return month; }
    public int getDay() { return day; }
    public int getHour() { return hour; }
    public int getDayOfWeek() { return dayOfWeek; }
    public int getDayOfYear() { return dayOfYear; }
    public int getWeekOfYear() { return weekOfYear; }
    public double getHourSin() { return hourSin; }
    public double getHourCos() { return hourCos; }
    public double getMonthSin() { return monthSin; }
    public double getMonthCos() { return monthCos; }
    public double getDayOfWeekSin() { return dayOfWeekSin; }
    public double getDayOfWeekCos() { return dayOfWeekCos; }
    public double getTimeSinceLast() { return timeSinceLast; }
    public Double getMagLag1() { return magLag1; }
    public Double getMagLag2() { return magLag2; }
    public Double getMagLag3() { return magLag3; }
    public double getMagRolling24h() { return magRolling24h; }
    public double getMagRolling7d() { return magRolling7d; }
    public double getMagRolling30d() { return magRolling30d; }
    public int getCountRolling24h() { return countRolling24h; }
    public int getCountRolling7d() { return countRolling7d; }
    public Double getMagStd24h() { return magStd24h; }
    public double getAbsLatitude() { return absLatitude; }
    public int getPacificRing() { return pacificRing; }

    // --- Setters ---
    public void setId(String id) { this.id = id; }
    public void setMagnitude(Double magnitude) { this.magnitude = magnitude; }
    public void setTime(Long time) { this.time = time; }
    public void setPlace(String place) { this.place = place; }
    public void setLongitude(Double longitude) { this.longitude = longitude; }
    public void setLatitude(Double latitude) { this.latitude = latitude; }
    public void setDepth(Double depth) { this.depth = depth; }
    public void setMagType(String magType) { this.magType = magType; }
    public void setEventType(String eventType) { this.eventType = eventType; }
    public void setStatus(String status) { this.status = status; }
    public void setTsunami(int tsunami) { this.tsunami = tsunami; }
    public void setSignificance(Integer significance) { this.significance = significance; }
    public void setGap(Double gap) { this.gap = gap; }
    public void setDmin(Double dmin) { this.dmin = dmin; }
    public void setRms(Double rms) { this.rms = rms; }
    public void setNst(Integer nst) { this.nst = nst; }
    public void setYear(int year) { this.year = year; }
    public void setMonth(int month) { this.month = month; }
    public void setDay(int day) { this.day = day; }
    public void setHour(int hour) { this.hour = hour; }
    public void setDayOfWeek(int dayOfWeek) { this.dayOfWeek = dayOfWeek; }
    public void setDayOfYear(int dayOfYear) { this.dayOfYear = dayOfYear; }
    public void setWeekOfYear(int weekOfYear) { this.weekOfYear = weekOfYear; }
    public void setHourSin(double hourSin) { this.hourSin = hourSin; }
    public void setHourCos(double hourCos) { this.hourCos = hourCos; }
    public void setMonthSin(double monthSin) { this.monthSin = monthSin; }
    public void setMonthCos(double monthCos) { this.monthCos = monthCos; }
    public void setDayOfWeekSin(double dayOfWeekSin) { this.dayOfWeekSin = dayOfWeekSin; }
    public void setDayOfWeekCos(double dayOfWeekCos) { this.dayOfWeekCos = dayOfWeekCos; }
    public void setTimeSinceLast(double timeSinceLast) { this.timeSinceLast = timeSinceLast; }
    public void setMagLag1(Double magLag1) { this.magLag1 = magLag1; }
    public void setMagLag2(Double magLag2) { this.magLag2 = magLag2; }
    public void setMagLag3(Double magLag3) { this.magLag3 = magLag3; }
    public void setMagRolling24h(double magRolling24h) { this.magRolling24h = magRolling24h; }
    public void setMagRolling7d(double magRolling7d) { this.magRolling7d = magRolling7d; }
    public void setMagRolling30d(double magRolling30d) { this.magRolling30d = magRolling30d; }
    public void setCountRolling24h(int countRolling24h) { this.countRolling24h = countRolling24h; }
    public void setCountRolling7d(int countRolling7d) { this.countRolling7d = countRolling7d; }
    public void setMagStd24h(Double magStd24h) { this.magStd24h = magStd24h; }
    public void setAbsLatitude(double absLatitude) { this.absLatitude = absLatitude; }
    public void setPacificRing(int pacificRing) { this.pacificRing = pacificRing; }

    @Override
    public String toString() {
        return String.format("FeatureRow{id=%s, time=%s, mag=%s, lag1=%s, roll24h=%.3f}",
                id, time, magnitude, magLag1, magRolling24h);
    }
}
