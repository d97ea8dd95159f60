package io.quakeflow.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One seismic occurrence flattened from a GeoJSON feature.
 * Core attributes are boxed: a missing value stays null until cleaning.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Event {

    @JsonProperty("id")
    private String id;

    @JsonProperty("magnitude")
    private Double magnitude;

    @JsonProperty("time")
    private Long time; // epoch millis, UTC

    @JsonProperty("place")
    private String place;

    @JsonProperty("longitude")
    private Double longitude;

    @JsonProperty("latitude")
    private Double latitude;

    @JsonProperty("depth")
    private Double depth;

    @JsonProperty("mag_type")
    private String magType;

    @JsonProperty("event_type")
    private String eventType;

    @JsonProperty("status")
    private String status;

    @JsonProperty("tsunami")
    private int tsunami;

    @JsonProperty("significance")
    private Integer significance;

    @JsonProperty("gap")
    private Double gap;

    @JsonProperty("dmin")
    private Double dmin;

    @JsonProperty("rms")
    private Double rms;

    @JsonProperty("nst")
    private Integer nst;

    public Event() {}

    // Getters
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

    // Setters
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

    public boolean hasCoreAttributes() {
        return magnitude != null && time != null && longitude != null && latitude != null;
    }

    @Override
    public String toString() {
        return String.format("Event{id=%s, mag=%s, time=%s, lon=%s, lat=%s, depth=%s}",
                id, magnitude, time, longitude, latitude, depth);
    }
}
