package com.whalewatch.cli;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Answers collected during one interactive session, written as JSON when a
 * report path is configured.
 *
 * <p>
 * Fields stay {@code null} for the steps the user skipped and are then left
 * out of the JSON.
 * </p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SessionReport {

    private Instant generatedAt = Instant.now();
    private Integer month;
    private Double peakLatitude;
    private Double peakLongitude;
    private Integer peakCount;
    private Double latitude;
    private Double longitude;
    private Double encounterProbability;
    private String mostLikelyPod;
    private Map<String, Double> podProbabilities;
    private Double expectedWaitHours;
    private final List<WaitQuery> waitQueries = new ArrayList<>();

    public Instant getGeneratedAt() {
        return generatedAt;
    }

    public void setGeneratedAt(Instant generatedAt) {
        this.generatedAt = generatedAt;
    }

    public Integer getMonth() {
        return month;
    }

    public void setMonth(Integer month) {
        this.month = month;
    }

    public Double getPeakLatitude() {
        return peakLatitude;
    }

    public Double getPeakLongitude() {
        return peakLongitude;
    }

    public Integer getPeakCount() {
        return peakCount;
    }

    public void setPeak(double latitude, double longitude, int count) {
        this.peakLatitude = latitude;
        this.peakLongitude = longitude;
        this.peakCount = count;
    }

    public Double getLatitude() {
        return latitude;
    }

    public Double getLongitude() {
        return longitude;
    }

    public void setLocation(double latitude, double longitude) {
        this.latitude = latitude;
        this.longitude = longitude;
    }

    public Double getEncounterProbability() {
        return encounterProbability;
    }

    public void setEncounterProbability(Double encounterProbability) {
        this.encounterProbability = encounterProbability;
    }

    public String getMostLikelyPod() {
        return mostLikelyPod;
    }

    public void setMostLikelyPod(String mostLikelyPod) {
        this.mostLikelyPod = mostLikelyPod;
    }

    public Map<String, Double> getPodProbabilities() {
        return podProbabilities;
    }

    public void setPodProbabilities(Map<String, Double> podProbabilities) {
        this.podProbabilities = podProbabilities != null ? new LinkedHashMap<>(podProbabilities) : null;
    }

    public Double getExpectedWaitHours() {
        return expectedWaitHours;
    }

    public void setExpectedWaitHours(Double expectedWaitHours) {
        this.expectedWaitHours = expectedWaitHours;
    }

    public List<WaitQuery> getWaitQueries() {
        return Collections.unmodifiableList(waitQueries);
    }

    public void addWaitQuery(double hours, double probability) {
        waitQueries.add(new WaitQuery(hours, probability));
    }

    /** One waiting-time question and its tail probability. */
    public static class WaitQuery {
        private final double hours;
        private final double probability;

        public WaitQuery(double hours, double probability) {
            this.hours = hours;
            this.probability = probability;
        }

        public double getHours() {
            return hours;
        }

        public double getProbability() {
            return probability;
        }
    }
}
