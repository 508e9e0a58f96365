package com.cloud.costspike.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
public class ScoredRecord {

    FeaturizedRecord features;

    // 2^(-E[h(x)] / c(psi)); closer to 1 = isolated faster = more anomalous
    double anomalyScore;

    // Ranked in the batch's top contamination fraction, before the direction check
    boolean ensembleFlagged;

    // Ensemble-flagged AND an upward move against both the rolling mean and the previous day
    boolean anomaly;

    public LocalDate getDate() { return features.getDate(); }
    public String getService() { return features.getService(); }
    public double getCost() { return features.getCost(); }
    public double getPctChange() { return features.getPctChange(); }
    public Double getRollingMean7() { return features.getRollingMean7(); }
    public double getCostVsRollMean() { return features.getCostVsRollMean(); }
}
