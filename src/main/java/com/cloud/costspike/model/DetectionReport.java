package com.cloud.costspike.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Result of one detection run: every scored row plus the explanation built from them.
 */
@Value
@Builder
public class DetectionReport {

    List<ScoredRecord> scored;
    ExplanationSummary explanation;

    public List<ScoredRecord> anomalies() {
        return scored.stream().filter(ScoredRecord::isAnomaly).toList();
    }

    public int totalRows() {
        return scored.size();
    }

    public DetectResponse toDetectResponse() {
        List<AnomalyPoint> points = anomalies().stream().map(AnomalyPoint::from).toList();
        return DetectResponse.builder()
                .anomalies(points)
                .totalRows(totalRows())
                .totalAnomalies(points.size())
                .build();
    }

    public SummaryResponse toSummaryResponse() {
        return SummaryResponse.builder()
                .totalRows(totalRows())
                .totalAnomalies(anomalies().size())
                .explanation(explanation)
                .build();
    }
}
