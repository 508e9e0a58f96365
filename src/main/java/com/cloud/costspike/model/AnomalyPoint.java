package com.cloud.costspike.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A billing row flagged as a cost spike")
public class AnomalyPoint {

    @Schema(description = "Billing date (ISO-8601)", example = "2025-01-08")
    private String date;

    @Schema(description = "Service identifier", example = "EC2")
    private String service;

    @Schema(description = "Cost on that date", example = "40.0")
    private double cost;

    @JsonProperty("anomaly_score")
    @Schema(description = "Isolation Forest score in (0, 1]; higher is more anomalous", example = "0.71")
    private double anomalyScore;

    @JsonProperty("cost_pct_change")
    @Schema(description = "Fractional change versus the previous row of the same service", example = "3.0")
    private double costPctChange;

    @JsonProperty("cost_rolling_mean_7")
    @JsonInclude(JsonInclude.Include.ALWAYS)
    @Schema(description = "Trailing 7-row mean cost; null while history is too short", example = "14.29", nullable = true)
    private Double costRollingMean7;

    public static AnomalyPoint from(ScoredRecord record) {
        return AnomalyPoint.builder()
                .date(record.getDate().toString())
                .service(record.getService())
                .cost(record.getCost())
                .anomalyScore(record.getAnomalyScore())
                .costPctChange(record.getPctChange())
                .costRollingMean7(record.getRollingMean7())
                .build();
    }
}
