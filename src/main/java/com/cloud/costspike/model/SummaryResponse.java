package com.cloud.costspike.model;

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
@Schema(description = "Row counts plus the per-service explanation of detected spikes")
public class SummaryResponse {

    @JsonProperty("total_rows")
    @Schema(description = "Number of rows scored", example = "8")
    private int totalRows;

    @JsonProperty("total_anomalies")
    @Schema(description = "Number of spike rows", example = "1")
    private int totalAnomalies;

    @Schema(description = "Top services by anomalous spend and the overall anomalous total")
    private ExplanationSummary explanation;
}
