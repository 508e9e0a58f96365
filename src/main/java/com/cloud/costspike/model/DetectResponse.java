package com.cloud.costspike.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Spike rows found in an uploaded billing file")
public class DetectResponse {

    @Schema(description = "Rows flagged as spikes, in service then date order")
    private List<AnomalyPoint> anomalies;

    @JsonProperty("total_rows")
    @Schema(description = "Number of rows scored", example = "8")
    private int totalRows;

    @JsonProperty("total_anomalies")
    @Schema(description = "Number of spike rows", example = "1")
    private int totalAnomalies;
}
