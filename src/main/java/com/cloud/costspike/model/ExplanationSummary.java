package com.cloud.costspike.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Business-facing summary of the detected spikes")
public class ExplanationSummary {

    @JsonProperty("top_services")
    @Schema(description = "Up to 5 services ranked by anomalous spend, descending")
    @Builder.Default
    private List<ServiceCost> topServices = new ArrayList<>();

    @JsonProperty("total_anomalous_cost")
    @Schema(description = "Cost summed over every spike row, not only the top services", example = "40.0")
    private double totalAnomalousCost;

    public static ExplanationSummary empty() {
        return ExplanationSummary.builder()
                .topServices(new ArrayList<>())
                .totalAnomalousCost(0.0)
                .build();
    }
}
