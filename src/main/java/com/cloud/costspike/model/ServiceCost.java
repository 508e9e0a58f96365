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
@Schema(description = "Anomalous spend attributed to one service")
public class ServiceCost {

    @Schema(description = "Service identifier", example = "EC2")
    private String service;

    @JsonProperty("anomalous_cost")
    @Schema(description = "Sum of cost over this service's spike rows", example = "40.0")
    private double anomalousCost;
}
