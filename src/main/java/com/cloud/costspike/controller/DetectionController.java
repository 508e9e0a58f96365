package com.cloud.costspike.controller;

import com.cloud.costspike.model.DetectResponse;
import com.cloud.costspike.model.RawCostTable;
import com.cloud.costspike.model.SummaryResponse;
import com.cloud.costspike.service.CostSpikeDetectionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;

@RestController
@RequestMapping("/api/v1/detect")
@Tag(name = "Detection", description = "Upload billing data and get cost spikes back")
public class DetectionController {

    private final CostSpikeDetectionService detectionService;

    public DetectionController(CostSpikeDetectionService detectionService) {
        this.detectionService = detectionService;
    }

    @Operation(summary = "Detect cost spikes in a billing CSV",
            description = "Accepts a CSV with date, service and cost columns (case-insensitive). " +
                    "Every row is scored by an Isolation Forest trained on the upload itself; " +
                    "only rows that are both flagged and upward moves are returned.")
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<DetectResponse> detect(
            @Parameter(description = "Billing CSV file")
            @RequestParam("file") MultipartFile file) throws IOException {
        try (InputStream in = file.getInputStream()) {
            return ResponseEntity.ok(detectionService.detectCsv(in).toDetectResponse());
        }
    }

    @Operation(summary = "Summarize cost spikes in a billing CSV",
            description = "Same detection as POST /api/v1/detect, returned as row counts plus the top 5 " +
                    "services by anomalous spend and the total anomalous cost.")
    @PostMapping(value = "/summary", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<SummaryResponse> detectSummary(
            @Parameter(description = "Billing CSV file")
            @RequestParam("file") MultipartFile file) throws IOException {
        try (InputStream in = file.getInputStream()) {
            return ResponseEntity.ok(detectionService.detectCsv(in).toSummaryResponse());
        }
    }

    @Operation(summary = "Detect cost spikes in already-parsed rows",
            description = "JSON variant of POST /api/v1/detect for callers that hold the table in memory.")
    @PostMapping(value = "/records", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<DetectResponse> detectRecords(@RequestBody RawCostTable table) {
        return ResponseEntity.ok(detectionService.detect(table).toDetectResponse());
    }
}
