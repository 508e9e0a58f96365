package com.cloud.costspike.service;

import com.cloud.costspike.config.MetricsConfig;
import com.cloud.costspike.engine.CostSpikeDetector;
import com.cloud.costspike.engine.InputNormalizer;
import com.cloud.costspike.exception.CostDataException;
import com.cloud.costspike.model.CostRecord;
import com.cloud.costspike.model.DetectionReport;
import com.cloud.costspike.model.ExplanationSummary;
import com.cloud.costspike.model.RawCostTable;
import com.cloud.costspike.model.ScoredRecord;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.InputStream;
import java.util.List;

/**
 * Entry point for the HTTP layer: raw table in, scored rows plus explanation out.
 */
@Service
public class CostSpikeDetectionService {

    private static final Logger log = LoggerFactory.getLogger(CostSpikeDetectionService.class);

    private final CsvCostTableReader csvReader;
    private final CostSpikeDetector detector;
    private final MetricsConfig metricsConfig;
    private final InputNormalizer normalizer = new InputNormalizer();

    public CostSpikeDetectionService(CsvCostTableReader csvReader,
                                     CostSpikeDetector detector,
                                     MetricsConfig metricsConfig) {
        this.csvReader = csvReader;
        this.detector = detector;
        this.metricsConfig = metricsConfig;
    }

    @Observed(name = "cost.detect.csv", contextualName = "detect-cost-spikes-csv")
    public DetectionReport detectCsv(InputStream csv) {
        RawCostTable table;
        try {
            table = csvReader.read(csv);
        } catch (CostDataException e) {
            metricsConfig.recordRejected(e.getKind().name());
            throw e;
        }
        return runDetection(table);
    }

    @Observed(name = "cost.detect", contextualName = "detect-cost-spikes")
    public DetectionReport detect(RawCostTable table) {
        return runDetection(table);
    }

    // Both entry points land here; each is observed once under its own name
    private DetectionReport runDetection(RawCostTable table) {
        try {
            List<CostRecord> records = normalizer.normalize(table);
            List<ScoredRecord> scored = detector.detect(records);
            ExplanationSummary explanation = detector.explain(scored);

            DetectionReport report = DetectionReport.builder()
                    .scored(scored)
                    .explanation(explanation)
                    .build();

            int anomalyCount = report.anomalies().size();
            log.info("Detected {} spikes in {} rows across {} services (anomalous cost {})",
                    anomalyCount, report.totalRows(), countServices(records),
                    explanation.getTotalAnomalousCost());
            metricsConfig.recordDetection(report.totalRows(), anomalyCount, explanation.getTotalAnomalousCost());
            return report;
        } catch (CostDataException e) {
            log.warn("Rejected cost table ({} rows): {}", table == null ? 0 : table.rowCount(), e.getMessage());
            metricsConfig.recordRejected(e.getKind().name());
            throw e;
        }
    }

    private static long countServices(List<CostRecord> records) {
        return records.stream().map(CostRecord::getService).distinct().count();
    }
}
