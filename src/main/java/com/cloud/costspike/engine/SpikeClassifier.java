package com.cloud.costspike.engine;

import com.cloud.costspike.model.FeaturizedRecord;
import com.cloud.costspike.model.ScoredRecord;

/**
 * Keeps only upward moves among the ensemble's picks. Drops in spend are often just as
 * "isolated" as spikes, but they are not what anyone is paged for.
 */
public class SpikeClassifier {

    public ScoredRecord classify(FeaturizedRecord record, double anomalyScore, boolean ensembleFlagged) {
        return ScoredRecord.builder()
                .features(record)
                .anomalyScore(anomalyScore)
                .ensembleFlagged(ensembleFlagged)
                .anomaly(ensembleFlagged && isSpike(record))
                .build();
    }

    /**
     * Above the rolling baseline and up versus the previous row of the same service.
     */
    public boolean isSpike(FeaturizedRecord record) {
        return record.getCostVsRollMean() > 0 && record.getPctChange() > 0;
    }
}
