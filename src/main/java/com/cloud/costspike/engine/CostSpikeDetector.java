package com.cloud.costspike.engine;

import com.cloud.costspike.config.DetectionConfig;
import com.cloud.costspike.engine.isolationforest.ContaminationThreshold;
import com.cloud.costspike.engine.isolationforest.IsolationForest;
import com.cloud.costspike.model.CostRecord;
import com.cloud.costspike.model.ExplanationSummary;
import com.cloud.costspike.model.FeaturizedRecord;
import com.cloud.costspike.model.ScoredRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * The detection pipeline over one in-memory batch.
 *
 * Flow:
 * 1. Derive calendar and rolling features per service
 * 2. Train an Isolation Forest on the batch's feature vectors and score every row
 * 3. Flag the top contamination fraction of scores
 * 4. Keep only flagged rows that are upward moves (spikes)
 *
 * Each call builds its own forest; the result depends only on the input and the seed.
 * Errors propagate as-is and no partial result is returned.
 */
@Component
public class CostSpikeDetector {

    private static final Logger log = LoggerFactory.getLogger(CostSpikeDetector.class);

    private final DetectionConfig config;
    private final FeatureBuilder featureBuilder;
    private final SpikeClassifier spikeClassifier;
    private final Explainer explainer;

    public CostSpikeDetector(DetectionConfig config) {
        this.config = config;
        this.featureBuilder = new FeatureBuilder(config.getRollingWindow(), config.getRollingMinPeriods());
        this.spikeClassifier = new SpikeClassifier();
        this.explainer = new Explainer(config.getTopServices());
    }

    /**
     * Score every record. Output has one entry per input record, in input order.
     */
    public List<ScoredRecord> detect(List<CostRecord> records) {
        List<FeaturizedRecord> featurized = featureBuilder.build(records);

        double[][] matrix = new double[featurized.size()][];
        for (int i = 0; i < matrix.length; i++) {
            matrix[i] = featurized.get(i).featureVector();
        }

        IsolationForest forest = new IsolationForest();
        forest.train(matrix, config.getNumTrees(), config.getMaxSamples(), config.getRandomSeed());
        double[] scores = forest.scoreAll(matrix);
        boolean[] flagged = ContaminationThreshold.flagTop(scores, config.getContamination());

        List<ScoredRecord> scored = new ArrayList<>(featurized.size());
        int flaggedCount = 0;
        for (int i = 0; i < featurized.size(); i++) {
            if (flagged[i]) flaggedCount++;
            scored.add(spikeClassifier.classify(featurized.get(i), scores[i], flagged[i]));
        }

        if (log.isDebugEnabled()) {
            long spikes = scored.stream().filter(ScoredRecord::isAnomaly).count();
            log.debug("Scored {} rows with {} trees (psi={}): {} ensemble-flagged, {} spikes",
                    scored.size(), config.getNumTrees(), forest.getSampleSize(), flaggedCount, spikes);
        }
        return scored;
    }

    public ExplanationSummary explain(List<ScoredRecord> scored) {
        return explainer.explain(scored);
    }
}
