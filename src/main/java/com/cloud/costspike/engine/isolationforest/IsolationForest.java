package com.cloud.costspike.engine.isolationforest;

import com.cloud.costspike.exception.InsufficientDataException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Isolation Forest trained and scored on the same batch.
 *
 * A fresh instance is built per detection run; nothing is kept between runs.
 */
public class IsolationForest {

    public static final int MIN_TRAINING_ROWS = 2;

    private List<IsolationTree> trees = Collections.emptyList();
    private int sampleSize;

    /**
     * Train the isolation forest on the given data.
     *
     * @param data       training samples, each row is a feature vector
     * @param numTrees   number of trees in the forest
     * @param maxSamples cap on the sub-sample size per tree; the effective size is min(maxSamples, N)
     * @param seed       random seed; the same data and seed always give the same forest
     */
    public void train(double[][] data, int numTrees, int maxSamples, long seed) {
        if (data.length < MIN_TRAINING_ROWS) {
            throw new InsufficientDataException(data.length, MIN_TRAINING_ROWS);
        }
        if (numTrees < 1) {
            throw new IllegalArgumentException("numTrees must be >= 1, got " + numTrees);
        }
        if (maxSamples < MIN_TRAINING_ROWS) {
            throw new IllegalArgumentException("maxSamples must be >= " + MIN_TRAINING_ROWS + ", got " + maxSamples);
        }

        this.sampleSize = Math.min(maxSamples, data.length);
        int maxDepth = (int) Math.ceil(Math.log(this.sampleSize) / Math.log(2));

        Random random = new Random(seed);
        List<IsolationTree> built = new ArrayList<>(numTrees);
        for (int i = 0; i < numTrees; i++) {
            double[][] sample = subsample(data, this.sampleSize, random);
            built.add(IsolationTree.build(sample, maxDepth, random));
        }
        this.trees = built;
    }

    /**
     * Compute anomaly score for a single point.
     *
     * @return s(x) = 2^(-E[h(x)] / c(psi)) in (0, 1]; close to 1 means the point is
     *         isolated after few splits, well below 0.5 means it sits in a dense region
     */
    public double anomalyScore(double[] point) {
        if (trees.isEmpty()) {
            throw new IllegalStateException("Isolation forest has not been trained");
        }

        double avgPathLength = 0.0;
        for (IsolationTree tree : trees) {
            avgPathLength += tree.pathLength(point);
        }
        avgPathLength /= trees.size();

        double c = IsolationTree.averagePathLength(sampleSize);
        return Math.pow(2.0, -avgPathLength / c);
    }

    /**
     * Scores every row, whether or not it was drawn into a given tree's sub-sample.
     */
    public double[] scoreAll(double[][] data) {
        double[] scores = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            scores[i] = anomalyScore(data[i]);
        }
        return scores;
    }

    // Partial Fisher-Yates: draws `size` distinct rows without replacement
    private double[][] subsample(double[][] data, int size, Random random) {
        if (data.length <= size) {
            return data.clone();
        }
        double[][] sample = new double[size][];
        int[] indices = new int[data.length];
        for (int i = 0; i < data.length; i++) indices[i] = i;
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(data.length - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
            sample[i] = data[indices[i]];
        }
        return sample;
    }

    public List<IsolationTree> getTrees() { return Collections.unmodifiableList(trees); }
    public int getSampleSize() { return sampleSize; }
}
