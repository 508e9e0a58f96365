package com.cloud.costspike.engine.isolationforest;

import com.cloud.costspike.exception.InsufficientDataException;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class IsolationForestTest {

    @Test
    void train_fewerThanTwoRows_throwsInsufficientData() {
        IsolationForest forest = new IsolationForest();

        assertThatThrownBy(() -> forest.train(new double[][]{{1.0, 2.0}}, 10, 256, 42L))
                .isInstanceOf(InsufficientDataException.class);
        assertThatThrownBy(() -> forest.train(new double[0][], 10, 256, 42L))
                .isInstanceOf(InsufficientDataException.class);
    }

    @Test
    void train_sampleSizeIsCappedByBatchSize() {
        IsolationForest small = new IsolationForest();
        small.train(cluster(40, new Random(1)), 5, 256, 42L);
        IsolationForest large = new IsolationForest();
        large.train(cluster(600, new Random(1)), 5, 256, 42L);

        assertThat(small.getSampleSize()).isEqualTo(40);
        assertThat(large.getSampleSize()).isEqualTo(256);
        assertThat(large.getTrees()).hasSize(5);
    }

    @Test
    void scoreAll_outlierScoresHighest() {
        double[][] data = cluster(200, new Random(3));
        data[137] = new double[]{25.0, -25.0, 25.0};

        IsolationForest forest = new IsolationForest();
        forest.train(data, 200, 256, 42L);
        double[] scores = forest.scoreAll(data);

        int best = 0;
        for (int i = 1; i < scores.length; i++) {
            if (scores[i] > scores[best]) best = i;
        }
        assertThat(best).isEqualTo(137);
        assertThat(scores[137]).isGreaterThan(0.6);
    }

    @Test
    void scoreAll_scoresAreFiniteAndInUnitInterval() {
        double[][] data = cluster(300, new Random(9));

        IsolationForest forest = new IsolationForest();
        forest.train(data, 50, 256, 7L);

        for (double s : forest.scoreAll(data)) {
            assertThat(Double.isFinite(s)).isTrue();
            assertThat(s).isGreaterThan(0.0).isLessThanOrEqualTo(1.0);
        }
    }

    @Test
    void scoreAll_sameSeed_isBitIdentical() {
        double[][] data = cluster(500, new Random(5));

        IsolationForest first = new IsolationForest();
        first.train(data, 100, 256, 42L);
        IsolationForest second = new IsolationForest();
        second.train(data, 100, 256, 42L);

        assertThat(second.scoreAll(data)).containsExactly(first.scoreAll(data));
    }

    @Test
    void anomalyScore_identicalRows_isOneHalf() {
        double[][] data = new double[16][];
        for (int i = 0; i < data.length; i++) data[i] = new double[]{3.0, 3.0};

        IsolationForest forest = new IsolationForest();
        forest.train(data, 10, 256, 42L);

        // Every tree is a single leaf, so E[h] = c(psi) and s = 2^-1
        assertThat(forest.anomalyScore(data[0])).isCloseTo(0.5, within(1e-12));
    }

    @Test
    void anomalyScore_untrained_throws() {
        assertThatThrownBy(() -> new IsolationForest().anomalyScore(new double[]{1.0}))
                .isInstanceOf(IllegalStateException.class);
    }

    private static double[][] cluster(int n, Random random) {
        double[][] data = new double[n][3];
        for (int i = 0; i < n; i++) {
            for (int d = 0; d < 3; d++) data[i][d] = random.nextGaussian();
        }
        return data;
    }
}
