package com.cloud.costspike.engine;

import com.cloud.costspike.model.CostRecord;
import com.cloud.costspike.model.FeaturizedRecord;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives calendar features and per-service rolling statistics.
 *
 * Rolling features for a row only look at rows of the same service at or before it,
 * in input order. Input is expected to be the normalizer's (service, date) ordering,
 * so input order within a service is date order.
 *
 * Features:
 *   day_of_week      Monday = 0 .. Sunday = 6
 *   day_of_month     1-31
 *   month            1-12
 *   rolling_mean_7   mean of the trailing window, null below minPeriods observations
 *   rolling_std_7    sample std (n - 1) of the same window, same null rule
 *   pct_change       (cost - prev) / prev, 0 for the first row or a zero previous cost
 *   cost_vs_rollmean cost - rolling_mean_7, 0 when the mean is null
 *   roll_std_filled  rolling_std_7, 0 when null
 */
public class FeatureBuilder {

    private final int window;
    private final int minPeriods;

    public FeatureBuilder(int window, int minPeriods) {
        if (window < 1) {
            throw new IllegalArgumentException("Rolling window must be >= 1, got " + window);
        }
        if (minPeriods < 1 || minPeriods > window) {
            throw new IllegalArgumentException("Rolling min periods must be in [1, " + window + "], got " + minPeriods);
        }
        this.window = window;
        this.minPeriods = minPeriods;
    }

    public List<FeaturizedRecord> build(List<CostRecord> records) {
        FeaturizedRecord[] out = new FeaturizedRecord[records.size()];

        for (List<Integer> slice : groupByService(records).values()) {
            double[] costs = new double[slice.size()];
            for (int k = 0; k < slice.size(); k++) {
                costs[k] = records.get(slice.get(k)).getCost();
            }

            for (int k = 0; k < slice.size(); k++) {
                int idx = slice.get(k);
                out[idx] = featurize(records.get(idx), costs, k);
            }
        }

        return new ArrayList<>(Arrays.asList(out));
    }

    /**
     * Service -> indices of its rows, in first-seen service order and input row order.
     */
    static Map<String, List<Integer>> groupByService(List<CostRecord> records) {
        Map<String, List<Integer>> groups = new LinkedHashMap<>();
        for (int i = 0; i < records.size(); i++) {
            groups.computeIfAbsent(records.get(i).getService(), k -> new ArrayList<>()).add(i);
        }
        return groups;
    }

    private FeaturizedRecord featurize(CostRecord record, double[] costs, int k) {
        LocalDate date = record.getDate();

        int from = Math.max(0, k - window + 1);
        int count = k - from + 1;

        Double mean = null;
        Double std = null;
        if (count >= minPeriods) {
            mean = mean(costs, from, k);
            std = count > 1 ? sampleStd(costs, from, k, mean) : null;
        }

        double pctChange = 0.0;
        if (k > 0 && costs[k - 1] != 0.0) {
            pctChange = (costs[k] - costs[k - 1]) / costs[k - 1];
        }

        return FeaturizedRecord.builder()
                .record(record)
                .dayOfWeek(date.getDayOfWeek().getValue() - 1)
                .dayOfMonth(date.getDayOfMonth())
                .month(date.getMonthValue())
                .rollingMean7(mean)
                .rollingStd7(std)
                .pctChange(pctChange)
                .costVsRollMean(mean != null ? record.getCost() - mean : 0.0)
                .rollStdFilled(std != null ? std : 0.0)
                .build();
    }

    // Inclusive bounds
    private static double mean(double[] values, int from, int to) {
        double sum = 0.0;
        for (int i = from; i <= to; i++) sum += values[i];
        return sum / (to - from + 1);
    }

    private static double sampleStd(double[] values, int from, int to, double mean) {
        double m2 = 0.0;
        for (int i = from; i <= to; i++) {
            double d = values[i] - mean;
            m2 += d * d;
        }
        return Math.sqrt(m2 / (to - from));
    }
}
