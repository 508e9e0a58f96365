package com.cloud.costspike.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * A {@link CostRecord} with its calendar and per-service rolling features.
 *
 * <p>{@code rollingMean7} and {@code rollingStd7} are {@code null} while the service has
 * fewer than the minimum number of observations in its window. The filled variants
 * ({@code costVsRollMean}, {@code rollStdFilled}) are always defined.
 */
@Value
@Builder
public class FeaturizedRecord {

    public static final int FEATURE_COUNT = 7;

    CostRecord record;
    int dayOfWeek;
    int dayOfMonth;
    int month;
    Double rollingMean7;
    Double rollingStd7;
    double pctChange;
    double costVsRollMean;
    double rollStdFilled;

    public LocalDate getDate() { return record.getDate(); }
    public String getService() { return record.getService(); }
    public double getCost() { return record.getCost(); }

    /**
     * Numeric vector handed to the isolation forest:
     * [cost, day_of_week, day_of_month, month, pct_change, cost_vs_rollmean, roll_std_filled].
     */
    public double[] featureVector() {
        double[] v = {
                getCost(),
                dayOfWeek,
                dayOfMonth,
                month,
                pctChange,
                costVsRollMean,
                rollStdFilled
        };
        for (int i = 0; i < v.length; i++) {
            if (!Double.isFinite(v[i])) v[i] = 0.0;
        }
        return v;
    }
}
