package com.cloud.costspike.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "detection")
public class DetectionConfig {

    // Number of isolation trees in the ensemble
    private int numTrees = 200;

    // Upper bound on the per-tree sub-sample size; the effective size is min(maxSamples, N)
    private int maxSamples = 256;

    // Expected fraction of anomalous rows. Calibrates the flag threshold only, never the score.
    private double contamination = 0.05;

    // Seed for sub-sampling and split selection. Same input + same seed = same scores.
    private long randomSeed = 42L;

    // Trailing window (by observation count, not calendar days) for rolling stats
    private int rollingWindow = 7;

    // Below this many observations in the window, rolling mean/std are undefined
    private int rollingMinPeriods = 3;

    // How many services the explanation ranks
    private int topServices = 5;
}
