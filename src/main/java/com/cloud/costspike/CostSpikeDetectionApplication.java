package com.cloud.costspike;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CostSpikeDetectionApplication {

    public static void main(String[] args) {
        SpringApplication.run(CostSpikeDetectionApplication.class, args);
    }
}
