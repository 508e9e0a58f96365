package com.cloud.costspike.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * One normalized billing observation. Duplicate (date, service) pairs are legal.
 */
@Value
@Builder
public class CostRecord {
    LocalDate date;
    String service;
    double cost;
}
