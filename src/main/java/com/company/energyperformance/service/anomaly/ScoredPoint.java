package com.company.energyperformance.service.anomaly;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * One detection bucket after scoring, with the dimension that stands out most
 */
@Value
@Builder
public class ScoredPoint {
    Instant bucketStart;
    Instant bucketEnd;
    double score;
    boolean anomalous;
    String metric;
    double metricValue;
    double metricZScore;
    double referenceMean;
    double consumption;
    double predicted;
    Map<String, Double> values;
}
