package com.company.energyperformance.service.anomaly;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

@Value
@Builder
public class DetectionOutcome {

    public enum ReferenceSource {
        TRAINING_WINDOW,
        DETECTION_WINDOW
    }

    ReferenceSource referenceSource;
    int referenceSize;
    double threshold;
    double contamination;
    int bucketsScored;
    int bucketsSkipped;
    List<ScoredPoint> points;

    public List<ScoredPoint> anomalies() {
        return points.stream().filter(ScoredPoint::isAnomalous).collect(Collectors.toList());
    }
}
