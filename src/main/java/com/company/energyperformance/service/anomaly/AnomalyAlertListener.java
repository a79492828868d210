package com.company.energyperformance.service.anomaly;

import com.company.energyperformance.domain.AnomalyFinding;
import com.company.energyperformance.event.AnomalyDetectedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

@Service
@Slf4j
@RequiredArgsConstructor
public class AnomalyAlertListener {

    private final AnomalyAlertPublisher publisher;

    @EventListener
    @Async
    public void onAnomalyDetected(AnomalyDetectedEvent event) {
        AnomalyFinding finding = event.getFinding();
        log.warn("Critical anomaly for group {} at {}: {}",
                finding.getGroupId(), finding.getFindingTime(), finding.getDescription());

        if (!publisher.publish(finding)) {
            log.warn("Alert for finding {} dropped; the finding stays OPEN for operators", finding.getFindingId());
        }
    }
}
