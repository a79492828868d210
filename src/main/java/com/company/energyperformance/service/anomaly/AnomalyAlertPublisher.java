package com.company.energyperformance.service.anomaly;

import com.company.energyperformance.domain.AnomalyFinding;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Forwards critical findings to the Redis channel watched by alerting consumers
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class AnomalyAlertPublisher {

    public static final String CHANNEL = "anomaly.detected";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;
    private final Tracer tracer;

    /**
     * @return false when the alert could not be delivered after retries or the circuit is open
     */
    @Retry(name = "anomalyAlert", fallbackMethod = "publishFallback")
    @CircuitBreaker(name = "anomalyAlert", fallbackMethod = "publishFallback")
    public boolean publish(AnomalyFinding finding) {
        Span span = tracer.spanBuilder("anomaly.alert")
                .setSpanKind(SpanKind.PRODUCER)
                .startSpan();

        try (Scope ignored = span.makeCurrent()) {
            span.setAttribute("group", finding.getGroupId());
            span.setAttribute("metric", finding.getMetric());
            span.setAttribute("severity", finding.getSeverity().name());

            Long receivers = redisTemplate.convertAndSend(CHANNEL, payload(finding));

            meterRegistry.counter("anomaly.alerts.sent", "severity", finding.getSeverity().name()).increment();
            log.info("Anomaly alert for group {} at {} ({}) published to {} subscriber(s)",
                    finding.getGroupId(), finding.getFindingTime(), finding.getMetric(), receivers);
            return true;

        } catch (RuntimeException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, "Failed to publish anomaly alert");
            throw e;
        } finally {
            span.end();
        }
    }

    private boolean publishFallback(AnomalyFinding finding, Exception e) {
        log.error("Anomaly alert for group {} at {} not delivered: {}",
                finding.getGroupId(), finding.getFindingTime(), e.getMessage());
        meterRegistry.counter("anomaly.alerts.failed").increment();
        return false;
    }

    String payload(AnomalyFinding finding) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("findingId", finding.getFindingId());
        body.put("groupId", finding.getGroupId());
        body.put("entityId", finding.getEntityId());
        body.put("findingTime", finding.getFindingTime().toString());
        body.put("metric", finding.getMetric());
        body.put("anomalyType", finding.getAnomalyType().name());
        body.put("severity", finding.getSeverity().name());
        body.put("actualValue", finding.getActualValue());
        body.put("expectedValue", finding.getExpectedValue());
        body.put("zScore", finding.getZScore());
        body.put("confidence", finding.getConfidence());
        body.put("modelVersion", finding.getModelVersion());
        body.put("description", finding.getDescription());
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize anomaly alert", e);
        }
    }
}
