package com.company.energyperformance.scheduled;

import com.company.energyperformance.config.AnomalyProperties;
import com.company.energyperformance.domain.SignificantUseGroup;
import com.company.energyperformance.exception.NoActiveModelException;
import com.company.energyperformance.repository.SignificantUseGroupRepository;
import com.company.energyperformance.service.anomaly.AnomalyDetectionResult;
import com.company.energyperformance.service.anomaly.AnomalyService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AnomalySweepJobTest {

    @Mock
    private AnomalyService anomalyService;
    @Mock
    private SignificantUseGroupRepository groupRepository;

    @Test
    void oneFailingGroupDoesNotStopTheSweep() {
        when(groupRepository.findAllActive()).thenReturn(List.of(group("boilers"), group("new-line"), group("compressors")));
        when(anomalyService.detect(eq("boilers"), any(), any(), isNull()))
                .thenThrow(new DataAccessResourceFailureException("timeout"));
        when(anomalyService.detect(eq("new-line"), any(), any(), isNull()))
                .thenThrow(new NoActiveModelException("new-line"));
        when(anomalyService.detect(eq("compressors"), any(), any(), isNull()))
                .thenReturn(AnomalyDetectionResult.builder().groupId("compressors").findingsCreated(2).build());

        new AnomalySweepJob(anomalyService, groupRepository, new AnomalyProperties()).sweep();

        verify(anomalyService).detect(eq("compressors"), any(), any(), isNull());
    }

    @Test
    void scansTrailingWindowEndingOnTheHour() {
        AnomalyProperties properties = new AnomalyProperties();
        properties.setSweepWindow(Duration.ofHours(3));
        when(groupRepository.findAllActive()).thenReturn(List.of(group("compressors")));
        when(anomalyService.detect(eq("compressors"), any(), any(), isNull()))
                .thenReturn(AnomalyDetectionResult.builder().groupId("compressors").build());

        new AnomalySweepJob(anomalyService, groupRepository, properties).sweep();

        ArgumentCaptor<Instant> start = ArgumentCaptor.forClass(Instant.class);
        ArgumentCaptor<Instant> end = ArgumentCaptor.forClass(Instant.class);
        verify(anomalyService).detect(eq("compressors"), start.capture(), end.capture(), isNull());
        assertThat(end.getValue().getEpochSecond() % 3600).isZero();
        assertThat(Duration.between(start.getValue(), end.getValue())).isEqualTo(Duration.ofHours(3));
    }

    private static SignificantUseGroup group(String groupId) {
        return SignificantUseGroup.builder().groupId(groupId).energySourceId("electricity").build();
    }
}
