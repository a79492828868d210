package com.company.energyperformance.service.baseline;

import com.company.energyperformance.config.BaselineProperties;
import com.company.energyperformance.domain.*;
import com.company.energyperformance.event.BaselineActivatedEvent;
import com.company.energyperformance.exception.DeadlineExceededException;
import com.company.energyperformance.exception.InsufficientDataException;
import com.company.energyperformance.exception.NoActiveModelException;
import com.company.energyperformance.exception.QualityGateFailureException;
import com.company.energyperformance.exception.ResourceNotFoundException;
import com.company.energyperformance.exception.ValidationException;
import com.company.energyperformance.repository.BaselineModelRepository;
import com.company.energyperformance.service.ReferenceDataService;
import com.company.energyperformance.service.aggregation.TierDefinition;
import com.company.energyperformance.service.aggregation.TierGraph;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Trains, versions and serves regression baselines per (group, energy source).
 *
 * <p>A request is fully validated before any rollup is read. Fits that pass the quality gate are
 * stored and activated in one transaction; fits that miss it are stored inactive with the reason.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BaselineModelRegistry {

    private final BaselineModelRepository modelRepository;
    private final ReferenceDataService referenceDataService;
    private final TierGraph tierGraph;
    private final FeatureCatalog featureCatalog;
    private final FeatureRowAssembler featureRowAssembler;
    private final LinearRegressionFitter fitter;
    private final BaselinePredictor predictor;
    private final BaselineProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;
    private final Tracer tracer;

    public BaselineModel train(TrainingCommand command) {
        if (command.getWindowStart() == null || command.getWindowEnd() == null
                || !command.getWindowStart().isBefore(command.getWindowEnd())) {
            throw new ValidationException("Training window start must be before its end",
                    Map.of("windowStart", String.valueOf(command.getWindowStart()),
                            "windowEnd", String.valueOf(command.getWindowEnd())));
        }

        SignificantUseGroup group = referenceDataService.getGroup(command.getGroupId());
        EnergySource source = referenceDataService.getEnergySource(group.getEnergySourceId());
        TierDefinition tier = tierGraph.require(
                command.getTier() != null ? command.getTier() : properties.getDefaultTier());

        List<String> featureNames = command.getFeatures() != null
                ? command.getFeatures()
                : featureCatalog.defaultFeatures(source.getType());
        List<FeatureDefinition> features = featureCatalog.resolveForTraining(source.getType(), featureNames);

        int minSamples = command.getMinSamples() != null ? command.getMinSamples() : properties.getMinSamples();
        double minRSquared = command.getMinRSquared() != null ? command.getMinRSquared() : properties.getMinRSquared();
        if (minSamples < 1) {
            throw new ValidationException("minSamples must be at least 1", Map.of("minSamples", minSamples));
        }
        if (minRSquared < 0.0 || minRSquared > 1.0) {
            throw new ValidationException("minRSquared must be within [0, 1]", Map.of("minRSquared", minRSquared));
        }

        Span span = tracer.spanBuilder("baseline.train")
                .setAttribute("group", group.getGroupId())
                .setAttribute("tier", tier.getName())
                .startSpan();
        Timer.Sample sample = Timer.start(meterRegistry);

        try (Scope ignored = span.makeCurrent()) {
            List<FeatureRow> rows = featureRowAssembler.assemble(group, source, tier.getName(),
                    command.getWindowStart(), command.getWindowEnd(), features, properties.getExcludedStates());
            List<FeatureRow> usable = rows.stream().filter(FeatureRow::isUsable).collect(Collectors.toList());

            log.info("Training baseline for group {}: {} buckets, {} usable, features {}",
                    group.getGroupId(), rows.size(), usable.size(), featureNames);

            if (usable.size() < minSamples) {
                meterRegistry.counter("baseline.training.rejected", "reason", "insufficient_data").increment();
                throw new InsufficientDataException(group.getGroupId(), usable.size(), minSamples);
            }
            int identifiable = features.size() + 2;
            if (usable.size() < identifiable) {
                meterRegistry.counter("baseline.training.rejected", "reason", "insufficient_data").increment();
                throw new InsufficientDataException(group.getGroupId(), usable.size(), identifiable);
            }

            FitResult fit = fitWithDeadline(usable, featureNames, command.isIncludeIntercept());

            boolean passed = fit.getRSquared() >= minRSquared;
            String reason = passed
                    ? String.format(Locale.ROOT, "R² %.4f ≥ %.2f with %d samples", fit.getRSquared(), minRSquared, fit.getSampleCount())
                    : String.format(Locale.ROOT, "R² %.4f below required %.2f", fit.getRSquared(), minRSquared);

            BaselineModel model = BaselineModel.builder()
                    .groupId(group.getGroupId())
                    .energySourceId(source.getEnergySourceId())
                    .tier(tier.getName())
                    .featureNames(new ArrayList<>(featureNames))
                    .coefficients(new LinkedHashMap<>(fit.getCoefficients()))
                    .pValues(new LinkedHashMap<>(fit.getPValues()))
                    .intercept(fit.getIntercept())
                    .interceptIncluded(fit.isInterceptIncluded())
                    .trainingStart(command.getWindowStart())
                    .trainingEnd(command.getWindowEnd())
                    .sampleCount(fit.getSampleCount())
                    .rSquared(fit.getRSquared())
                    .adjustedRSquared(fit.getAdjustedRSquared())
                    .rmse(fit.getRmse())
                    .mae(fit.getMae())
                    .qualityGatePassed(passed)
                    .qualityGateReason(reason)
                    .consumptionUnit(source.resolvedUnit())
                    .trainedBy(command.getTrainedBy())
                    .trainedAt(Instant.now())
                    .build();

            BaselineModel saved = modelRepository.saveNewVersion(model, passed);

            if (passed) {
                eventPublisher.publishEvent(new BaselineActivatedEvent(saved, true));
                meterRegistry.counter("baseline.training.success").increment();
                log.info("Baseline v{} of group {} activated: {}", saved.getVersion(), group.getGroupId(),
                        predictor.formula(saved));
            } else {
                meterRegistry.counter("baseline.training.quality_gate_failed").increment();
                log.warn("Baseline v{} of group {} stored inactive: {}", saved.getVersion(), group.getGroupId(), reason);
            }
            span.setAttribute("version", saved.getVersion());
            return saved;

        } catch (RuntimeException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR);
            throw e;
        } finally {
            sample.stop(meterRegistry.timer("baseline.training.duration"));
            span.end();
        }
    }

    @Cacheable(value = "activeBaselines", key = "#groupId")
    public BaselineModel activeModel(String groupId) {
        SignificantUseGroup group = referenceDataService.getGroup(groupId);
        return modelRepository.findActive(groupId, group.getEnergySourceId())
                .orElseThrow(() -> new NoActiveModelException(groupId));
    }

    public List<BaselineModel> history(String groupId) {
        SignificantUseGroup group = referenceDataService.getGroup(groupId);
        return modelRepository.findHistory(groupId, group.getEnergySourceId());
    }

    public BaselineModel activate(String groupId, int version) {
        SignificantUseGroup group = referenceDataService.getGroup(groupId);
        BaselineModel candidate = modelRepository.findByVersion(groupId, group.getEnergySourceId(), version)
                .orElseThrow(() -> new ResourceNotFoundException("Baseline model", groupId + " v" + version));
        if (!candidate.isQualityGatePassed()) {
            meterRegistry.counter("baseline.activation.rejected", "reason", "quality_gate").increment();
            throw new QualityGateFailureException(candidate);
        }
        BaselineModel model = modelRepository.activate(groupId, group.getEnergySourceId(), version, Instant.now());
        eventPublisher.publishEvent(new BaselineActivatedEvent(model, true));
        log.info("Baseline v{} of group {} activated manually", version, groupId);
        return model;
    }

    public BaselineModel deactivate(String groupId, int version, String reason) {
        SignificantUseGroup group = referenceDataService.getGroup(groupId);
        BaselineModel model = modelRepository.deactivate(groupId, group.getEnergySourceId(), version,
                reason != null ? reason : "Deactivated by operator", Instant.now());
        eventPublisher.publishEvent(new BaselineActivatedEvent(model, false));
        log.info("Baseline v{} of group {} deactivated: {}", version, groupId, model.getDeactivationReason());
        return model;
    }

    public Prediction predict(String groupId, Map<String, Double> features) {
        BaselineModel model = modelRepository.findActive(groupId,
                        referenceDataService.getGroup(groupId).getEnergySourceId())
                .orElseThrow(() -> new NoActiveModelException(groupId));
        Prediction prediction = predictor.predict(model, features);
        if (prediction.isClamped()) {
            meterRegistry.counter("baseline.predictions.clamped").increment();
            log.warn("Negative prediction {} clamped to 0 for group {} v{}",
                    prediction.getRawValue(), groupId, model.getVersion());
        }
        return prediction;
    }

    private FitResult fitWithDeadline(List<FeatureRow> rows, List<String> featureNames, boolean includeIntercept) {
        Duration deadline = properties.getTrainingDeadline();
        CompletableFuture<FitResult> future =
                CompletableFuture.supplyAsync(() -> fitter.fit(rows, featureNames, includeIntercept));
        try {
            return future.get(deadline.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            meterRegistry.counter("baseline.training.rejected", "reason", "deadline").increment();
            throw new DeadlineExceededException("baseline fit", deadline);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Baseline fit failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while fitting baseline", e);
        }
    }
}
