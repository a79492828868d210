package com.company.energyperformance.service;

import com.company.energyperformance.domain.BaselineModel;
import com.company.energyperformance.domain.SignificantUseGroup;
import com.company.energyperformance.event.BaselineActivatedEvent;
import com.company.energyperformance.event.GroupRegisteredEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Keeps cached baselines and groups in step with activation changes and registrations.
 * Runs on the publishing thread so a caller reading right after activation sees the new model.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CacheEvictionService {

    public static final String ACTIVE_BASELINES = "activeBaselines";
    public static final String SIGNIFICANT_GROUPS = "significantGroups";

    private final CacheManager cacheManager;

    @EventListener
    public void onBaselineActivationChanged(BaselineActivatedEvent event) {
        BaselineModel model = event.getModel();
        Cache cache = cacheManager.getCache(ACTIVE_BASELINES);
        if (cache != null) {
            cache.evict(model.getGroupId());
            log.debug("Evicted active baseline of group {} after v{} {}", model.getGroupId(),
                    model.getVersion(), event.isActivated() ? "activation" : "deactivation");
        }
    }

    @EventListener
    public void onGroupRegistered(GroupRegisteredEvent event) {
        SignificantUseGroup group = event.getGroup();
        Cache groups = cacheManager.getCache(SIGNIFICANT_GROUPS);
        if (groups != null) {
            groups.evict(group.getGroupId());
        }
        Cache baselines = cacheManager.getCache(ACTIVE_BASELINES);
        if (baselines != null) {
            baselines.evict(group.getGroupId());
        }
        log.debug("Evicted cached group {}", group.getGroupId());
    }
}
