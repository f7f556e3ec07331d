package com.trialwatch.service;

import com.trialwatch.config.TrialWatchProperties;
import com.trialwatch.model.TrialEntity;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Digest data: trials reading out soon or recently completed, best first.
 */
@Service
public class DigestService {

    private final TrialStoreService store;
    private final TrialWatchProperties properties;

    public DigestService(TrialStoreService store, TrialWatchProperties properties) {
        this.store = store;
        this.properties = properties;
    }

    /**
     * @param readoutDaysOverride upcoming window in days, or null for the configured window
     */
    public List<TrialEntity> actionableTrials(Integer readoutDaysOverride) {
        TrialWatchProperties.Pipeline pipeline = properties.getPipeline();
        int readoutDays = readoutDaysOverride != null ? readoutDaysOverride : pipeline.getReadoutWindowDays();
        if (readoutDays < 0) {
            throw new IllegalArgumentException("days must not be negative");
        }
        return store.actionableTrials(readoutDays, pipeline.getRecentlyCompletedDays());
    }
}
