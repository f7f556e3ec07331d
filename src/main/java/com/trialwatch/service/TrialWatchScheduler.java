package com.trialwatch.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Periodic sync followed by a literature pass. Disabled unless {@code trialwatch.schedule.cron}
 * is set to a cron expression.
 */
@Service
public class TrialWatchScheduler {

    private static final Logger log = LoggerFactory.getLogger(TrialWatchScheduler.class);

    private final TrialSyncService syncService;
    private final LiteratureLinkService literatureService;

    public TrialWatchScheduler(TrialSyncService syncService, LiteratureLinkService literatureService) {
        this.syncService = syncService;
        this.literatureService = literatureService;
    }

    @Scheduled(cron = "${trialwatch.schedule.cron:-}")
    public void runCycle() {
        if (syncService.isRunning()) {
            log.info("[schedule] Sync still running, skipping this cycle");
            return;
        }
        try {
            TrialSyncService.SyncReport sync = syncService.sync(null, null);
            log.info("[schedule] Sync stored {} trials", sync.totalStored());
            LiteratureLinkService.LinkReport link = literatureService.link(null);
            log.info("[schedule] Literature pass checked {} trials", link.checked());
        } catch (SyncInProgressException e) {
            log.info("[schedule] {}", e.getMessage());
        } catch (RuntimeException e) {
            // the next cycle starts from scratch; rows written so far are already committed
            log.error("[schedule] Cycle failed: {}", e.getMessage(), e);
        }
    }
}
