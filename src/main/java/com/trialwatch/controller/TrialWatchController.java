package com.trialwatch.controller;

import com.trialwatch.model.CitationEntity;
import com.trialwatch.model.TrialEntity;
import com.trialwatch.service.DigestService;
import com.trialwatch.service.LiteratureLinkService;
import com.trialwatch.service.TrialStoreService;
import com.trialwatch.service.TrialSyncService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/trials")
public class TrialWatchController {

    private static final Logger log = LoggerFactory.getLogger(TrialWatchController.class);

    private final TrialSyncService syncService;
    private final LiteratureLinkService literatureService;
    private final DigestService digestService;
    private final TrialStoreService store;

    public TrialWatchController(TrialSyncService syncService, LiteratureLinkService literatureService,
                                DigestService digestService, TrialStoreService store) {
        this.syncService = syncService;
        this.literatureService = literatureService;
        this.digestService = digestService;
        this.store = store;
    }

    @PostMapping("/sync")
    public TrialSyncService.SyncReport sync(@RequestParam(name = "topic", required = false) List<String> topics,
                                            @RequestParam(required = false) Integer maxPages) {
        log.info("[api] sync requested: topics={} maxPages={}", topics, maxPages);
        return syncService.sync(topics, maxPages);
    }

    @PostMapping("/literature")
    public LiteratureLinkService.LinkReport linkLiterature(@RequestParam(required = false) Integer maxTrials) {
        log.info("[api] literature pass requested: maxTrials={}", maxTrials);
        return literatureService.link(maxTrials);
    }

    @GetMapping("/digest")
    public List<TrialEntity> digest(@RequestParam(required = false) Integer days) {
        return digestService.actionableTrials(days);
    }

    @GetMapping("/{nctId}")
    public ResponseEntity<TrialEntity> getTrial(@PathVariable String nctId) {
        return store.findTrial(nctId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/{nctId}/citations")
    public List<CitationEntity> getCitations(@PathVariable String nctId) {
        return store.citationsFor(nctId);
    }
}
