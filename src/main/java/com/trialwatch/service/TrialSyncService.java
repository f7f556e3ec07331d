package com.trialwatch.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.trialwatch.client.ClinicalTrialsClient;
import com.trialwatch.config.TrialWatchProperties;
import com.trialwatch.config.TrialWatchProperties.Topic;
import com.trialwatch.model.ScoreResult;
import com.trialwatch.model.TrialRecord;
import com.trialwatch.parsing.TrialNormalizer;
import com.trialwatch.scoring.ScoringEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

/**
 * Sync pass: streams every configured topic from the registry, normalizes and scores each
 * study, and upserts it. Registry and persistence failures abort the pass; trials already
 * stored stay committed.
 */
@Service
public class TrialSyncService {

    private static final Logger log = LoggerFactory.getLogger(TrialSyncService.class);

    static final String PAGE_SIZE_PARAM = "pageSize";
    private static final int PROGRESS_EVERY = 200;

    private final ClinicalTrialsClient registryClient;
    private final TrialNormalizer normalizer;
    private final ScoringEngine scoringEngine;
    private final TrialStoreService store;
    private final TrialWatchProperties properties;
    private final Clock clock;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public TrialSyncService(ClinicalTrialsClient registryClient, TrialNormalizer normalizer,
                            ScoringEngine scoringEngine, TrialStoreService store,
                            TrialWatchProperties properties, Clock clock) {
        this.registryClient = registryClient;
        this.normalizer = normalizer;
        this.scoringEngine = scoringEngine;
        this.store = store;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Runs a sync pass.
     *
     * @param topicNames topics to sync; null or empty means every configured topic
     * @param maxPagesOverride page cap per topic, or null for the configured cap
     * @return summary of what was received and stored
     * @throws SyncInProgressException if a sync pass is already running
     * @throws IllegalArgumentException if a requested topic is not configured
     */
    public SyncReport sync(List<String> topicNames, Integer maxPagesOverride) {
        if (!running.compareAndSet(false, true)) {
            log.warn("[sync] A sync pass is already running, skipping this trigger");
            throw new SyncInProgressException();
        }
        try {
            List<Topic> topics = selectTopics(topicNames);
            int maxPages = maxPagesOverride != null ? maxPagesOverride : properties.getPipeline().getMaxPagesPerTopic();
            if (maxPages < 1) {
                throw new IllegalArgumentException("maxPages must be at least 1");
            }

            List<TopicReport> reports = new ArrayList<>();
            for (Topic topic : topics) {
                reports.add(syncTopic(topic, maxPages));
            }
            return new SyncReport(reports);
        } finally {
            running.set(false);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    List<Topic> selectTopics(List<String> topicNames) {
        List<Topic> configured = properties.getTopics();
        if (topicNames == null || topicNames.isEmpty()) {
            return configured;
        }
        List<Topic> selected = new ArrayList<>();
        for (String name : topicNames) {
            Topic match = configured.stream()
                    .filter(t -> t.getName().equals(name))
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException("Unknown topic: " + name));
            selected.add(match);
        }
        return selected;
    }

    private TopicReport syncTopic(Topic topic, int maxPages) {
        Map<String, String> params = topic.getParams();
        int pageSize = pageSize(params, properties.getRegistry().getPageSize());
        log.info("[sync] Topic: {} (pageSize={}, maxPages={})", topic.getName(), pageSize, maxPages);

        boolean keepRaw = properties.getPipeline().isStoreRawJson();
        int received = 0;
        int stored = 0;

        try (Stream<JsonNode> studies = registryClient.streamStudies(params, pageSize, maxPages)) {
            Iterator<JsonNode> it = studies.iterator();
            while (it.hasNext()) {
                JsonNode study = it.next();
                received++;

                TrialRecord record = normalizer.normalize(study).orElse(null);
                if (record == null) {
                    log.debug("[sync] Skipping study without an NCT id");
                    continue;
                }
                checkTagKeywords(topic, record);

                int citations = store.currentCitationCount(record.nctId());
                ScoreResult scores = scoringEngine.score(record, topic.getInterestingKeywords(), citations,
                        LocalDate.now(clock));
                store.upsertTrial(record, topic.getName(), scores, keepRaw ? study.toString() : null);
                stored++;

                if (stored % PROGRESS_EVERY == 0) {
                    log.info("[sync] {}: stored {} trials so far", topic.getName(), stored);
                }
            }
        }

        log.info("[sync] Topic: {} received={} stored={}", topic.getName(), received, stored);
        return new TopicReport(topic.getName(), received, stored);
    }

    /**
     * Tag keywords are advisory. The registry query already scopes the topic, so a trial that
     * mentions none of them is still tagged and stored.
     */
    private void checkTagKeywords(Topic topic, TrialRecord record) {
        List<String> keywords = topic.getTagKeywords();
        if (keywords == null || keywords.isEmpty()) {
            return;
        }
        String text = record.searchableText().toLowerCase(Locale.ROOT);
        boolean matched = keywords.stream()
                .filter(k -> k != null && !k.isBlank())
                .anyMatch(k -> text.contains(k.toLowerCase(Locale.ROOT)));
        if (!matched) {
            log.debug("[sync] {} matched no tag keyword of topic {}", record.nctId(), topic.getName());
        }
    }

    static int pageSize(Map<String, String> params, int fallback) {
        String raw = params == null ? null : params.get(PAGE_SIZE_PARAM);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.strip());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid pageSize for topic: " + raw, e);
        }
    }

    public record TopicReport(String topic, int received, int stored) {}

    public record SyncReport(List<TopicReport> topics) {

        public int totalStored() {
            return topics.stream().mapToInt(TopicReport::stored).sum();
        }
    }
}
