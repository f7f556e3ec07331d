package com.trialwatch.service;

import com.trialwatch.client.ExternalApiException;
import com.trialwatch.client.PubMedClient;
import com.trialwatch.config.TrialWatchProperties;
import com.trialwatch.model.Citation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;

import java.util.List;
import java.util.Objects;

/**
 * Literature pass: looks up PubMed citations for stored trials and writes them back, together
 * with a per-trial summary. A failing lookup only skips that trial.
 */
@Service
public class LiteratureLinkService {

    private static final Logger log = LoggerFactory.getLogger(LiteratureLinkService.class);

    private static final int PROGRESS_EVERY = 25;

    private final PubMedClient pubMedClient;
    private final TrialStoreService store;
    private final TrialWatchProperties properties;

    public LiteratureLinkService(PubMedClient pubMedClient, TrialStoreService store, TrialWatchProperties properties) {
        this.pubMedClient = pubMedClient;
        this.store = store;
        this.properties = properties;
    }

    /**
     * @param maxTrialsOverride cap on trials checked, or null for the configured cap
     */
    public LinkReport link(Integer maxTrialsOverride) {
        TrialWatchProperties.PubMed config = properties.getPubmed();
        if (!config.isEnabled()) {
            log.info("[pubmed] Literature linking is disabled");
            return new LinkReport(0, 0, 0);
        }
        int maxTrials = maxTrialsOverride != null ? maxTrialsOverride : config.getMaxTrialsPerRun();
        if (maxTrials < 1) {
            throw new IllegalArgumentException("maxTrials must be at least 1");
        }

        List<String> nctIds = selectTrials(config.isActionableOnly(), maxTrials);
        log.info("[pubmed] Checking {} trials ({})", nctIds.size(), config.isActionableOnly() ? "actionable" : "top scored");

        int checked = 0;
        int linked = 0;
        int failed = 0;
        for (String nctId : nctIds) {
            List<Citation> citations;
            try {
                citations = pubMedClient.citationsFor(nctId);
            } catch (ExternalApiException | RestClientException e) {
                failed++;
                log.warn("[pubmed] Lookup failed for {}: {}", nctId, e.getMessage());
                continue;
            }

            store.upsertCitations(nctId, citations);
            store.updateLiteratureSummary(nctId, citations.size(), latestPublicationDate(citations));
            checked++;
            if (!citations.isEmpty()) {
                linked++;
            }
            if (checked % PROGRESS_EVERY == 0) {
                log.info("[pubmed] checked {}/{} trials", checked, nctIds.size());
            }
        }

        log.info("[pubmed] Done: checked={} withCitations={} failed={}", checked, linked, failed);
        return new LinkReport(checked, linked, failed);
    }

    private List<String> selectTrials(boolean actionableOnly, int limit) {
        if (actionableOnly) {
            TrialWatchProperties.Pipeline pipeline = properties.getPipeline();
            return store.actionableIds(pipeline.getReadoutWindowDays(), pipeline.getRecentlyCompletedDays(), limit);
        }
        return store.topIds(limit);
    }

    /**
     * PubMed dates are free text ("2023 Jan 15", "2023"), so this is the string maximum rather
     * than a calendar comparison. Null when no citation carries a date.
     */
    static String latestPublicationDate(List<Citation> citations) {
        return citations.stream()
                .map(Citation::pubDate)
                .filter(Objects::nonNull)
                .filter(d -> !d.isEmpty())
                .max(String::compareTo)
                .orElse(null);
    }

    public record LinkReport(int checked, int withCitations, int failed) {}
}
