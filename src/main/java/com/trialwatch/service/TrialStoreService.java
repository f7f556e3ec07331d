package com.trialwatch.service;

import com.trialwatch.model.Citation;
import com.trialwatch.model.CitationEntity;
import com.trialwatch.model.CitationId;
import com.trialwatch.model.PartialDate;
import com.trialwatch.model.ScoreResult;
import com.trialwatch.model.TrialEntity;
import com.trialwatch.model.TrialRecord;
import com.trialwatch.repository.CitationRepository;
import com.trialwatch.repository.TrialRepository;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Idempotent writes and digest reads over the trial and citation tables. Each public write
 * runs in its own transaction, so progress is durable as soon as the call returns.
 */
@Service
public class TrialStoreService {

    private final TrialRepository trialRepository;
    private final CitationRepository citationRepository;
    private final Clock clock;

    public TrialStoreService(TrialRepository trialRepository, CitationRepository citationRepository, Clock clock) {
        this.trialRepository = trialRepository;
        this.citationRepository = citationRepository;
        this.clock = clock;
    }

    /**
     * Inserts or fully rewrites the trial row. Topic tags accumulate: the topic is appended
     * unless already present. Literature summary columns are left as they are.
     *
     * @param rawJson registry document snapshot, or null to clear it
     */
    @Transactional
    public TrialEntity upsertTrial(TrialRecord record, String topicName, ScoreResult scores, String rawJson) {
        TrialEntity row = trialRepository.findById(record.nctId())
                .orElseGet(() -> new TrialEntity(record.nctId()));

        row.setTopicTags(mergeTags(row.getTopicTags(), topicName));
        copyRecord(record, row);
        copyScores(scores, row);
        row.setRawJson(rawJson);
        row.setLastSyncedUtc(Instant.now(clock));
        return trialRepository.save(row);
    }

    static List<String> mergeTags(Collection<String> existing, String topicName) {
        Set<String> tags = new LinkedHashSet<>();
        if (existing != null) {
            tags.addAll(existing);
        }
        if (topicName != null && !topicName.isBlank()) {
            tags.add(topicName);
        }
        return new ArrayList<>(tags);
    }

    /**
     * Inserts or refreshes citations keyed on (trial, PubMed id). Citations without an id are skipped.
     *
     * @return number of citations written
     */
    @Transactional
    public int upsertCitations(String nctId, Collection<Citation> citations) {
        Instant now = Instant.now(clock);
        int written = 0;
        for (Citation citation : citations) {
            String pmid = citation.pmid() == null ? "" : citation.pmid().strip();
            if (pmid.isEmpty()) {
                continue;
            }
            CitationEntity row = citationRepository.findById(new CitationId(nctId, pmid))
                    .orElseGet(() -> new CitationEntity(nctId, pmid));
            row.refresh(citation, now);
            citationRepository.save(row);
            written++;
        }
        return written;
    }

    /**
     * Overwrites only the literature summary columns of an existing trial row.
     */
    @Transactional
    public void updateLiteratureSummary(String nctId, int citationCount, String latestDate) {
        trialRepository.updateLiteratureSummary(nctId, citationCount, latestDate, Instant.now(clock));
    }

    @Transactional(readOnly = true)
    public int currentCitationCount(String nctId) {
        return trialRepository.findPubmedCountByNctId(nctId).orElse(0);
    }

    /**
     * Actionable rows, highest total score first, earliest primary completion breaking ties.
     */
    @Transactional(readOnly = true)
    public List<TrialEntity> actionableTrials(int readoutWindowDays, int recentlyCompletedDays) {
        return trialRepository.findActionable(readoutWindowDays, -recentlyCompletedDays);
    }

    @Transactional(readOnly = true)
    public List<String> actionableIds(int readoutWindowDays, int recentlyCompletedDays, int limit) {
        return trialRepository.findActionableIds(readoutWindowDays, -recentlyCompletedDays, PageRequest.of(0, limit));
    }

    @Transactional(readOnly = true)
    public List<String> topIds(int limit) {
        return trialRepository.findTopIds(PageRequest.of(0, limit));
    }

    @Transactional(readOnly = true)
    public Optional<TrialEntity> findTrial(String nctId) {
        return trialRepository.findById(nctId);
    }

    @Transactional(readOnly = true)
    public List<CitationEntity> citationsFor(String nctId) {
        return citationRepository.findByNctIdOrderByPubDateDesc(nctId);
    }

    private static void copyRecord(TrialRecord record, TrialEntity row) {
        row.setBriefTitle(record.briefTitle());
        row.setOfficialTitle(record.officialTitle());
        row.setAcronym(record.acronym());
        row.setOverallStatus(record.overallStatus());
        row.setStudyType(record.studyType());
        row.setPhase(record.firstPhase());
        row.setPhases(new ArrayList<>(record.phases()));
        row.setModality(record.modality() == null ? null : record.modality().label());
        row.setEnrollment(record.enrollment());
        row.setEnrollmentType(record.enrollmentType());
        row.setLeadSponsorName(record.leadSponsorName());
        row.setLeadSponsorClass(record.leadSponsorClass());
        row.setFdaRegulatedDrug(record.fdaRegulatedDrug());
        row.setFdaRegulatedDevice(record.fdaRegulatedDevice());
        row.setOversightHasDmc(record.oversightHasDmc());
        row.setHasResults(record.hasResults());
        row.setConditions(new ArrayList<>(record.conditions()));
        row.setInterventions(new ArrayList<>(record.interventions()));
        row.setInterventionTypes(new ArrayList<>(record.interventionTypes()));
        row.setContacts(record.contacts());
        row.setLocationCount(record.locationCount());

        PartialDate start = record.startDate();
        row.setStartDate(start.raw());
        row.setStartDateParsed(start.value());
        row.setStartDatePrecision(start.precision());

        PartialDate primary = record.primaryCompletionDate();
        row.setPrimaryCompletionDate(primary.raw());
        row.setPrimaryCompletionDateParsed(primary.value());
        row.setPrimaryCompletionDatePrecision(primary.precision());
        row.setPrimaryCompletionDateType(record.primaryCompletionType());

        PartialDate completion = record.completionDate();
        row.setCompletionDate(completion.raw());
        row.setCompletionDateParsed(completion.value());
        row.setCompletionDatePrecision(completion.precision());
        row.setCompletionDateType(record.completionType());

        PartialDate lastUpdate = record.lastUpdatePostDate();
        row.setLastUpdatePostDate(lastUpdate.raw());
        row.setLastUpdatePostDateParsed(lastUpdate.value());
        row.setLastUpdatePostDatePrecision(lastUpdate.precision());

        PartialDate resultsFirstPost = record.resultsFirstPostDate();
        row.setResultsFirstPostDate(resultsFirstPost.raw());
        row.setResultsFirstPostDateParsed(resultsFirstPost.value());
        row.setResultsFirstPostDatePrecision(resultsFirstPost.precision());
    }

    private static void copyScores(ScoreResult scores, TrialEntity row) {
        row.setUrgencyScore(scores.urgency());
        row.setMajorScore(scores.major());
        row.setInterestingScore(scores.interesting());
        row.setTotalScore(scores.total());
        row.setDaysToPrimaryCompletion(scores.daysToPrimaryCompletion());
        row.setScoreReasons(scores.reasons());
    }
}
