package com.trialwatch.model;

import jakarta.persistence.*;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "trials", indexes = {
    @Index(name = "idx_trials_total_score", columnList = "total_score DESC"),
    @Index(name = "idx_trials_primary_completion", columnList = "primary_completion_date_parsed"),
    @Index(name = "idx_trials_last_update", columnList = "last_update_post_date_parsed")
})
public class TrialEntity {

    @Id
    @Column(name = "nct_id", nullable = false)
    private String nctId;

    @Column(name = "brief_title", columnDefinition = "TEXT")
    private String briefTitle;

    @Column(name = "official_title", columnDefinition = "TEXT")
    private String officialTitle;

    @Column(name = "acronym")
    private String acronym;

    @Column(name = "overall_status")
    private String overallStatus;

    @Column(name = "study_type")
    private String studyType;

    @Column(name = "phase")
    private String phase;  // first phase token, e.g. PHASE3

    @Convert(converter = StringListConverter.class)
    @Column(name = "phases_json", columnDefinition = "TEXT")
    private List<String> phases;

    @Column(name = "modality")
    private String modality;

    @Column(name = "enrollment", columnDefinition = "INTEGER")
    private Integer enrollment;

    @Column(name = "enrollment_type")
    private String enrollmentType;

    @Column(name = "lead_sponsor_name", columnDefinition = "TEXT")
    private String leadSponsorName;

    @Column(name = "lead_sponsor_class")
    private String leadSponsorClass;

    @Column(name = "is_fda_regulated_drug", columnDefinition = "INTEGER")
    private Boolean fdaRegulatedDrug;

    @Column(name = "is_fda_regulated_device", columnDefinition = "INTEGER")
    private Boolean fdaRegulatedDevice;

    @Column(name = "oversight_has_dmc", columnDefinition = "INTEGER")
    private Boolean oversightHasDmc;

    @Column(name = "has_results", columnDefinition = "INTEGER")
    private Boolean hasResults;

    @Column(name = "start_date")
    private String startDate;

    @Convert(converter = IsoDateConverter.class)
    @Column(name = "start_date_parsed")
    private LocalDate startDateParsed;

    @Enumerated(EnumType.STRING)
    @Column(name = "start_date_precision")
    private DatePrecision startDatePrecision;

    @Column(name = "primary_completion_date")
    private String primaryCompletionDate;

    @Convert(converter = IsoDateConverter.class)
    @Column(name = "primary_completion_date_parsed")
    private LocalDate primaryCompletionDateParsed;

    @Enumerated(EnumType.STRING)
    @Column(name = "primary_completion_date_precision")
    private DatePrecision primaryCompletionDatePrecision;

    @Column(name = "primary_completion_date_type")
    private String primaryCompletionDateType;

    @Column(name = "completion_date")
    private String completionDate;

    @Convert(converter = IsoDateConverter.class)
    @Column(name = "completion_date_parsed")
    private LocalDate completionDateParsed;

    @Enumerated(EnumType.STRING)
    @Column(name = "completion_date_precision")
    private DatePrecision completionDatePrecision;

    @Column(name = "completion_date_type")
    private String completionDateType;

    @Column(name = "last_update_post_date")
    private String lastUpdatePostDate;

    @Convert(converter = IsoDateConverter.class)
    @Column(name = "last_update_post_date_parsed")
    private LocalDate lastUpdatePostDateParsed;

    @Enumerated(EnumType.STRING)
    @Column(name = "last_update_post_date_precision")
    private DatePrecision lastUpdatePostDatePrecision;

    @Column(name = "results_first_post_date")
    private String resultsFirstPostDate;

    @Convert(converter = IsoDateConverter.class)
    @Column(name = "results_first_post_date_parsed")
    private LocalDate resultsFirstPostDateParsed;

    @Enumerated(EnumType.STRING)
    @Column(name = "results_first_post_date_precision")
    private DatePrecision resultsFirstPostDatePrecision;

    @Convert(converter = StringListConverter.class)
    @Column(name = "conditions_json", columnDefinition = "TEXT")
    private List<String> conditions;

    @Convert(converter = StringListConverter.class)
    @Column(name = "interventions_json", columnDefinition = "TEXT")
    private List<String> interventions;

    @Convert(converter = StringListConverter.class)
    @Column(name = "intervention_types_json", columnDefinition = "TEXT")
    private List<String> interventionTypes;

    @Convert(converter = ContactBundleConverter.class)
    @Column(name = "contacts_json", columnDefinition = "TEXT")
    private ContactBundle contacts;

    @Column(name = "location_count", columnDefinition = "INTEGER")
    private Integer locationCount;

    @Convert(converter = StringListConverter.class)
    @Column(name = "topic_tags_json", columnDefinition = "TEXT")
    private List<String> topicTags = new ArrayList<>();  // union of every topic that matched; never shrinks

    @Column(name = "urgency_score", columnDefinition = "INTEGER")
    private Integer urgencyScore;

    @Column(name = "major_score", columnDefinition = "INTEGER")
    private Integer majorScore;

    @Column(name = "interesting_score", columnDefinition = "INTEGER")
    private Integer interestingScore;

    @Column(name = "total_score", columnDefinition = "INTEGER")
    private Integer totalScore;

    @Column(name = "days_to_primary_completion", columnDefinition = "INTEGER")
    private Integer daysToPrimaryCompletion;

    @Convert(converter = ScoreReasonsConverter.class)
    @Column(name = "score_reasons_json", columnDefinition = "TEXT")
    private ScoreReasons scoreReasons;

    @Column(name = "pubmed_count", columnDefinition = "INTEGER DEFAULT 0")
    private Integer pubmedCount = 0;  // owned by the literature pass

    @Column(name = "pubmed_latest_date")
    private String pubmedLatestDate;

    @Convert(converter = UtcTimestampConverter.class)
    @Column(name = "last_pubmed_check_utc")
    private Instant lastPubmedCheckUtc;

    @Convert(converter = UtcTimestampConverter.class)
    @Column(name = "last_synced_utc")
    private Instant lastSyncedUtc;

    @Column(name = "raw_json", columnDefinition = "TEXT")
    private String rawJson;  // registry document snapshot, when enabled

    protected TrialEntity() {
    }

    public TrialEntity(String nctId) {
        this.nctId = nctId;
    }

    // Getters and Setters
    public String getNctId() {
        return nctId;
    }

    public String getBriefTitle() {
        return briefTitle;
    }

    public void setBriefTitle(String briefTitle) {
        this.briefTitle = briefTitle;
    }

    public String getOfficialTitle() {
        return officialTitle;
    }

    public void setOfficialTitle(String officialTitle) {
        this.officialTitle = officialTitle;
    }

    public String getAcronym() {
        return acronym;
    }

    public void setAcronym(String acronym) {
        this.acronym = acronym;
    }

    public String getOverallStatus() {
        return overallStatus;
    }

    public void setOverallStatus(String overallStatus) {
        this.overallStatus = overallStatus;
    }

    public String getStudyType() {
        return studyType;
    }

    public void setStudyType(String studyType) {
        this.studyType = studyType;
    }

    public String getPhase() {
        return phase;
    }

    public void setPhase(String phase) {
        this.phase = phase;
    }

    public List<String> getPhases() {
        return phases;
    }

    public void setPhases(List<String> phases) {
        this.phases = phases;
    }

    public String getModality() {
        return modality;
    }

    public void setModality(String modality) {
        this.modality = modality;
    }

    public Integer getEnrollment() {
        return enrollment;
    }

    public void setEnrollment(Integer enrollment) {
        this.enrollment = enrollment;
    }

    public String getEnrollmentType() {
        return enrollmentType;
    }

    public void setEnrollmentType(String enrollmentType) {
        this.enrollmentType = enrollmentType;
    }

    public String getLeadSponsorName() {
        return leadSponsorName;
    }

    public void setLeadSponsorName(String leadSponsorName) {
        this.leadSponsorName = leadSponsorName;
    }

    public String getLeadSponsorClass() {
        return leadSponsorClass;
    }

    public void setLeadSponsorClass(String leadSponsorClass) {
        this.leadSponsorClass = leadSponsorClass;
    }

    public Boolean getFdaRegulatedDrug() {
        return fdaRegulatedDrug;
    }

    public void setFdaRegulatedDrug(Boolean fdaRegulatedDrug) {
        this.fdaRegulatedDrug = fdaRegulatedDrug;
    }

    public Boolean getFdaRegulatedDevice() {
        return fdaRegulatedDevice;
    }

    public void setFdaRegulatedDevice(Boolean fdaRegulatedDevice) {
        this.fdaRegulatedDevice = fdaRegulatedDevice;
    }

    public Boolean getOversightHasDmc() {
        return oversightHasDmc;
    }

    public void setOversightHasDmc(Boolean oversightHasDmc) {
        this.oversightHasDmc = oversightHasDmc;
    }

    public Boolean getHasResults() {
        return hasResults;
    }

    public void setHasResults(Boolean hasResults) {
        this.hasResults = hasResults;
    }

    public String getStartDate() {
        return startDate;
    }

    public void setStartDate(String startDate) {
        this.startDate = startDate;
    }

    public LocalDate getStartDateParsed() {
        return startDateParsed;
    }

    public void setStartDateParsed(LocalDate startDateParsed) {
        this.startDateParsed = startDateParsed;
    }

    public DatePrecision getStartDatePrecision() {
        return startDatePrecision;
    }

    public void setStartDatePrecision(DatePrecision startDatePrecision) {
        this.startDatePrecision = startDatePrecision;
    }

    public String getPrimaryCompletionDate() {
        return primaryCompletionDate;
    }

    public void setPrimaryCompletionDate(String primaryCompletionDate) {
        this.primaryCompletionDate = primaryCompletionDate;
    }

    public LocalDate getPrimaryCompletionDateParsed() {
        return primaryCompletionDateParsed;
    }

    public void setPrimaryCompletionDateParsed(LocalDate primaryCompletionDateParsed) {
        this.primaryCompletionDateParsed = primaryCompletionDateParsed;
    }

    public DatePrecision getPrimaryCompletionDatePrecision() {
        return primaryCompletionDatePrecision;
    }

    public void setPrimaryCompletionDatePrecision(DatePrecision primaryCompletionDatePrecision) {
        this.primaryCompletionDatePrecision = primaryCompletionDatePrecision;
    }

    public String getPrimaryCompletionDateType() {
        return primaryCompletionDateType;
    }

    public void setPrimaryCompletionDateType(String primaryCompletionDateType) {
        this.primaryCompletionDateType = primaryCompletionDateType;
    }

    public String getCompletionDate() {
        return completionDate;
    }

    public void setCompletionDate(String completionDate) {
        this.completionDate = completionDate;
    }

    public LocalDate getCompletionDateParsed() {
        return completionDateParsed;
    }

    public void setCompletionDateParsed(LocalDate completionDateParsed) {
        this.completionDateParsed = completionDateParsed;
    }

    public DatePrecision getCompletionDatePrecision() {
        return completionDatePrecision;
    }

    public void setCompletionDatePrecision(DatePrecision completionDatePrecision) {
        this.completionDatePrecision = completionDatePrecision;
    }

    public String getCompletionDateType() {
        return completionDateType;
    }

    public void setCompletionDateType(String completionDateType) {
        this.completionDateType = completionDateType;
    }

    public String getLastUpdatePostDate() {
        return lastUpdatePostDate;
    }

    public void setLastUpdatePostDate(String lastUpdatePostDate) {
        this.lastUpdatePostDate = lastUpdatePostDate;
    }

    public LocalDate getLastUpdatePostDateParsed() {
        return lastUpdatePostDateParsed;
    }

    public void setLastUpdatePostDateParsed(LocalDate lastUpdatePostDateParsed) {
        this.lastUpdatePostDateParsed = lastUpdatePostDateParsed;
    }

    public DatePrecision getLastUpdatePostDatePrecision() {
        return lastUpdatePostDatePrecision;
    }

    public void setLastUpdatePostDatePrecision(DatePrecision lastUpdatePostDatePrecision) {
        this.lastUpdatePostDatePrecision = lastUpdatePostDatePrecision;
    }

    public String getResultsFirstPostDate() {
        return resultsFirstPostDate;
    }

    public void setResultsFirstPostDate(String resultsFirstPostDate) {
        this.resultsFirstPostDate = resultsFirstPostDate;
    }

    public LocalDate getResultsFirstPostDateParsed() {
        return resultsFirstPostDateParsed;
    }

    public void setResultsFirstPostDateParsed(LocalDate resultsFirstPostDateParsed) {
        this.resultsFirstPostDateParsed = resultsFirstPostDateParsed;
    }

    public DatePrecision getResultsFirstPostDatePrecision() {
        return resultsFirstPostDatePrecision;
    }

    public void setResultsFirstPostDatePrecision(DatePrecision resultsFirstPostDatePrecision) {
        this.resultsFirstPostDatePrecision = resultsFirstPostDatePrecision;
    }

    public List<String> getConditions() {
        return conditions;
    }

    public void setConditions(List<String> conditions) {
        this.conditions = conditions;
    }

    public List<String> getInterventions() {
        return interventions;
    }

    public void setInterventions(List<String> interventions) {
        this.interventions = interventions;
    }

    public List<String> getInterventionTypes() {
        return interventionTypes;
    }

    public void setInterventionTypes(List<String> interventionTypes) {
        this.interventionTypes = interventionTypes;
    }

    public ContactBundle getContacts() {
        return contacts;
    }

    public void setContacts(ContactBundle contacts) {
        this.contacts = contacts;
    }

    public Integer getLocationCount() {
        return locationCount;
    }

    public void setLocationCount(Integer locationCount) {
        this.locationCount = locationCount;
    }

    public List<String> getTopicTags() {
        return topicTags;
    }

    public void setTopicTags(List<String> topicTags) {
        this.topicTags = topicTags;
    }

    public Integer getUrgencyScore() {
        return urgencyScore;
    }

    public void setUrgencyScore(Integer urgencyScore) {
        this.urgencyScore = urgencyScore;
    }

    public Integer getMajorScore() {
        return majorScore;
    }

    public void setMajorScore(Integer majorScore) {
        this.majorScore = majorScore;
    }

    public Integer getInterestingScore() {
        return interestingScore;
    }

    public void setInterestingScore(Integer interestingScore) {
        this.interestingScore = interestingScore;
    }

    public Integer getTotalScore() {
        return totalScore;
    }

    public void setTotalScore(Integer totalScore) {
        this.totalScore = totalScore;
    }

    public Integer getDaysToPrimaryCompletion() {
        return daysToPrimaryCompletion;
    }

    public void setDaysToPrimaryCompletion(Integer daysToPrimaryCompletion) {
        this.daysToPrimaryCompletion = daysToPrimaryCompletion;
    }

    public ScoreReasons getScoreReasons() {
        return scoreReasons;
    }

    public void setScoreReasons(ScoreReasons scoreReasons) {
        this.scoreReasons = scoreReasons;
    }

    public Integer getPubmedCount() {
        return pubmedCount;
    }

    public void setPubmedCount(Integer pubmedCount) {
        this.pubmedCount = pubmedCount;
    }

    public String getPubmedLatestDate() {
        return pubmedLatestDate;
    }

    public void setPubmedLatestDate(String pubmedLatestDate) {
        this.pubmedLatestDate = pubmedLatestDate;
    }

    public Instant getLastPubmedCheckUtc() {
        return lastPubmedCheckUtc;
    }

    public void setLastPubmedCheckUtc(Instant lastPubmedCheckUtc) {
        this.lastPubmedCheckUtc = lastPubmedCheckUtc;
    }

    public Instant getLastSyncedUtc() {
        return lastSyncedUtc;
    }

    public void setLastSyncedUtc(Instant lastSyncedUtc) {
        this.lastSyncedUtc = lastSyncedUtc;
    }

    public String getRawJson() {
        return rawJson;
    }

    public void setRawJson(String rawJson) {
        this.rawJson = rawJson;
    }

}
