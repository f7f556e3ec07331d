package com.trialwatch.config;

import com.trialwatch.model.InterestKeyword;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Trial watch settings bound from {@code trialwatch.*}. Validation runs at startup, so a
 * configuration without topics fails before any network or database work.
 */
@Validated
@ConfigurationProperties(prefix = "trialwatch")
public class TrialWatchProperties {

    @Valid
    private Pipeline pipeline = new Pipeline();

    @Valid
    private Registry registry = new Registry();

    @Valid
    private PubMed pubmed = new PubMed();

    private Schedule schedule = new Schedule();

    @Valid
    @NotEmpty(message = "at least one topic must be configured under trialwatch.topics")
    private List<Topic> topics = new ArrayList<>();

    public Pipeline getPipeline() {
        return pipeline;
    }

    public void setPipeline(Pipeline pipeline) {
        this.pipeline = pipeline;
    }

    public Registry getRegistry() {
        return registry;
    }

    public void setRegistry(Registry registry) {
        this.registry = registry;
    }

    public PubMed getPubmed() {
        return pubmed;
    }

    public void setPubmed(PubMed pubmed) {
        this.pubmed = pubmed;
    }

    public Schedule getSchedule() {
        return schedule;
    }

    public void setSchedule(Schedule schedule) {
        this.schedule = schedule;
    }

    public List<Topic> getTopics() {
        return topics;
    }

    public void setTopics(List<Topic> topics) {
        this.topics = topics;
    }

    public static class Pipeline {

        /** Upcoming window: primary completion within this many days counts as actionable. */
        @Min(0)
        private int readoutWindowDays = 180;

        /** Look-back window for recently completed trials. */
        @Min(0)
        private int recentlyCompletedDays = 120;

        @Min(1)
        private int maxPagesPerTopic = 10;

        /** Pause between consecutive registry page requests. */
        @NotNull
        private Duration registryDelay = Duration.ofMillis(250);

        /** Keep the raw registry document on each trial row. */
        private boolean storeRawJson = false;

        public int getReadoutWindowDays() {
            return readoutWindowDays;
        }

        public void setReadoutWindowDays(int readoutWindowDays) {
            this.readoutWindowDays = readoutWindowDays;
        }

        public int getRecentlyCompletedDays() {
            return recentlyCompletedDays;
        }

        public void setRecentlyCompletedDays(int recentlyCompletedDays) {
            this.recentlyCompletedDays = recentlyCompletedDays;
        }

        public int getMaxPagesPerTopic() {
            return maxPagesPerTopic;
        }

        public void setMaxPagesPerTopic(int maxPagesPerTopic) {
            this.maxPagesPerTopic = maxPagesPerTopic;
        }

        public Duration getRegistryDelay() {
            return registryDelay;
        }

        public void setRegistryDelay(Duration registryDelay) {
            this.registryDelay = registryDelay;
        }

        public boolean isStoreRawJson() {
            return storeRawJson;
        }

        public void setStoreRawJson(boolean storeRawJson) {
            this.storeRawJson = storeRawJson;
        }
    }

    public static class Registry {

        @NotBlank
        private String baseUrl = "https://clinicaltrials.gov/api/v2";

        @Min(1)
        private int pageSize = 200;

        @NotNull
        private Duration timeout = Duration.ofSeconds(30);

        @NotBlank
        private String userAgent = "ctgov-trial-watch/0.1";

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public int getPageSize() {
            return pageSize;
        }

        public void setPageSize(int pageSize) {
            this.pageSize = pageSize;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public String getUserAgent() {
            return userAgent;
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = userAgent;
        }
    }

    public static class PubMed {

        private boolean enabled = true;

        @NotBlank
        private String baseUrl = "https://eutils.ncbi.nlm.nih.gov/entrez/eutils";

        /** E-utilities {@code tool} parameter. */
        @NotBlank
        private String tool = "ctgov-trial-watch";

        /** E-utilities {@code email} parameter; omitted when blank. */
        private String email = "";

        /** Pause after each search or summary call. */
        @NotNull
        private Duration delay = Duration.ofMillis(400);

        @NotNull
        private Duration timeout = Duration.ofSeconds(30);

        /** Only link trials inside the readout / recently-completed windows. */
        private boolean actionableOnly = true;

        @Min(1)
        private int maxTrialsPerRun = 200;

        /** Upper bound on PubMed ids returned per trial search. */
        @Min(1)
        private int retmax = 200;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getTool() {
            return tool;
        }

        public void setTool(String tool) {
            this.tool = tool;
        }

        public String getEmail() {
            return email;
        }

        public void setEmail(String email) {
            this.email = email;
        }

        public Duration getDelay() {
            return delay;
        }

        public void setDelay(Duration delay) {
            this.delay = delay;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public boolean isActionableOnly() {
            return actionableOnly;
        }

        public void setActionableOnly(boolean actionableOnly) {
            this.actionableOnly = actionableOnly;
        }

        public int getMaxTrialsPerRun() {
            return maxTrialsPerRun;
        }

        public void setMaxTrialsPerRun(int maxTrialsPerRun) {
            this.maxTrialsPerRun = maxTrialsPerRun;
        }

        public int getRetmax() {
            return retmax;
        }

        public void setRetmax(int retmax) {
            this.retmax = retmax;
        }
    }

    public static class Schedule {

        /** Cron for the periodic sync + literature pass; "-" disables it. */
        private String cron = "-";

        public String getCron() {
            return cron;
        }

        public void setCron(String cron) {
            this.cron = cron;
        }
    }

    /**
     * A named registry query. Every trial it returns is tagged with the topic name.
     */
    public static class Topic {

        @NotBlank
        private String name;

        /** Registry search parameters, e.g. {@code query.cond}, {@code filter.overallStatus}. */
        private Map<String, String> params = new LinkedHashMap<>();

        /** Informational only: trials returned by the query are kept whether or not these match. */
        private List<String> tagKeywords = new ArrayList<>();

        private List<InterestKeyword> interestingKeywords = new ArrayList<>();

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public Map<String, String> getParams() {
            return params;
        }

        public void setParams(Map<String, String> params) {
            this.params = params;
        }

        public List<String> getTagKeywords() {
            return tagKeywords;
        }

        public void setTagKeywords(List<String> tagKeywords) {
            this.tagKeywords = tagKeywords;
        }

        public List<InterestKeyword> getInterestingKeywords() {
            return interestingKeywords;
        }

        public void setInterestingKeywords(List<InterestKeyword> interestingKeywords) {
            this.interestingKeywords = interestingKeywords;
        }
    }
}
