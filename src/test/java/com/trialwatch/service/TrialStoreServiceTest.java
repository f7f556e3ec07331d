package com.trialwatch.service;

import com.trialwatch.model.CitationEntity;
import com.trialwatch.model.DatePrecision;
import com.trialwatch.model.TrialEntity;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static com.trialwatch.service.TrialFixtures.citation;
import static com.trialwatch.service.TrialFixtures.scores;
import static com.trialwatch.service.TrialFixtures.trial;
import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import(TrialStoreService.class)
class TrialStoreServiceTest {

    static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    @TestConfiguration
    static class FixedClock {

        @Bean
        Clock clock() {
            return Clock.fixed(NOW, ZoneOffset.UTC);
        }
    }

    @Autowired
    private TrialStoreService store;

    @Autowired
    private TestEntityManager entityManager;

    private void flushAndClear() {
        entityManager.flush();
        entityManager.clear();
    }

    @Test
    void tagsAccumulateInFirstSeenOrder() {
        store.upsertTrial(trial("NCT1", "First", "2024-07-01"), "oncology", scores(50, 30), null);
        store.upsertTrial(trial("NCT1", "First", "2024-07-01"), "immuno", scores(50, 30), null);
        store.upsertTrial(trial("NCT1", "First", "2024-07-01"), "oncology", scores(50, 30), null);
        flushAndClear();

        TrialEntity row = store.findTrial("NCT1").orElseThrow();
        assertThat(row.getTopicTags()).containsExactly("oncology", "immuno");
    }

    @Test
    void resyncOverwritesDerivedFields() {
        store.upsertTrial(trial("NCT2", "Old title", "2024-07-01"), "oncology", scores(40, 30), "{\"v\":1}");
        store.upsertTrial(trial("NCT2", "New title", "2024-08-01"), "oncology", scores(70, 61), null);
        flushAndClear();

        TrialEntity row = store.findTrial("NCT2").orElseThrow();
        assertThat(row.getBriefTitle()).isEqualTo("New title");
        assertThat(row.getTotalScore()).isEqualTo(70);
        assertThat(row.getDaysToPrimaryCompletion()).isEqualTo(61);
        assertThat(row.getPrimaryCompletionDateParsed()).isEqualTo(LocalDate.of(2024, 8, 1));
        assertThat(row.getScoreReasons().urgency()).containsExactly("urgency 70");
        assertThat(row.getRawJson()).isNull();
        assertThat(row.getLastSyncedUtc()).isEqualTo(NOW);
    }

    @Test
    void storesNormalizedColumns() {
        store.upsertTrial(trial("NCT3", "Columns", "2024-07"), "oncology", scores(10, 44), null);
        flushAndClear();

        TrialEntity row = store.findTrial("NCT3").orElseThrow();
        assertThat(row.getPhase()).isEqualTo("PHASE3");
        assertThat(row.getPhases()).containsExactly("PHASE3");
        assertThat(row.getModality()).isEqualTo("drug/biologic");
        assertThat(row.getPrimaryCompletionDatePrecision()).isEqualTo(DatePrecision.MONTH);
        assertThat(row.getPrimaryCompletionDateParsed()).isEqualTo(LocalDate.of(2024, 7, 15));
        assertThat(row.getStartDate()).isEqualTo("2021-05");
        assertThat(row.getOversightHasDmc()).isTrue();
        assertThat(row.getHasResults()).isFalse();
        assertThat(row.getContacts().centralContacts()).isEmpty();
        assertThat(row.getPubmedCount()).isZero();
    }

    @Test
    void literatureSummarySurvivesResync() {
        store.upsertTrial(trial("NCT4", "Summary", "2024-07-01"), "oncology", scores(50, 30), null);
        store.updateLiteratureSummary("NCT4", 3, "2024 Mar");
        store.upsertTrial(trial("NCT4", "Summary", "2024-07-01"), "oncology", scores(55, 30), null);
        flushAndClear();

        TrialEntity row = store.findTrial("NCT4").orElseThrow();
        assertThat(row.getPubmedCount()).isEqualTo(3);
        assertThat(row.getPubmedLatestDate()).isEqualTo("2024 Mar");
        assertThat(row.getLastPubmedCheckUtc()).isEqualTo(NOW);
        assertThat(row.getTotalScore()).isEqualTo(55);
        assertThat(store.currentCitationCount("NCT4")).isEqualTo(3);
    }

    @Test
    void citationCountDefaultsToZero() {
        assertThat(store.currentCitationCount("NCT_MISSING")).isZero();
    }

    @Test
    void citationUpsertIsIdempotent() {
        store.upsertTrial(trial("NCT5", "Cites", "2024-07-01"), "oncology", scores(50, 30), null);

        store.upsertCitations("NCT5", List.of(citation("111", "Old", "2023"), citation("222", "Other", "2024 Jan")));
        int written = store.upsertCitations("NCT5", List.of(citation("111", "Updated", "2023")));
        flushAndClear();

        assertThat(written).isEqualTo(1);
        List<CitationEntity> rows = store.citationsFor("NCT5");
        assertThat(rows).extracting(CitationEntity::getPmid).containsExactly("222", "111");
        assertThat(rows.get(1).getTitle()).isEqualTo("Updated");
        assertThat(rows.get(1).getLastSeenUtc()).isEqualTo(NOW);
    }

    @Test
    void blankCitationIdsAreSkipped() {
        int written = store.upsertCitations("NCT6", List.of(citation("  ", "Blank", "2024"),
                citation(null, "Null", "2024"), citation("333", "Kept", "2024")));
        flushAndClear();

        assertThat(written).isEqualTo(1);
        assertThat(store.citationsFor("NCT6")).extracting(CitationEntity::getPmid).containsExactly("333");
    }

    @Test
    void actionableRowsAreFilteredAndOrdered() {
        store.upsertTrial(trial("NCT_A", "A", "2024-07-01"), "t", scores(50, 30), null);
        store.upsertTrial(trial("NCT_B", "B", "2024-05-22"), "t", scores(80, -10), null);
        store.upsertTrial(trial("NCT_C", "C", "2025-07-06"), "t", scores(90, 400), null);
        store.upsertTrial(trial("NCT_D", "D", "2023-11-14"), "t", scores(95, -200), null);
        store.upsertTrial(trial("NCT_E", "E", "2024-09-09"), "t", scores(50, 100), null);
        store.upsertTrial(trial("NCT_F", "F", ""), "t", scores(99, null), null);
        flushAndClear();

        assertThat(store.actionableTrials(180, 120)).extracting(TrialEntity::getNctId)
                .containsExactly("NCT_B", "NCT_A", "NCT_E");
        assertThat(store.actionableTrials(60, 5)).extracting(TrialEntity::getNctId)
                .containsExactly("NCT_A");
        assertThat(store.actionableIds(180, 120, 2)).hasSize(2).first().isEqualTo("NCT_B");
        assertThat(store.topIds(2)).containsExactly("NCT_F", "NCT_D");
    }

    @Test
    void summaryUpdateForUnknownTrialIsNoOp() {
        store.updateLiteratureSummary("NCT_NONE", 2, "2024");

        assertThat(store.findTrial("NCT_NONE")).isEmpty();
    }
}
