package com.trialwatch.scoring;

import com.trialwatch.model.InterestKeyword;
import com.trialwatch.model.Modality;
import com.trialwatch.model.PartialDate;
import com.trialwatch.model.ScoreResult;
import com.trialwatch.model.TrialRecord;
import com.trialwatch.parsing.PartialDateParser;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ScoringEngineTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 6, 1);

    private final ScoringEngine engine = new ScoringEngine();

    private ScoringEngine.Urgency urgencyAt(int delta, boolean hasResults, int citations) {
        return engine.scoreUrgency(TODAY.plusDays(delta), hasResults, citations, TODAY);
    }

    @Test
    void urgencyWithoutDateIsZero() {
        ScoringEngine.Urgency urgency = engine.scoreUrgency(null, false, 0, TODAY);

        assertThat(urgency.score()).isZero();
        assertThat(urgency.daysToPrimaryCompletion()).isNull();
        assertThat(urgency.reasons()).containsExactly("No primary completion date available");
    }

    @Test
    void completionBeyondIntDaysIsTreatedAsUndated() {
        ScoringEngine.Urgency urgency = engine.scoreUrgency(LocalDate.of(11761245, 7, 1), false, 0, TODAY);

        assertThat(urgency.score()).isZero();
        assertThat(urgency.daysToPrimaryCompletion()).isNull();
        assertThat(urgency.reasons()).containsExactly("No primary completion date available");
        assertThat(engine.scoreUrgency(LocalDate.MAX, true, 3, TODAY).score()).isZero();
    }

    @Test
    void urgencyOverUpcomingWindow() {
        assertThat(urgencyAt(0, false, 0).score()).isEqualTo(100);
        assertThat(urgencyAt(90, false, 0).score()).isEqualTo(60);
        assertThat(urgencyAt(180, false, 0).score()).isEqualTo(20);
        assertThat(urgencyAt(181, false, 0).score()).isZero();
        assertThat(urgencyAt(45, false, 0).reasons()).containsExactly("Primary completion in 45 days");
    }

    @Test
    void urgencyForRecentlyCompletedTrials() {
        ScoringEngine.Urgency bare = urgencyAt(-1, false, 0);
        assertThat(bare.score()).isEqualTo(99);
        assertThat(bare.daysToPrimaryCompletion()).isEqualTo(-1);
        assertThat(bare.reasons()).containsExactly(
                "Primary completion 1 days ago",
                "No posted results on ClinicalTrials.gov",
                "No linked PubMed citations found (yet)");

        assertThat(urgencyAt(-1, true, 3).score()).isEqualTo(69);
        assertThat(urgencyAt(-180, false, 0).score()).isEqualTo(60);
        assertThat(urgencyAt(-180, true, 1).score()).isEqualTo(30);
        assertThat(urgencyAt(-181, false, 0).score()).isZero();
    }

    @Test
    void urgencyOutsideWindowsExplainsDistance() {
        assertThat(urgencyAt(400, false, 0).reasons()).containsExactly("Primary completion is >180 days away (400 days)");
        assertThat(urgencyAt(-200, false, 0).reasons()).containsExactly("Primary completion is >180 days ago (200 days ago)");
        assertThat(urgencyAt(400, false, 0).daysToPrimaryCompletion()).isEqualTo(400);
    }

    @Test
    void urgencyStaysInRange() {
        for (int delta = -400; delta <= 400; delta += 7) {
            for (boolean results : new boolean[]{true, false}) {
                assertThat(urgencyAt(delta, results, results ? 2 : 0).score()).isBetween(0, 100);
            }
        }
    }

    @Test
    void majorRisesWithPhase() {
        int p1 = majorFor("PHASE1", 300);
        int p2 = majorFor("PHASE2", 300);
        int p3 = majorFor("PHASE3", 300);
        int na = majorFor("NA", 300);

        assertThat(p3).isGreaterThan(p2);
        assertThat(p2).isGreaterThan(p1);
        assertThat(p1).isGreaterThan(na);
    }

    @Test
    void majorNeverFallsWithEnrollment() {
        int previous = -1;
        for (int n : new int[]{10, 99, 100, 199, 200, 499, 500, 999, 1000, 1999, 2000, 50000}) {
            int score = majorFor("PHASE1", n);
            assertThat(score).isGreaterThanOrEqualTo(previous);
            previous = score;
        }
    }

    @Test
    void majorUsesMostAdvancedCombinedPhase() {
        ScoringEngine.ComponentScore major = engine.scoreMajor(List.of("PHASE2", "PHASE3"), null, null, null,
                null, null, null);

        assertThat(major.reasons()).contains("Phase 3", "Enrollment unknown", "Sponsor class unknown");
        assertThat(major.score()).isEqualTo(45);
    }

    @Test
    void majorIsClampedAt100() {
        ScoringEngine.ComponentScore major = engine.scoreMajor(List.of("PHASE3"), 5000, "INDUSTRY", "INTERVENTIONAL",
                true, true, true);

        assertThat(major.score()).isEqualTo(100);
        assertThat(major.reasons()).contains("Industry-sponsored", "Has DMC/DSM board (oversightHasDmc=true)");
    }

    @Test
    void interestingSumsTopicKeywordsAndSignalTerms() {
        ScoringEngine.ComponentScore interesting = engine.scoreInteresting("Bispecific CAR-T study",
                List.of(new InterestKeyword("bispecific", 6)));

        assertThat(interesting.score()).isEqualTo(19);
        assertThat(interesting.reasons()).containsExactly(
                "Keyword match: bispecific (+6)",
                "Signal term: CAR-T (+7)",
                "Signal term: bispecific (+6)");
    }

    @Test
    void interestingWithoutMatches() {
        ScoringEngine.ComponentScore interesting = engine.scoreInteresting("Observational registry of hypertension",
                List.of(new InterestKeyword("oncology", 9)));

        assertThat(interesting.score()).isZero();
        assertThat(interesting.reasons()).containsExactly("No interest keywords matched");
    }

    @Test
    void totalIsWeightedAndRounded() {
        assertThat(engine.total(0, 0, 0)).isZero();
        assertThat(engine.total(100, 100, 100)).isEqualTo(100);
        assertThat(engine.total(50, 60, 10)).isEqualTo(46);
        assertThat(engine.total(1, 1, 3)).isEqualTo(1);
    }

    @Test
    void scoresWholeRecord() {
        TrialRecord record = new TrialRecord("NCT09999999", "Bispecific antibody trial", "", "", "RECRUITING",
                "INTERVENTIONAL", List.of("PHASE2"), 250, "ESTIMATED", "Acme", "INDUSTRY",
                null, null, null, List.of("Melanoma"), List.of("AB-1"), List.of("BIOLOGICAL"),
                Modality.DRUG_BIOLOGIC, 4, null,
                PartialDate.none(), PartialDateParser.parse("2024-07-01"), "ESTIMATED",
                PartialDate.none(), null, PartialDate.none(), PartialDate.none(), false);

        ScoreResult result = engine.score(record, List.of(), 0, TODAY);

        assertThat(result.daysToPrimaryCompletion()).isEqualTo(30);
        assertThat(result.urgency()).isEqualTo(86);
        assertThat(result.major()).isEqualTo(71);
        assertThat(result.interesting()).isEqualTo(6);
        assertThat(result.total()).isEqualTo(engine.total(71, 86, 6));
        assertThat(result.reasons().urgency()).containsExactly("Primary completion in 30 days");
    }

    private int majorFor(String phase, int enrollment) {
        return engine.scoreMajor(List.of(phase), enrollment, "OTHER", "INTERVENTIONAL", false, false, false).score();
    }
}
