package com.trialwatch.scoring;

import com.trialwatch.model.InterestKeyword;
import com.trialwatch.model.Phase;
import com.trialwatch.model.ScoreReasons;
import com.trialwatch.model.ScoreResult;
import com.trialwatch.model.TrialRecord;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Editorial priority scoring. Every component score lies in [0, 100] and comes with the
 * reasons that produced it.
 */
@Component
public class ScoringEngine {

    static final int SOON_WINDOW_DAYS = 180;
    static final int RECENT_WINDOW_DAYS = 180;

    private static final double MAJOR_WEIGHT = 0.4;
    private static final double URGENCY_WEIGHT = 0.4;
    private static final double INTERESTING_WEIGHT = 0.2;

    /**
     * Signal terms applied to every topic, on top of the topic's own keywords.
     */
    static final List<InterestKeyword> SIGNAL_TERMS = List.of(
            new InterestKeyword("first-in-human", 6),
            new InterestKeyword("randomized", 4),
            new InterestKeyword("double-blind", 4),
            new InterestKeyword("platform", 4),
            new InterestKeyword("adaptive", 4),
            new InterestKeyword("pragmatic", 3),
            new InterestKeyword("mRNA", 8),
            new InterestKeyword("CRISPR", 8),
            new InterestKeyword("gene therapy", 8),
            new InterestKeyword("cell therapy", 7),
            new InterestKeyword("CAR-T", 7),
            new InterestKeyword("ADC", 7),
            new InterestKeyword("bispecific", 6),
            new InterestKeyword("AI", 5)
    );

    public record Urgency(int score, List<String> reasons, Integer daysToPrimaryCompletion) {}

    public record ComponentScore(int score, List<String> reasons) {}

    public ScoreResult score(TrialRecord record, List<InterestKeyword> topicKeywords, int citationCount, LocalDate today) {
        Urgency urgency = scoreUrgency(record.primaryCompletionDate().value(), record.hasResults(), citationCount, today);
        ComponentScore major = scoreMajor(record);
        ComponentScore interesting = scoreInteresting(record.searchableText(), topicKeywords);
        return new ScoreResult(
                urgency.score(),
                major.score(),
                interesting.score(),
                total(major.score(), urgency.score(), interesting.score()),
                urgency.daysToPrimaryCompletion(),
                new ScoreReasons(urgency.reasons(), major.reasons(), interesting.reasons()));
    }

    private static Urgency undated() {
        return new Urgency(0, List.of("No primary completion date available"), null);
    }

    /**
     * Piecewise on days until primary completion: rising to 100 as completion nears, and a
     * boost for recently completed trials with nothing posted or published yet.
     */
    public Urgency scoreUrgency(LocalDate primaryCompletion, boolean hasResults, int citationCount, LocalDate today) {
        if (primaryCompletion == null) {
            return undated();
        }
        int delta;
        try {
            delta = Math.toIntExact(ChronoUnit.DAYS.between(today, primaryCompletion));
        } catch (ArithmeticException e) {
            // further out than an int of days; no usable timing signal
            return undated();
        }
        List<String> reasons = new ArrayList<>();

        if (delta >= 0 && delta <= SOON_WINDOW_DAYS) {
            int score = (int) (100 - ((double) delta / SOON_WINDOW_DAYS) * 80);
            reasons.add("Primary completion in " + delta + " days");
            return new Urgency(clamp(score), reasons, delta);
        }
        if (delta < 0 && delta >= -RECENT_WINDOW_DAYS) {
            int ago = Math.abs(delta);
            int score = (int) (70 - ((double) ago / RECENT_WINDOW_DAYS) * 40);
            reasons.add("Primary completion " + ago + " days ago");
            if (!hasResults) {
                score += 15;
                reasons.add("No posted results on ClinicalTrials.gov");
            }
            if (citationCount == 0) {
                score += 15;
                reasons.add("No linked PubMed citations found (yet)");
            }
            return new Urgency(clamp(score), reasons, delta);
        }
        if (delta > SOON_WINDOW_DAYS) {
            reasons.add("Primary completion is >" + SOON_WINDOW_DAYS + " days away (" + delta + " days)");
        } else {
            reasons.add("Primary completion is >" + RECENT_WINDOW_DAYS + " days ago (" + Math.abs(delta) + " days ago)");
        }
        return new Urgency(0, reasons, delta);
    }

    public ComponentScore scoreMajor(TrialRecord record) {
        return scoreMajor(record.phases(), record.enrollment(), record.leadSponsorClass(), record.studyType(),
                record.oversightHasDmc(), record.fdaRegulatedDrug(), record.fdaRegulatedDevice());
    }

    /**
     * Additive points for phase, enrollment size, sponsor class, study type and oversight.
     */
    public ComponentScore scoreMajor(List<String> phases, Integer enrollment, String sponsorClass, String studyType,
                                Boolean oversightHasDmc, Boolean fdaRegulatedDrug, Boolean fdaRegulatedDevice) {
        List<String> reasons = new ArrayList<>();
        int score = 0;

        Phase phase = Phase.mostAdvanced(phases);
        switch (phase) {
            case PHASE4, PHASE3 -> {
                score += 40;
                reasons.add(phase.label());
            }
            case PHASE2 -> {
                score += 25;
                reasons.add(phase.label());
            }
            case PHASE1 -> {
                score += 10;
                reasons.add(phase.label());
            }
            default -> {
                score += 5;
                reasons.add("Phase: " + (phase == Phase.EARLY_PHASE1 ? phase.name() : Phase.unrankedLabel(phases)));
            }
        }

        if (enrollment != null) {
            int n = enrollment;
            if (n >= 2000) {
                score += 35;
                reasons.add("Large enrollment (n=" + n + ")");
            } else if (n >= 1000) {
                score += 30;
                reasons.add("Large enrollment (n=" + n + ")");
            } else if (n >= 500) {
                score += 25;
                reasons.add("Moderate-large enrollment (n=" + n + ")");
            } else if (n >= 200) {
                score += 18;
                reasons.add("Moderate enrollment (n=" + n + ")");
            } else if (n >= 100) {
                score += 12;
                reasons.add("Enrollment (n=" + n + ")");
            } else {
                score += 5;
                reasons.add("Small enrollment (n=" + n + ")");
            }
        } else {
            reasons.add("Enrollment unknown");
        }

        String sc = upperTrim(sponsorClass);
        if (sc.equals("INDUSTRY")) {
            score += 20;
            reasons.add("Industry-sponsored");
        } else if (sc.equals("NIH")) {
            score += 18;
            reasons.add("NIH-sponsored");
        } else if (!sc.isEmpty()) {
            score += 10;
            reasons.add("Sponsor class: " + sc);
        } else {
            score += 5;
            reasons.add("Sponsor class unknown");
        }

        String st = upperTrim(studyType);
        if (st.equals("INTERVENTIONAL")) {
            score += 8;
            reasons.add("Interventional study");
        } else if (!st.isEmpty()) {
            score += 3;
            reasons.add("Study type: " + st);
        }

        if (Boolean.TRUE.equals(oversightHasDmc)) {
            score += 5;
            reasons.add("Has DMC/DSM board (oversightHasDmc=true)");
        }
        if (Boolean.TRUE.equals(fdaRegulatedDrug)) {
            score += 3;
            reasons.add("FDA-regulated drug");
        }
        if (Boolean.TRUE.equals(fdaRegulatedDevice)) {
            score += 3;
            reasons.add("FDA-regulated device");
        }
        return new ComponentScore(clamp(score), reasons);
    }

    /**
     * Case-insensitive substring matches of topic keywords and built-in signal terms. The two
     * sources are summed independently, so a term present in both counts twice.
     */
    public ComponentScore scoreInteresting(String text, List<InterestKeyword> topicKeywords) {
        String haystack = text == null ? "" : text.toLowerCase(Locale.ROOT);
        List<String> reasons = new ArrayList<>();
        int score = 0;

        if (topicKeywords != null) {
            for (InterestKeyword item : topicKeywords) {
                if (item == null || item.keyword() == null || item.keyword().isBlank()) {
                    continue;
                }
                String kw = item.keyword().strip();
                if (haystack.contains(kw.toLowerCase(Locale.ROOT))) {
                    score += item.weight();
                    reasons.add("Keyword match: " + kw + " (+" + item.weight() + ")");
                }
            }
        }
        for (InterestKeyword term : SIGNAL_TERMS) {
            if (haystack.contains(term.keyword().toLowerCase(Locale.ROOT))) {
                score += term.weight();
                reasons.add("Signal term: " + term.keyword() + " (+" + term.weight() + ")");
            }
        }

        if (reasons.isEmpty()) {
            reasons.add("No interest keywords matched");
        }
        return new ComponentScore(clamp(score), reasons);
    }

    public int total(int major, int urgency, int interesting) {
        return (int) Math.round(MAJOR_WEIGHT * major + URGENCY_WEIGHT * urgency + INTERESTING_WEIGHT * interesting);
    }

    private static int clamp(int score) {
        return Math.max(0, Math.min(100, score));
    }

    private static String upperTrim(String value) {
        return value == null ? "" : value.strip().toUpperCase(Locale.ROOT);
    }
}
