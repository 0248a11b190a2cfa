package com.repurpose.analysis.service.scoring;

import com.repurpose.analysis.model.CollectorId;
import com.repurpose.analysis.model.EvidencePool;
import com.repurpose.analysis.model.ScoreBreakdown;
import com.repurpose.analysis.model.evidence.LiteratureEvidence;
import com.repurpose.analysis.model.evidence.MarketEvidence;
import com.repurpose.analysis.model.evidence.PatentEvidence;
import com.repurpose.analysis.model.evidence.RegulatoryEvidence;
import com.repurpose.analysis.model.evidence.TrialsEvidence;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts an {@link EvidencePool} into per-category scores, a weighted overall score and a
 * confidence value.
 *
 * <p>Pure and deterministic: the result depends only on the pool. Every category score is clamped
 * to [0,100] before weighting, and the weights of the categories present always sum to 100, so
 * the overall score stays within [0,100].
 */
@Component
public class ScoringEngine {

    /** Weights for the full five-category run. */
    public static final Map<CollectorId, Integer> BASE_WEIGHTS;
    static {
        EnumMap<CollectorId, Integer> w = new EnumMap<>(CollectorId.class);
        w.put(CollectorId.LITERATURE, 25);
        w.put(CollectorId.TRIALS, 30);
        w.put(CollectorId.PATENTS, 10);
        w.put(CollectorId.REGULATORY, 20);
        w.put(CollectorId.MARKET, 15);
        BASE_WEIGHTS = Collections.unmodifiableMap(w);
    }

    static final double CRITICAL_FAILURE_PENALTY = 0.7;

    private static final Pattern NUMBER = Pattern.compile("(\\d+(?:\\.\\d+)?)");

    public ScoreBreakdown score(EvidencePool pool) {
        Map<CollectorId, Integer> scores = new EnumMap<>(CollectorId.class);
        for (CollectorId id : pool.categories()) {
            scores.put(id, clamp(categoryScore(id, pool), 0, 100));
        }
        Map<CollectorId, Integer> weights = weightsFor(scores.keySet());
        return new ScoreBreakdown(scores, weights, overall(scores, weights), confidence(pool));
    }

    private static int categoryScore(CollectorId id, EvidencePool pool) {
        return switch (id) {
            case LITERATURE -> literatureScore(pool.literature());
            case TRIALS -> trialsScore(pool.trials());
            case PATENTS -> patentScore(pool.patents());
            case REGULATORY -> regulatoryScore(pool.regulatory());
            case MARKET -> marketScore(pool.market());
        };
    }

    /**
     * Base weights restricted to the given categories and rescaled to sum to exactly 100.
     * Rounding uses the largest-remainder method; ties go to the earlier category.
     */
    public static Map<CollectorId, Integer> weightsFor(Collection<CollectorId> categories) {
        Map<CollectorId, Integer> out = new EnumMap<>(CollectorId.class);
        if (categories.isEmpty()) return out;

        int baseTotal = 0;
        for (CollectorId id : categories) baseTotal += BASE_WEIGHTS.get(id);

        List<CollectorId> order = new ArrayList<>();
        Map<CollectorId, Double> remainders = new EnumMap<>(CollectorId.class);
        int assigned = 0;
        for (CollectorId id : CollectorId.values()) {
            if (!categories.contains(id)) continue;
            double exact = BASE_WEIGHTS.get(id) * 100.0 / baseTotal;
            int floor = (int) Math.floor(exact);
            out.put(id, floor);
            remainders.put(id, exact - floor);
            order.add(id);
            assigned += floor;
        }
        // stable sort keeps enum order among equal remainders
        order.sort((a, b) -> Double.compare(remainders.get(b), remainders.get(a)));
        for (int i = 0; i < 100 - assigned; i++) {
            CollectorId id = order.get(i % order.size());
            out.put(id, out.get(id) + 1);
        }
        return out;
    }

    /** round(Σ weight × score / 100). */
    public static int overall(Map<CollectorId, Integer> scores, Map<CollectorId, Integer> weights) {
        long weighted = 0;
        for (Map.Entry<CollectorId, Integer> e : scores.entrySet()) {
            weighted += (long) weights.getOrDefault(e.getKey(), 0) * e.getValue();
        }
        return clamp((int) Math.round(weighted / 100.0), 0, 100);
    }

    /**
     * Share of categories backed by a successful collector, penalised when a critical collector
     * (literature, trials) failed. Rounded to two decimals.
     */
    static double confidence(EvidencePool pool) {
        if (pool.size() == 0) return 0.0;
        double c = (double) pool.retrievedCount() / pool.size();
        for (CollectorId id : pool.categories()) {
            if (id.isCritical() && !pool.get(id).isRetrieved()) {
                c *= CRITICAL_FAILURE_PENALTY;
                break;
            }
        }
        return Math.round(c * 100.0) / 100.0;
    }

    static int literatureScore(LiteratureEvidence ev) {
        if (ev == null || !ev.isRetrieved()) return 20;
        List<LiteratureEvidence.Paper> papers = ev.getPapers();
        if (papers == null || papers.isEmpty()) return 30;
        double avgRelevance = papers.stream().mapToInt(LiteratureEvidence.Paper::getRelevance).average().orElse(50);
        double score = 30 + Math.min(30, papers.size() * 5) + (avgRelevance - 50) * 0.8;
        return clamp((int) Math.round(score), 20, 100);
    }

    static int trialsScore(TrialsEvidence ev) {
        if (ev == null || !ev.isRetrieved()) return 20;
        List<TrialsEvidence.Trial> trials = ev.getTrials();
        if (trials == null || trials.isEmpty()) return 30;
        int score = 30;
        for (TrialsEvidence.Trial t : trials) {
            String phase = t.getPhase() == null ? "" : t.getPhase().replace(" ", "").replace("_", "").toLowerCase(Locale.ROOT);
            if (phase.contains("phase3")) score += 20;
            else if (phase.contains("phase2")) score += 15;
            else if (phase.contains("phase1")) score += 8;

            String status = t.getStatus() == null ? "" : t.getStatus().toLowerCase(Locale.ROOT);
            if (status.contains("recruiting")) score += 5;
            else if (status.contains("active")) score += 8;
        }
        if (trials.size() >= 3) score += 15;
        else if (trials.size() == 2) score += 10;
        return clamp(score, 20, 100);
    }

    static int patentScore(PatentEvidence ev) {
        if (ev == null || !ev.isRetrieved()) return 30;
        List<PatentEvidence.Patent> patents = ev.getPatents();
        if (patents == null || patents.isEmpty()) return 35;
        long granted = patents.stream().filter(PatentEvidence.Patent::isGranted).count();
        int score = 40 + Math.min(30, patents.size() * 5) + (int) granted * 5;
        return clamp(score, 30, 100);
    }

    static int regulatoryScore(RegulatoryEvidence ev) {
        if (ev == null || !ev.isRetrieved()) return 40;
        int score = 50 + (ev.isApproved() ? 30 : 10);
        if (ev.isAbbreviatedPathway()) score += 15;
        return clamp(score, 40, 100);
    }

    static int marketScore(MarketEvidence ev) {
        if (ev == null || !ev.isRetrieved()) return 50;
        int score = 50;
        Double billions = parseMarketSizeBillions(ev.getMarketSize());
        if (billions != null) {
            if (billions > 50) score += 20;
            else if (billions > 10) score += 15;
            else score += 8;
        }
        String unmet = ev.getUnmetNeed() == null ? "" : ev.getUnmetNeed().toLowerCase(Locale.ROOT);
        if (unmet.contains("high")) score += 15;
        else if (unmet.contains("moderate")) score += 8;

        String competition = ev.getCompetition() == null ? "" : ev.getCompetition().toLowerCase(Locale.ROOT);
        if (competition.contains("low")) score += 10;
        return clamp(score, 50, 100);
    }

    /**
     * Market size in billions, e.g. "$4.2B" is 4.2, "$500M" is 0.5. A range such as "$2-10B" counts
     * at its upper bound. Returns {@code null} when no figure can be read.
     */
    static Double parseMarketSizeBillions(String marketSize) {
        if (marketSize == null) return null;
        Matcher m = NUMBER.matcher(marketSize.replace(",", ""));
        Double largest = null;
        while (m.find()) {
            double v = Double.parseDouble(m.group(1));
            if (largest == null || v > largest) largest = v;
        }
        if (largest == null) return null;
        String upper = marketSize.toUpperCase(Locale.ROOT);
        if (upper.contains("M") && !upper.contains("B")) return largest / 1000.0;
        return largest;
    }

    private static int clamp(int v, int lo, int hi) {
        return Math.max(lo, Math.min(hi, v));
    }
}
