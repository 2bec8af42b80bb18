package me.golemcore.membank.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.RequiredArgsConstructor;
import me.golemcore.membank.domain.model.DecayCurve;
import me.golemcore.membank.domain.model.DecayRecommendation;
import me.golemcore.membank.domain.model.InitialTrust;
import me.golemcore.membank.domain.model.MemoryArtifact;
import me.golemcore.membank.domain.model.MemoryHit;
import me.golemcore.membank.domain.model.OutputCategory;
import me.golemcore.membank.domain.model.TrustAdjustment;
import me.golemcore.membank.domain.model.TrustSignals;
import me.golemcore.membank.domain.model.UsageOutcome;
import me.golemcore.membank.infrastructure.config.MemoryBankProperties;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Locale;
import java.util.Map;

/**
 * Stateless trust, decay and ranking formulas.
 *
 * <p>
 * Composite trust blends four signals:
 *
 * <pre>
 * trust = provenance * 0.30 + consensus * 0.25 + governance * 0.30 + usage * 0.15
 * </pre>
 *
 * and retrieval rank blends decayed trust with caller-supplied inputs:
 *
 * <pre>
 * rank = trust * 0.40 + relevance * 0.35 + recency * 0.15 + importance * 0.10
 * </pre>
 *
 * <p>
 * Only the reputation table, the violation penalty, the consistency sample
 * floor and the per-category decay defaults come from configuration; every
 * method is a pure function of its arguments and that configuration.
 */
@Service
@RequiredArgsConstructor
public class MemoryScoreModel {

    static final double PROVENANCE_WEIGHT = 0.30;
    static final double CONSENSUS_WEIGHT = 0.25;
    static final double GOVERNANCE_WEIGHT = 0.30;
    static final double USAGE_WEIGHT = 0.15;

    static final double RANK_TRUST_WEIGHT = 0.40;
    static final double RANK_RELEVANCE_WEIGHT = 0.35;
    static final double RANK_RECENCY_WEIGHT = 0.15;
    static final double RANK_IMPORTANCE_WEIGHT = 0.10;

    static final double SUCCESS_REWARD = 0.05;
    static final double SUCCESS_DAMPING = 0.1;
    static final double FAILURE_PENALTY = 0.08;
    static final double FAILURE_DAMPING = 0.05;
    static final double CONSISTENCY_BONUS = 0.02;
    static final double CONSISTENCY_RATE = 0.80;

    static final double DEFAULT_CONSENSUS = 0.5;
    static final double MIN_REPUTATION = 0.70;
    static final double MAX_REPUTATION = 0.95;
    static final double ACCESS_SATURATION = 20.0;

    private static final Comparator<MemoryHit> HIT_ORDER = Comparator
            .comparingDouble(MemoryHit::getRank).reversed()
            .thenComparing(Comparator.comparingDouble(MemoryHit::getTrust).reversed())
            .thenComparing(MemoryHit::getCreatedAt, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(MemoryHit::getReference, Comparator.nullsLast(Comparator.naturalOrder()));

    private final MemoryBankProperties properties;

    // ==================== WRITE ====================

    /**
     * Baseline reputation of a producing component, clamped to [0.70, 0.95].
     * Unknown components get the configured default.
     */
    public double resolveReputation(String component) {
        MemoryBankProperties.ScoringProperties scoring = properties.getScoring();
        double reputation = scoring.getDefaultReputation();
        if (component != null) {
            Map<String, Double> table = scoring.getComponentReputation();
            Double configured = table.get(component.trim().toLowerCase(Locale.ROOT));
            if (configured != null) {
                reputation = configured;
            }
        }
        return Math.max(MIN_REPUTATION, Math.min(MAX_REPUTATION, reputation));
    }

    /**
     * Score a freshly written output.
     *
     * @param reputation
     *            baseline reputation of the producing component
     * @param producerConfidence
     *            producer's own confidence in [0,1]
     * @param consensusQuality
     *            agreement/quality score, or {@code null} when not supplied
     * @param compliant
     *            governance gate verdict
     * @param violationCount
     *            number of reported violations
     */
    public InitialTrust computeInitialTrust(double reputation, double producerConfidence, Double consensusQuality,
            boolean compliant, int violationCount) {
        double provenance = clamp(reputation * clamp(producerConfidence));
        double consensus = consensusQuality != null ? clamp(consensusQuality) : DEFAULT_CONSENSUS;
        double governance = compliant ? 1.0 : governanceSignal(violationCount);
        TrustSignals signals = TrustSignals.builder()
                .provenance(provenance)
                .consensus(consensus)
                .governance(governance)
                .usage(0.0)
                .build();
        double composite = recomputeComposite(signals);

        String reason = String.format(Locale.ROOT,
                "provenance=%.3f consensus=%.3f governance=%.3f usage=0.000",
                provenance, consensus, governance);
        return InitialTrust.builder()
                .composite(composite)
                .signals(signals)
                .requiresManualReview(!compliant)
                .reason(reason)
                .build();
    }

    /**
     * Full re-blend of the four signals into composite trust.
     */
    public double recomputeComposite(TrustSignals signals) {
        return clamp(clamp(signals.getProvenance()) * PROVENANCE_WEIGHT
                + clamp(signals.getConsensus()) * CONSENSUS_WEIGHT
                + clamp(signals.getGovernance()) * GOVERNANCE_WEIGHT
                + clamp(signals.getUsage()) * USAGE_WEIGHT);
    }

    private double governanceSignal(int violationCount) {
        int counted = Math.max(1, violationCount);
        return clamp(1.0 - properties.getScoring().getViolationPenalty() * counted);
    }

    /**
     * Decay curve and half-life a category gets unless the producer overrides
     * them.
     */
    public DecayRecommendation recommendDecay(OutputCategory category) {
        MemoryBankProperties.DecayProperties configured = properties.getDecay().get(category);
        if (configured == null || configured.getCurve() == null || configured.getHalfLife() == null) {
            return new DecayRecommendation(DecayCurve.HYPERBOLIC, Duration.ofDays(7));
        }
        return new DecayRecommendation(configured.getCurve(), configured.getHalfLife());
    }

    // ==================== DECAY ====================

    /**
     * Apply a decay curve to a trust value. Negative ages count as zero.
     *
     * @throws IllegalArgumentException
     *             if the half-life is missing or not positive
     */
    public double applyDecay(double value, Duration age, DecayCurve curve, Duration halfLife) {
        if (halfLife == null || halfLife.isZero() || halfLife.isNegative()) {
            throw new IllegalArgumentException("Half-life must be positive: " + halfLife);
        }
        if (curve == null) {
            throw new IllegalArgumentException("Decay curve is required");
        }
        double clamped = clamp(value);
        if (age == null || age.isZero() || age.isNegative()) {
            return clamped;
        }
        double ratio = (double) age.toMillis() / (double) halfLife.toMillis();
        double decayed = switch (curve) {
        case HYPERBOLIC -> clamped / (1.0 + ratio);
        case EXPONENTIAL -> clamped * Math.pow(2.0, -ratio);
        case LINEAR -> Math.max(0.0, clamped * (1.0 - ratio / 2.0));
        };
        return clamp(decayed);
    }

    /**
     * Current trust of an artifact: stored composite trust decayed from the
     * last re-score, or from creation.
     */
    public double currentTrust(MemoryArtifact artifact, Instant now) {
        Instant reference = artifact.getDecayReference();
        Duration age = reference != null ? Duration.between(reference, now) : Duration.ZERO;
        return applyDecay(artifact.getTrust(), age, artifact.getDecayCurve(), artifact.getHalfLife());
    }

    // ==================== USAGE ====================

    /**
     * Usage-driven trust update with diminishing returns.
     *
     * @param currentTrust
     *            stored composite trust
     * @param successCount
     *            successes recorded before this event
     * @param failureCount
     *            failures recorded before this event
     * @param outcome
     *            outcome of this event
     */
    public TrustAdjustment updateOnUse(double currentTrust, long successCount, long failureCount,
            UsageOutcome outcome) {
        double previous = clamp(currentTrust);
        double delta = 0.0;
        double bonus = 0.0;

        if (outcome == UsageOutcome.SUCCESS) {
            delta = SUCCESS_REWARD / (1.0 + successCount * SUCCESS_DAMPING);
            long priorUses = successCount + failureCount;
            double rateAfter = (double) (successCount + 1) / (double) (priorUses + 1);
            if (rateAfter > CONSISTENCY_RATE && priorUses >= properties.getScoring().getConsistencyMinUses()) {
                bonus = CONSISTENCY_BONUS;
            }
        } else if (outcome == UsageOutcome.FAILURE) {
            delta = -FAILURE_PENALTY / (1.0 + failureCount * FAILURE_DAMPING);
        }

        return TrustAdjustment.builder()
                .previousTrust(previous)
                .delta(delta)
                .bonus(bonus)
                .newTrust(clamp(previous + delta + bonus))
                .build();
    }

    /**
     * Usage signal used on the next full re-score:
     * {@code min(1, accessCount / 20 + successRate * 0.5)}.
     */
    public double computeUsageSignal(long accessCount, long successCount, long failureCount) {
        long judged = successCount + failureCount;
        double successRate = judged > 0 ? (double) successCount / (double) judged : 0.0;
        return clamp(accessCount / ACCESS_SATURATION + successRate * 0.5);
    }

    // ==================== RANK ====================

    public double computeRank(double trust, double relevance, double recency, double importance) {
        return clamp(clamp(trust) * RANK_TRUST_WEIGHT
                + clamp(relevance) * RANK_RELEVANCE_WEIGHT
                + clamp(recency) * RANK_RECENCY_WEIGHT
                + clamp(importance) * RANK_IMPORTANCE_WEIGHT);
    }

    /**
     * {@code 1 - age / window}, clamped. A missing or non-positive window
     * yields zero recency.
     */
    public double recencyScore(Duration age, Duration window) {
        if (window == null || window.isZero() || window.isNegative()) {
            return 0.0;
        }
        if (age == null || age.isNegative()) {
            return 1.0;
        }
        return clamp(1.0 - (double) age.toMillis() / (double) window.toMillis());
    }

    /**
     * Descending rank, then higher trust, then newer, then reference order.
     */
    public Comparator<MemoryHit> hitOrder() {
        return HIT_ORDER;
    }

    static double clamp(double value) {
        if (Double.isNaN(value) || value < 0.0) {
            return 0.0;
        }
        if (value > 1.0) {
            return 1.0;
        }
        return value;
    }
}
