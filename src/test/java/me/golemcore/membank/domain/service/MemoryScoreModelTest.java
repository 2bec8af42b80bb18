package me.golemcore.membank.domain.service;

import me.golemcore.membank.domain.model.DecayCurve;
import me.golemcore.membank.domain.model.DecayRecommendation;
import me.golemcore.membank.domain.model.InitialTrust;
import me.golemcore.membank.domain.model.MemoryHit;
import me.golemcore.membank.domain.model.OutputCategory;
import me.golemcore.membank.domain.model.TrustAdjustment;
import me.golemcore.membank.domain.model.TrustSignals;
import me.golemcore.membank.domain.model.UsageOutcome;
import me.golemcore.membank.infrastructure.config.MemoryBankProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MemoryScoreModelTest {

    private static final double EPSILON = 1e-9;
    private static final Duration WEEK = Duration.ofDays(7);

    private MemoryBankProperties properties;
    private MemoryScoreModel model;

    @BeforeEach
    void setUp() {
        properties = new MemoryBankProperties();
        model = new MemoryScoreModel(properties);
    }

    // ==================== INITIAL TRUST ====================

    @Test
    void shouldComputeInitialTrustForCompliantHunterOutput() {
        InitialTrust trust = model.computeInitialTrust(0.85, 0.95, 0.90, true, 0);

        assertEquals(0.76725, trust.getComposite(), EPSILON);
        assertEquals(0.8075, trust.getSignals().getProvenance(), EPSILON);
        assertEquals(0.90, trust.getSignals().getConsensus(), EPSILON);
        assertEquals(1.0, trust.getSignals().getGovernance(), EPSILON);
        assertEquals(0.0, trust.getSignals().getUsage(), EPSILON);
        assertFalse(trust.isRequiresManualReview());
    }

    @Test
    void shouldDefaultConsensusWhenQualityMissing() {
        InitialTrust trust = model.computeInitialTrust(0.70, 1.0, null, true, 0);

        assertEquals(0.5, trust.getSignals().getConsensus(), EPSILON);
        assertEquals(0.70 * 0.30 + 0.5 * 0.25 + 0.30, trust.getComposite(), EPSILON);
    }

    @Test
    void shouldPenalizeEachViolationAndRequireReview() {
        InitialTrust twoViolations = model.computeInitialTrust(0.85, 0.95, 0.90, false, 2);
        InitialTrust noneReported = model.computeInitialTrust(0.85, 0.95, 0.90, false, 0);
        InitialTrust many = model.computeInitialTrust(0.85, 0.95, 0.90, false, 12);

        assertEquals(0.70, twoViolations.getSignals().getGovernance(), EPSILON);
        assertEquals(0.85, noneReported.getSignals().getGovernance(), EPSILON);
        assertEquals(0.0, many.getSignals().getGovernance(), EPSILON);
        assertTrue(twoViolations.isRequiresManualReview());
    }

    @Test
    void shouldUseConfiguredViolationPenalty() {
        properties.getScoring().setViolationPenalty(0.25);

        InitialTrust trust = model.computeInitialTrust(0.85, 0.95, 0.90, false, 2);

        assertEquals(0.5, trust.getSignals().getGovernance(), EPSILON);
    }

    @Test
    void shouldResolveComponentReputation() {
        assertEquals(0.85, model.resolveReputation("hunter"), EPSILON);
        assertEquals(0.85, model.resolveReputation(" Hunter "), EPSILON);
        assertEquals(0.95, model.resolveReputation("governance"), EPSILON);
        assertEquals(0.70, model.resolveReputation("unknown-producer"), EPSILON);
        assertEquals(0.70, model.resolveReputation(null), EPSILON);
    }

    @Test
    void shouldClampConfiguredReputationToRange() {
        properties.getScoring().getComponentReputation().put("oracle", 0.99);
        properties.getScoring().getComponentReputation().put("noise", 0.10);

        assertEquals(0.95, model.resolveReputation("oracle"), EPSILON);
        assertEquals(0.70, model.resolveReputation("noise"), EPSILON);
    }

    @Test
    void shouldRecomputeCompositeFromAllSignals() {
        TrustSignals signals = TrustSignals.builder()
                .provenance(0.8)
                .consensus(0.6)
                .governance(1.0)
                .usage(0.4)
                .build();

        assertEquals(0.24 + 0.15 + 0.30 + 0.06, model.recomputeComposite(signals), EPSILON);
    }

    // ==================== DECAY ====================

    @Test
    void shouldHalveTrustAfterOneHyperbolicHalfLife() {
        assertEquals(0.40, model.applyDecay(0.80, WEEK, DecayCurve.HYPERBOLIC, WEEK), EPSILON);
    }

    @Test
    void shouldHitHalfAtHalfLifeForHyperbolicAndExponential() {
        assertEquals(0.5, model.applyDecay(1.0, WEEK, DecayCurve.HYPERBOLIC, WEEK), EPSILON);
        assertEquals(0.5, model.applyDecay(1.0, WEEK, DecayCurve.EXPONENTIAL, WEEK), EPSILON);
    }

    @Test
    void shouldReachZeroAtTwiceHalfLifeForLinear() {
        Duration halfLife = Duration.ofDays(2);

        assertEquals(0.5, model.applyDecay(1.0, halfLife, DecayCurve.LINEAR, halfLife), EPSILON);
        assertEquals(0.0, model.applyDecay(1.0, halfLife.multipliedBy(2), DecayCurve.LINEAR, halfLife), EPSILON);
        assertEquals(0.0, model.applyDecay(1.0, halfLife.multipliedBy(5), DecayCurve.LINEAR, halfLife), EPSILON);
    }

    @ParameterizedTest
    @EnumSource(DecayCurve.class)
    void shouldBeIdentityAtAgeZeroAndNonIncreasingWithAge(DecayCurve curve) {
        double value = 0.73;
        assertEquals(value, model.applyDecay(value, Duration.ZERO, curve, WEEK), EPSILON);

        double previous = value;
        for (int hours = 1; hours <= 24 * 30; hours += 7) {
            double decayed = model.applyDecay(value, Duration.ofHours(hours), curve, WEEK);
            assertTrue(decayed <= previous, curve + " increased at " + hours + "h");
            assertTrue(decayed >= 0.0 && decayed <= 1.0);
            previous = decayed;
        }
    }

    @Test
    void shouldTreatNegativeAgeAsZero() {
        assertEquals(0.6, model.applyDecay(0.6, Duration.ofHours(-5), DecayCurve.EXPONENTIAL, WEEK), EPSILON);
    }

    @Test
    void shouldRejectNonPositiveHalfLife() {
        assertThrows(IllegalArgumentException.class,
                () -> model.applyDecay(0.5, WEEK, DecayCurve.HYPERBOLIC, Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
                () -> model.applyDecay(0.5, WEEK, DecayCurve.LINEAR, Duration.ofDays(-1)));
        assertThrows(IllegalArgumentException.class,
                () -> model.applyDecay(0.5, WEEK, DecayCurve.LINEAR, null));
    }

    @Test
    void shouldRecommendDecayPerCategory() {
        DecayRecommendation reasoning = model.recommendDecay(OutputCategory.REASONING);
        DecayRecommendation action = model.recommendDecay(OutputCategory.ACTION);
        DecayRecommendation observation = model.recommendDecay(OutputCategory.OBSERVATION);

        assertEquals(DecayCurve.HYPERBOLIC, reasoning.curve());
        assertTrue(reasoning.halfLife().compareTo(Duration.ofHours(168)) >= 0);
        assertEquals(DecayCurve.EXPONENTIAL, action.curve());
        assertEquals(Duration.ofDays(3), action.halfLife());
        assertEquals(DecayCurve.LINEAR, observation.curve());
        assertEquals(Duration.ofDays(2), observation.halfLife());
    }

    // ==================== USAGE ====================

    @Test
    void shouldRaiseTrustWithStrictlyDecreasingIncrementsOverFiveSuccesses() {
        double trust = 0.77;
        double previousIncrement = Double.MAX_VALUE;

        for (int successes = 0; successes < 5; successes++) {
            TrustAdjustment adjustment = model.updateOnUse(trust, successes, 0, UsageOutcome.SUCCESS);
            double increment = adjustment.getNewTrust() - trust;
            assertTrue(increment > 0);
            assertTrue(increment < previousIncrement);
            previousIncrement = increment;
            trust = adjustment.getNewTrust();
        }

        assertTrue(trust > 0.77);
        assertTrue(trust < 0.77 + 5 * 0.05);
    }

    @Test
    void shouldApplyDiminishingReturnsToSuccessesAndFailures() {
        double firstSuccess = model.updateOnUse(0.5, 0, 0, UsageOutcome.SUCCESS).getDelta();
        double tenthSuccess = model.updateOnUse(0.5, 9, 0, UsageOutcome.SUCCESS).getDelta();
        double firstFailure = model.updateOnUse(0.5, 0, 0, UsageOutcome.FAILURE).getDelta();
        double tenthFailure = model.updateOnUse(0.5, 0, 9, UsageOutcome.FAILURE).getDelta();

        assertEquals(0.05, firstSuccess, EPSILON);
        assertTrue(Math.abs(tenthSuccess) < Math.abs(firstSuccess));
        assertEquals(-0.08, firstFailure, EPSILON);
        assertTrue(Math.abs(tenthFailure) < Math.abs(firstFailure));
    }

    @Test
    void shouldAddConsistencyBonusOnlyWithEnoughConsistentHistory() {
        TrustAdjustment withHistory = model.updateOnUse(0.5, 5, 0, UsageOutcome.SUCCESS);
        TrustAdjustment tooFewUses = model.updateOnUse(0.5, 4, 0, UsageOutcome.SUCCESS);
        TrustAdjustment inconsistent = model.updateOnUse(0.5, 3, 2, UsageOutcome.SUCCESS);
        TrustAdjustment onFailure = model.updateOnUse(0.5, 10, 0, UsageOutcome.FAILURE);

        assertEquals(0.02, withHistory.getBonus(), EPSILON);
        assertEquals(0.5 + 0.05 / 1.5 + 0.02, withHistory.getNewTrust(), EPSILON);
        assertEquals(0.0, tooFewUses.getBonus(), EPSILON);
        assertEquals(0.0, inconsistent.getBonus(), EPSILON);
        assertEquals(0.0, onFailure.getBonus(), EPSILON);
    }

    @Test
    void shouldHonorConfiguredConsistencyFloor() {
        properties.getScoring().setConsistencyMinUses(2);

        assertEquals(0.02, model.updateOnUse(0.5, 2, 0, UsageOutcome.SUCCESS).getBonus(), EPSILON);
    }

    @Test
    void shouldLeaveTrustUnchangedOnNeutralUse() {
        TrustAdjustment adjustment = model.updateOnUse(0.64, 3, 1, UsageOutcome.NEUTRAL);

        assertEquals(0.64, adjustment.getNewTrust(), EPSILON);
        assertEquals(0.0, adjustment.getAppliedDelta(), EPSILON);
    }

    @Test
    void shouldKeepTrustWithinBoundsForAnyOutcomeSequence() {
        double trust = 0.95;
        long successes = 0;
        long failures = 0;
        for (int i = 0; i < 200; i++) {
            UsageOutcome outcome = i < 100 ? UsageOutcome.SUCCESS : UsageOutcome.FAILURE;
            trust = model.updateOnUse(trust, successes, failures, outcome).getNewTrust();
            if (outcome == UsageOutcome.SUCCESS) {
                successes++;
            } else {
                failures++;
            }
            assertTrue(trust >= 0.0 && trust <= 1.0, "trust out of bounds: " + trust);
        }
        assertEquals(0.0, model.updateOnUse(0.01, 0, 0, UsageOutcome.FAILURE).getNewTrust(), EPSILON);
        assertEquals(1.0, model.updateOnUse(0.99, 0, 0, UsageOutcome.SUCCESS).getNewTrust(), EPSILON);
    }

    @Test
    void shouldComputeUsageSignal() {
        assertEquals(0.0, model.computeUsageSignal(0, 0, 0), EPSILON);
        assertEquals(0.5 + 0.4, model.computeUsageSignal(10, 8, 2), EPSILON);
        assertEquals(1.0, model.computeUsageSignal(30, 30, 0), EPSILON);
    }

    // ==================== RANK ====================

    @Test
    void shouldBlendRankInputs() {
        assertEquals(1.0, model.computeRank(1, 1, 1, 1), EPSILON);
        assertEquals(0.40, model.computeRank(1, 0, 0, 0), EPSILON);
        assertEquals(0.35, model.computeRank(0, 1, 0, 0), EPSILON);
        assertEquals(0.5, model.computeRank(0.5, 0.5, 0.5, 0.5), EPSILON);
        assertEquals(0.40 + 0.35, model.computeRank(2.0, 7.0, -1.0, -3.0), EPSILON);
    }

    @Test
    void shouldComputeRecencyOverWindow() {
        assertEquals(1.0, model.recencyScore(Duration.ZERO, WEEK), EPSILON);
        assertEquals(0.5, model.recencyScore(Duration.ofHours(84), WEEK), EPSILON);
        assertEquals(0.0, model.recencyScore(Duration.ofDays(30), WEEK), EPSILON);
        assertEquals(0.0, model.recencyScore(Duration.ofHours(1), Duration.ZERO), EPSILON);
    }

    @Test
    void shouldOrderHitsDeterministically() {
        Instant older = Instant.parse("2026-01-01T00:00:00Z");
        Instant newer = Instant.parse("2026-01-02T00:00:00Z");
        MemoryHit lowRank = hit("mem_e", 0.40, 0.9, newer);
        MemoryHit tiedLowTrust = hit("mem_d", 0.70, 0.5, newer);
        MemoryHit tiedOlder = hit("mem_c", 0.70, 0.6, older);
        MemoryHit tiedNewerB = hit("mem_b", 0.70, 0.6, newer);
        MemoryHit tiedNewerA = hit("mem_a", 0.70, 0.6, newer);

        List<MemoryHit> input = new ArrayList<>(List.of(lowRank, tiedLowTrust, tiedOlder, tiedNewerB, tiedNewerA));
        List<MemoryHit> first = input.stream().sorted(model.hitOrder()).toList();
        Collections.reverse(input);
        List<MemoryHit> second = input.stream().sorted(model.hitOrder()).toList();

        assertEquals(List.of(tiedNewerA, tiedNewerB, tiedOlder, tiedLowTrust, lowRank), first);
        assertEquals(first, second);
    }

    private static MemoryHit hit(String reference, double rank, double trust, Instant createdAt) {
        return MemoryHit.builder()
                .reference(reference)
                .rank(rank)
                .trust(trust)
                .createdAt(createdAt)
                .build();
    }
}
