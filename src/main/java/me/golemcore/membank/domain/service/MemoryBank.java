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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.membank.domain.exception.ArtifactNotFoundException;
import me.golemcore.membank.domain.exception.MemoryBankException;
import me.golemcore.membank.domain.exception.MemoryStorageException;
import me.golemcore.membank.domain.exception.MemoryValidationException;
import me.golemcore.membank.domain.model.ArtifactStoredEvent;
import me.golemcore.membank.domain.model.DecayCurve;
import me.golemcore.membank.domain.model.DecayRecommendation;
import me.golemcore.membank.domain.model.GarbageCollectionCompletedEvent;
import me.golemcore.membank.domain.model.GcCancellationToken;
import me.golemcore.membank.domain.model.GcLogEntry;
import me.golemcore.membank.domain.model.GcPolicy;
import me.golemcore.membank.domain.model.GcSummary;
import me.golemcore.membank.domain.model.GovernanceVerdict;
import me.golemcore.membank.domain.model.InitialTrust;
import me.golemcore.membank.domain.model.MemoryArtifact;
import me.golemcore.membank.domain.model.MemoryBankDiagnostics;
import me.golemcore.membank.domain.model.MemoryFilters;
import me.golemcore.membank.domain.model.MemoryHit;
import me.golemcore.membank.domain.model.MemoryQuery;
import me.golemcore.membank.domain.model.MemoryRef;
import me.golemcore.membank.domain.model.OutputCategory;
import me.golemcore.membank.domain.model.ProducerOutput;
import me.golemcore.membank.domain.model.StoreStatus;
import me.golemcore.membank.domain.model.TrustAdjustment;
import me.golemcore.membank.domain.model.TrustEvent;
import me.golemcore.membank.domain.model.TrustEventKind;
import me.golemcore.membank.domain.model.TrustSignals;
import me.golemcore.membank.domain.model.UsageOutcome;
import me.golemcore.membank.infrastructure.config.MemoryBankProperties;
import me.golemcore.membank.infrastructure.event.SpringEventBus;
import me.golemcore.membank.port.outbound.ArtifactRepositoryPort;
import me.golemcore.membank.port.outbound.GovernancePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Shared memory bank: the single entry point through which producers store
 * outputs and consumers read ranked context, report usage and trigger
 * maintenance.
 *
 * <p>
 * Write path: validation, governance gate, initial scoring, durable write,
 * indexing, ledger append. Read path: index lookup, decay, {@code minTrust}
 * filter, ranking, top-k. Mutations of one artifact are serialized through
 * {@link ArtifactLocks}; reads take no locks and score the snapshot they were
 * given.
 *
 * <p>
 * The bank is started by the container (or by hand in tests) and rebuilds its
 * index from the repository on {@link #start()}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MemoryBank {

    private static final String LOG_PREFIX = "[MemoryBank]";
    private static final String REFERENCE_PREFIX = "mem_";
    private static final int REFERENCE_HEX_LENGTH = 16;
    private static final double DEFAULT_CONFIDENCE = 1.0;
    private static final double DEFAULT_IMPORTANCE = 0.5;
    private static final String SYSTEM_ACTOR = "system";

    private final ArtifactRepositoryPort repository;
    private final GovernancePort governance;
    private final MemoryScoreModel scoreModel;
    private final TrustLedger ledger;
    private final MemoryIndex index;
    private final ArtifactLocks locks;
    private final GarbageCollector garbageCollector;
    private final SpringEventBus eventBus;
    private final MemoryBankProperties properties;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong readSkips = new AtomicLong();
    private final Set<GcCancellationToken> activeSweeps = ConcurrentHashMap.newKeySet();

    // ==================== LIFECYCLE ====================

    @PostConstruct
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        index.clear();
        int indexed = 0;
        for (MemoryArtifact artifact : repository.findAll()) {
            if (artifact.isDeleted()) {
                continue;
            }
            index.add(artifact);
            indexed++;
        }
        log.info("{} Started with {} indexed artifacts", LOG_PREFIX, indexed);
    }

    @PreDestroy
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        activeSweeps.forEach(GcCancellationToken::cancel);
        log.info("{} Stopped ({} in-flight GC sweeps cancelled)", LOG_PREFIX, activeSweeps.size());
    }

    public boolean isRunning() {
        return running.get();
    }

    // ==================== WRITE ====================

    /**
     * Store a producer output.
     *
     * <p>
     * Non-compliant outputs are persisted with
     * {@code constitutionalCompliance=false} and reported through
     * {@link MemoryRef#getStatus()} rather than an exception.
     *
     * @throws MemoryValidationException
     *             if the output is malformed; nothing is persisted
     * @throws MemoryStorageException
     *             if the durable write fails; nothing is indexed
     */
    public MemoryRef store(ProducerOutput output) {
        requireRunning();
        OutputCategory category = validate(output);
        Instant now = clock.instant();

        GovernanceVerdict verdict = evaluateGovernance(output);
        boolean compliant = verdict.isCompliant();
        List<String> violations = verdict.getViolations() != null ? List.copyOf(verdict.getViolations()) : List.of();
        StoreStatus status = resolveStatus(category, compliant);

        DecayRecommendation recommended = scoreModel.recommendDecay(category);
        DecayCurve curve = output.getDecayCurve() != null ? output.getDecayCurve() : recommended.curve();
        Duration halfLife = output.getHalfLife() != null ? output.getHalfLife() : recommended.halfLife();
        requirePositive("halfLife", halfLife);

        double confidence = output.getProducerConfidence() != null ? output.getProducerConfidence()
                : DEFAULT_CONFIDENCE;
        InitialTrust initial = scoreModel.computeInitialTrust(
                scoreModel.resolveReputation(output.getComponent()),
                confidence,
                output.getConsensusQuality(),
                compliant,
                violations.size());
        TrustSignals signals = initial.getSignals();

        MemoryArtifact artifact = MemoryArtifact.builder()
                .reference(newReference())
                .loopId(output.getLoopId().trim())
                .component(output.getComponent().trim())
                .category(category)
                .payload(output.getPayload() != null ? new LinkedHashMap<>(output.getPayload())
                        : new LinkedHashMap<>())
                .tags(normalizeTags(output.getTags()))
                .domain(output.getDomain())
                .trust(initial.getComposite())
                .provenance(signals.getProvenance())
                .consensus(signals.getConsensus())
                .governance(signals.getGovernance())
                .usage(signals.getUsage())
                .producerConfidence(confidence)
                .importance(output.getImportance() != null ? output.getImportance() : DEFAULT_IMPORTANCE)
                .decayCurve(curve)
                .halfLife(halfLife)
                .constitutionalCompliance(compliant)
                .violations(new ArrayList<>(violations))
                .requiresManualReview(initial.isRequiresManualReview())
                .createdAt(now)
                .updatedAt(now)
                .expiresAt(output.getExpiresAt())
                .build();

        persist(artifact);
        index.add(artifact);
        ledger.record(TrustEvent.builder()
                .reference(artifact.getReference())
                .kind(TrustEventKind.CREATE)
                .reason(status + ": " + initial.getReason())
                .trustBefore(0.0)
                .trustAfter(artifact.getTrust())
                .provenanceDelta(signals.getProvenance())
                .consensusDelta(signals.getConsensus())
                .governanceDelta(signals.getGovernance())
                .usageDelta(signals.getUsage())
                .actor(artifact.getComponent())
                .timestamp(now)
                .build());
        eventBus.publish(new ArtifactStoredEvent(artifact.getReference(), artifact.getComponent(), category,
                status, artifact.getTrust()));

        if (compliant) {
            log.debug("{} Stored {} {} from {}: trust={}", LOG_PREFIX, artifact.getReference(), category.value(),
                    artifact.getComponent(), format(artifact.getTrust()));
        } else {
            log.warn("{} Stored {} {} from {} as {}: {}", LOG_PREFIX, artifact.getReference(), category.value(),
                    artifact.getComponent(), status, violations);
        }

        return MemoryRef.builder()
                .reference(artifact.getReference())
                .createdAt(now)
                .trust(artifact.getTrust())
                .status(status)
                .violations(violations)
                .build();
    }

    // ==================== READ ====================

    public List<MemoryHit> read(MemoryQuery query, MemoryFilters filters) {
        return read(query, properties.getRetrieval().getDefaultTopK(), filters);
    }

    /**
     * Top-{@code k} artifacts matching {@code filters}, ordered by descending
     * rank. Trust on each hit is the decayed trust at query time. Returns an
     * empty list when nothing matches.
     */
    public List<MemoryHit> read(MemoryQuery query, int k, MemoryFilters filters) {
        requireRunning();
        if (k < 0) {
            throw new MemoryValidationException("k must not be negative: " + k);
        }
        MemoryQuery effectiveQuery = query != null ? query : MemoryQuery.defaults();
        MemoryFilters effectiveFilters = filters != null ? filters : MemoryFilters.none();
        if (effectiveFilters.getMinTrust() != null) {
            requireUnit("minTrust", effectiveFilters.getMinTrust());
        }
        if (k == 0) {
            return List.of();
        }

        Instant now = clock.instant();
        double defaultRelevance = effectiveQuery.getDefaultRelevance() != null
                ? effectiveQuery.getDefaultRelevance()
                : properties.getRetrieval().getDefaultRelevance();
        Duration window = effectiveQuery.getRecencyWindow() != null
                ? effectiveQuery.getRecencyWindow()
                : properties.getRetrieval().getRecencyWindow();

        List<MemoryArtifact> candidates = repository.findAll(index.lookup(effectiveFilters));
        List<MemoryHit> hits = new ArrayList<>();
        int skipped = 0;
        for (MemoryArtifact artifact : candidates) {
            if (!isVisible(artifact, effectiveFilters, now)) {
                continue;
            }
            try {
                double trust = scoreModel.currentTrust(artifact, now);
                if (effectiveFilters.getMinTrust() != null && trust < effectiveFilters.getMinTrust()) {
                    continue;
                }
                double relevance = effectiveQuery.getRelevanceScorer() != null
                        ? effectiveQuery.getRelevanceScorer().applyAsDouble(artifact)
                        : defaultRelevance;
                double recency = scoreModel.recencyScore(Duration.between(artifact.getCreatedAt(), now), window);
                double rank = scoreModel.computeRank(trust, relevance, recency, artifact.getImportance());
                hits.add(toHit(artifact, trust, rank));
            } catch (RuntimeException e) {
                skipped++;
                log.warn("{} Skipping unscoreable artifact {}: {}", LOG_PREFIX, artifact.getReference(),
                        e.getMessage());
            }
        }
        if (skipped > 0) {
            readSkips.addAndGet(skipped);
        }

        return hits.stream()
                .sorted(scoreModel.hitOrder())
                .limit(k)
                .toList();
    }

    /**
     * Stored snapshot of an artifact with undecayed trust, in any lifecycle
     * state except deleted.
     */
    public Optional<MemoryArtifact> find(String reference) {
        requireRunning();
        return repository.find(reference).filter(artifact -> !artifact.isDeleted());
    }

    // ==================== TRUST ====================

    /**
     * Record one use of an artifact and apply the usage-driven trust update.
     *
     * @return the new stored trust
     * @throws ArtifactNotFoundException
     *             if the reference is unknown or deleted
     */
    public double updateTrust(String reference, UsageOutcome outcome, String reason) {
        requireRunning();
        requireText("reference", reference);
        if (outcome == null) {
            throw new MemoryValidationException("outcome is required");
        }
        return locks.withLock(reference, () -> {
            MemoryArtifact current = requireExisting(reference);
            Instant now = clock.instant();

            TrustAdjustment adjustment = scoreModel.updateOnUse(current.getTrust(),
                    current.getSuccessCount(), current.getFailureCount(), outcome);
            long accessCount = current.getAccessCount() + 1;
            long successCount = current.getSuccessCount() + (outcome == UsageOutcome.SUCCESS ? 1 : 0);
            long failureCount = current.getFailureCount() + (outcome == UsageOutcome.FAILURE ? 1 : 0);
            double usage = scoreModel.computeUsageSignal(accessCount, successCount, failureCount);

            MemoryArtifact updated = current.toBuilder()
                    .trust(adjustment.getNewTrust())
                    .usage(usage)
                    .accessCount(accessCount)
                    .successCount(successCount)
                    .failureCount(failureCount)
                    .lastAccessedAt(now)
                    .updatedAt(notBefore(now, current.getCreatedAt()))
                    .build();
            persist(updated);

            String description = reason != null && !reason.isBlank() ? reason : outcome.name().toLowerCase(Locale.ROOT);
            if (adjustment.getBonus() > 0) {
                description = description + " (+consistency bonus)";
            }
            ledger.record(TrustEvent.builder()
                    .reference(reference)
                    .kind(TrustEventKind.fromOutcome(outcome))
                    .reason(description)
                    .trustBefore(adjustment.getPreviousTrust())
                    .trustAfter(adjustment.getNewTrust())
                    .usageDelta(usage - current.getUsage())
                    .actor(SYSTEM_ACTOR)
                    .timestamp(now)
                    .build());

            log.debug("{} {} on {}: trust {} -> {}", LOG_PREFIX, outcome, reference,
                    format(adjustment.getPreviousTrust()), format(adjustment.getNewTrust()));
            return adjustment.getNewTrust();
        });
    }

    /**
     * Manual trust boost or penalty, clamped to [0, 1].
     *
     * @return the new stored trust
     */
    public double adjustTrust(String reference, double delta, String reason, String actor) {
        requireRunning();
        requireText("reference", reference);
        if (Double.isNaN(delta) || delta < -1.0 || delta > 1.0) {
            throw new MemoryValidationException("delta must be within [-1, 1]: " + delta);
        }
        if (reason == null || reason.isBlank()) {
            throw new MemoryValidationException("reason is required for a manual trust adjustment");
        }
        return locks.withLock(reference, () -> {
            MemoryArtifact current = requireExisting(reference);
            Instant now = clock.instant();
            double newTrust = MemoryScoreModel.clamp(current.getTrust() + delta);

            persist(current.toBuilder()
                    .trust(newTrust)
                    .updatedAt(notBefore(now, current.getCreatedAt()))
                    .build());
            ledger.record(TrustEvent.builder()
                    .reference(reference)
                    .kind(TrustEventKind.MANUAL_ADJUST)
                    .reason(reason)
                    .trustBefore(current.getTrust())
                    .trustAfter(newTrust)
                    .actor(actor != null && !actor.isBlank() ? actor : SYSTEM_ACTOR)
                    .timestamp(now)
                    .build());

            log.info("{} Manual adjustment of {} by {}: trust {} -> {} ({})", LOG_PREFIX, reference, actor,
                    format(current.getTrust()), format(newTrust), reason);
            return newTrust;
        });
    }

    /**
     * Re-blend the stored signals, with a refreshed usage signal, into composite
     * trust and restart the decay clock.
     *
     * @return the new stored trust
     */
    public double rescore(String reference) {
        requireRunning();
        requireText("reference", reference);
        return locks.withLock(reference, () -> {
            MemoryArtifact current = requireExisting(reference);
            Instant now = clock.instant();
            double usage = scoreModel.computeUsageSignal(current.getAccessCount(), current.getSuccessCount(),
                    current.getFailureCount());
            TrustSignals signals = current.getSignals();
            signals.setUsage(usage);
            double composite = scoreModel.recomputeComposite(signals);

            persist(current.toBuilder()
                    .trust(composite)
                    .usage(usage)
                    .lastRescoredAt(now)
                    .updatedAt(notBefore(now, current.getCreatedAt()))
                    .build());
            ledger.record(TrustEvent.builder()
                    .reference(reference)
                    .kind(TrustEventKind.RESCORE)
                    .reason("full re-score; decay clock restarted")
                    .trustBefore(scoreModel.currentTrust(current, now))
                    .trustAfter(composite)
                    .usageDelta(usage - current.getUsage())
                    .actor(SYSTEM_ACTOR)
                    .timestamp(now)
                    .build());

            log.debug("{} Re-scored {}: trust={}", LOG_PREFIX, reference, format(composite));
            return composite;
        });
    }

    /**
     * Change the decay configuration of an artifact. Stored trust is left as
     * is; only its future decay changes.
     */
    public MemoryArtifact reclassify(String reference, DecayCurve curve, Duration halfLife) {
        requireRunning();
        requireText("reference", reference);
        if (curve == null) {
            throw new MemoryValidationException("decay curve is required");
        }
        requirePositive("halfLife", halfLife);
        return locks.withLock(reference, () -> {
            MemoryArtifact current = requireExisting(reference);
            Instant now = clock.instant();
            MemoryArtifact updated = current.toBuilder()
                    .decayCurve(curve)
                    .halfLife(halfLife)
                    .updatedAt(notBefore(now, current.getCreatedAt()))
                    .build();

            persist(updated);
            ledger.record(TrustEvent.builder()
                    .reference(reference)
                    .kind(TrustEventKind.RECLASSIFY)
                    .reason(current.getDecayCurve() + "/" + current.getHalfLife() + " -> " + curve + "/" + halfLife)
                    .trustBefore(scoreModel.currentTrust(current, now))
                    .trustAfter(scoreModel.currentTrust(updated, now))
                    .actor(SYSTEM_ACTOR)
                    .timestamp(now)
                    .build());

            log.info("{} Reclassified {} to {} with half-life {}", LOG_PREFIX, reference, curve, halfLife);
            return updated;
        });
    }

    /**
     * Append a {@code DECAY_SNAPSHOT} row with the current decayed trust of
     * every live artifact. Stored trust is not changed.
     *
     * @return number of snapshots written
     */
    public int snapshotDecay() {
        requireRunning();
        Instant now = clock.instant();
        int written = 0;
        for (MemoryArtifact artifact : repository.findAll()) {
            if (!artifact.isLive()) {
                continue;
            }
            try {
                double decayed = scoreModel.currentTrust(artifact, now);
                boolean recorded = ledger.record(TrustEvent.builder()
                        .reference(artifact.getReference())
                        .kind(TrustEventKind.DECAY_SNAPSHOT)
                        .reason("decay snapshot")
                        .trustBefore(artifact.getTrust())
                        .trustAfter(decayed)
                        .actor(SYSTEM_ACTOR)
                        .timestamp(now)
                        .build());
                if (recorded) {
                    written++;
                }
            } catch (RuntimeException e) {
                log.warn("{} Decay snapshot failed for {}: {}", LOG_PREFIX, artifact.getReference(), e.getMessage());
            }
        }
        log.debug("{} Wrote {} decay snapshots", LOG_PREFIX, written);
        return written;
    }

    // ==================== MAINTENANCE ====================

    public GcSummary garbageCollect(GcPolicy policy) {
        return garbageCollect(policy, GcCancellationToken.none());
    }

    /**
     * Run one garbage collection sweep. {@code token} is also cancelled when
     * the bank stops mid-sweep.
     */
    public GcSummary garbageCollect(GcPolicy policy, GcCancellationToken token) {
        requireRunning();
        GcCancellationToken cancellation = token != null ? token : GcCancellationToken.none();
        activeSweeps.add(cancellation);
        GcSummary summary;
        try {
            summary = garbageCollector.collect(policy, cancellation);
        } finally {
            activeSweeps.remove(cancellation);
        }
        eventBus.publish(new GarbageCollectionCompletedEvent(summary));
        return summary;
    }

    public List<GcLogEntry> recentGcRuns(int limit) {
        return ledger.recentGcRuns(limit);
    }

    // ==================== AUDIT ====================

    /**
     * Trust history of an artifact, oldest first. Deleted and purged artifacts
     * keep their history.
     *
     * @throws ArtifactNotFoundException
     *             if the reference never existed
     */
    public List<TrustEvent> getTrustHistory(String reference) {
        requireRunning();
        Optional<MemoryArtifact> artifact = repository.find(reference);
        List<TrustEvent> events = ledger.history(reference);
        if (events.isEmpty()) {
            if (artifact.isEmpty() && !ledger.hasHistory(reference)) {
                throw new ArtifactNotFoundException(reference);
            }
            if (artifact.isPresent()) {
                log.warn("{} Data integrity: artifact {} has no trust history", LOG_PREFIX, reference);
            }
        }
        return events;
    }

    public MemoryBankDiagnostics diagnostics() {
        int live = 0;
        int archived = 0;
        int deleted = 0;
        int nonCompliant = 0;
        for (MemoryArtifact artifact : repository.findAll()) {
            if (artifact.isDeleted()) {
                deleted++;
                continue;
            }
            if (artifact.isArchived()) {
                archived++;
            } else {
                live++;
            }
            if (!artifact.isConstitutionalCompliance()) {
                nonCompliant++;
            }
        }
        return MemoryBankDiagnostics.builder()
                .liveArtifacts(live)
                .archivedArtifacts(archived)
                .deletedArtifacts(deleted)
                .nonCompliantArtifacts(nonCompliant)
                .indexedReferences(index.size())
                .readSkips(readSkips.get())
                .auditGaps(ledger.getAuditGapCount())
                .running(running.get())
                .build();
    }

    // ==================== HELPERS ====================

    private OutputCategory validate(ProducerOutput output) {
        if (output == null) {
            throw new MemoryValidationException("Producer output is required");
        }
        requireText("loopId", output.getLoopId());
        requireText("component", output.getComponent());
        requireText("category", output.getCategory());
        OutputCategory category = OutputCategory.fromValue(output.getCategory())
                .orElseThrow(() -> new MemoryValidationException("Unrecognized category: " + output.getCategory()));
        if (output.getProducerConfidence() != null) {
            requireUnit("producerConfidence", output.getProducerConfidence());
        }
        if (output.getConsensusQuality() != null) {
            requireUnit("consensusQuality", output.getConsensusQuality());
        }
        if (output.getImportance() != null) {
            requireUnit("importance", output.getImportance());
        }
        if (output.getHalfLife() != null) {
            requirePositive("halfLife", output.getHalfLife());
        }
        return category;
    }

    private GovernanceVerdict evaluateGovernance(ProducerOutput output) {
        try {
            GovernanceVerdict verdict = governance.evaluate(output);
            if (verdict == null) {
                throw new MemoryBankException("Governance gate returned no verdict");
            }
            return verdict;
        } catch (MemoryBankException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new MemoryBankException("Governance gate failed: " + e.getMessage(), e);
        }
    }

    private StoreStatus resolveStatus(OutputCategory category, boolean compliant) {
        if (compliant) {
            return StoreStatus.ACCEPTED;
        }
        return properties.getGovernance().getRequiredCategories().contains(category)
                ? StoreStatus.CONSTITUTIONAL_VIOLATION
                : StoreStatus.FLAGGED_FOR_REVIEW;
    }

    private String newReference() {
        String reference;
        do {
            reference = REFERENCE_PREFIX
                    + UUID.randomUUID().toString().replace("-", "").substring(0, REFERENCE_HEX_LENGTH);
        } while (repository.find(reference).isPresent());
        return reference;
    }

    private void persist(MemoryArtifact artifact) {
        try {
            repository.save(artifact);
        } catch (MemoryStorageException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new MemoryStorageException("Failed to persist artifact: " + artifact.getReference(), e);
        }
    }

    private MemoryArtifact requireExisting(String reference) {
        return repository.find(reference)
                .filter(artifact -> !artifact.isDeleted())
                .orElseThrow(() -> new ArtifactNotFoundException(reference));
    }

    private boolean isVisible(MemoryArtifact artifact, MemoryFilters filters, Instant now) {
        if (artifact.isDeleted()) {
            return false;
        }
        if (!artifact.isConstitutionalCompliance() && !filters.isIncludeNonCompliant()) {
            return false;
        }
        boolean retired = artifact.isArchived() || artifact.isExpired(now);
        return !retired || filters.isIncludeArchived();
    }

    private MemoryHit toHit(MemoryArtifact artifact, double trust, double rank) {
        return MemoryHit.builder()
                .reference(artifact.getReference())
                .payload(artifact.getPayload() != null ? Collections.unmodifiableMap(artifact.getPayload()) : null)
                .trust(trust)
                .rank(rank)
                .component(artifact.getComponent())
                .category(artifact.getCategory())
                .createdAt(artifact.getCreatedAt())
                .loopId(artifact.getLoopId())
                .domain(artifact.getDomain())
                .tags(artifact.getTags() != null ? List.copyOf(artifact.getTags()) : List.of())
                .accessCount(artifact.getAccessCount())
                .lastAccessedAt(artifact.getLastAccessedAt())
                .build();
    }

    private void requireRunning() {
        if (!running.get()) {
            throw new IllegalStateException("Memory bank is not running");
        }
    }

    private static List<String> normalizeTags(List<String> tags) {
        if (tags == null) {
            return new ArrayList<>();
        }
        return new ArrayList<>(tags.stream()
                .filter(tag -> tag != null && !tag.isBlank())
                .map(String::trim)
                .distinct()
                .toList());
    }

    private static Instant notBefore(Instant now, Instant floor) {
        return floor != null && now.isBefore(floor) ? floor : now;
    }

    private static void requireText(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new MemoryValidationException(field + " is required");
        }
    }

    private static void requireUnit(String field, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new MemoryValidationException(field + " must be within [0, 1]: " + value);
        }
    }

    private static void requirePositive(String field, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new MemoryValidationException(field + " must be positive: " + value);
        }
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.3f", value);
    }
}
