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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.membank.domain.exception.GcPolicyConflictException;
import me.golemcore.membank.domain.exception.MemoryValidationException;
import me.golemcore.membank.domain.model.GcCancellationToken;
import me.golemcore.membank.domain.model.GcLogEntry;
import me.golemcore.membank.domain.model.GcPolicy;
import me.golemcore.membank.domain.model.GcSummary;
import me.golemcore.membank.domain.model.MemoryArtifact;
import me.golemcore.membank.domain.model.TrustEvent;
import me.golemcore.membank.domain.model.TrustEventKind;
import me.golemcore.membank.infrastructure.config.MemoryBankProperties;
import me.golemcore.membank.port.outbound.ArtifactRepositoryPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Policy-driven sweep that archives or deletes low-value artifacts.
 *
 * <p>
 * Every decision is taken on the artifact's decayed trust at sweep time and
 * committed independently under the artifact's lock, so a cancelled or failed
 * sweep leaves a consistent state behind. Artifacts that are already archived
 * or deleted are skipped, which makes repeated runs with the same policy
 * idempotent.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GarbageCollector {

    private static final String LOG_PREFIX = "[MemoryGc]";
    private static final String DEFAULT_POLICY_NAME = "adhoc";

    private final ArtifactRepositoryPort repository;
    private final MemoryIndex index;
    private final MemoryScoreModel scoreModel;
    private final TrustLedger ledger;
    private final ArtifactLocks locks;
    private final MemoryBankProperties properties;
    private final Clock clock;

    enum Action {
        KEEP, ARCHIVE, DELETE
    }

    record Decision(Action action, double trust, String reason) {

        static Decision keep(double trust) {
            return new Decision(Action.KEEP, trust, null);
        }
    }

    /**
     * Reject malformed policies before any artifact is scanned.
     *
     * @throws GcPolicyConflictException
     *             if the delete threshold is above the archive threshold
     * @throws MemoryValidationException
     *             for any other out-of-range value
     */
    public void validate(GcPolicy policy) {
        if (policy == null) {
            throw new MemoryValidationException("GC policy is required");
        }
        checkThreshold("archiveThreshold", policy.getArchiveThreshold());
        checkThreshold("deleteThreshold", policy.getDeleteThreshold());
        if (policy.getDeleteThreshold() > policy.getArchiveThreshold()) {
            throw new GcPolicyConflictException(String.format(Locale.ROOT,
                    "Delete threshold %.3f is above archive threshold %.3f",
                    policy.getDeleteThreshold(), policy.getArchiveThreshold()));
        }
        if (policy.getMaxAge() != null && (policy.getMaxAge().isNegative() || policy.getMaxAge().isZero())) {
            throw new MemoryValidationException("maxAge must be positive: " + policy.getMaxAge());
        }
        if (policy.getMaxArtifacts() != null && policy.getMaxArtifacts() < 0) {
            throw new MemoryValidationException("maxArtifacts must not be negative: " + policy.getMaxArtifacts());
        }
    }

    public GcSummary collect(GcPolicy policy, GcCancellationToken token) {
        validate(policy);
        GcCancellationToken cancellation = token != null ? token : GcCancellationToken.none();
        String policyName = policy.getName() != null && !policy.getName().isBlank()
                ? policy.getName()
                : DEFAULT_POLICY_NAME;
        Instant startedAt = clock.instant();

        log.info("{} Run '{}' started (archive<{}, delete<{}, maxAge={}, maxArtifacts={}, dryRun={})",
                LOG_PREFIX, policyName, policy.getArchiveThreshold(), policy.getDeleteThreshold(),
                policy.getMaxAge(), policy.getMaxArtifacts(), policy.isDryRun());

        int scanned = 0;
        int archived = 0;
        int deleted = 0;
        int evicted = 0;
        int failed = 0;
        boolean cancelled = false;
        List<MemoryArtifact> survivors = new ArrayList<>();
        List<String> candidates = index.lookup(policy.getScope());

        for (String reference : candidates) {
            if (cancellation.isCancelled()) {
                cancelled = true;
                break;
            }
            Optional<MemoryArtifact> snapshot = repository.find(reference);
            if (snapshot.isEmpty() || !snapshot.get().isLive()) {
                continue;
            }
            scanned++;
            try {
                Action applied = policy.isDryRun()
                        ? decide(snapshot.get(), policy, startedAt).action()
                        : locks.withLock(reference, () -> apply(reference, policy, policyName, startedAt));
                switch (applied) {
                case ARCHIVE -> archived++;
                case DELETE -> deleted++;
                case KEEP -> survivors.add(snapshot.get());
                }
            } catch (RuntimeException e) {
                failed++;
                log.warn("{} Failed to process {}: {}", LOG_PREFIX, reference, e.getMessage());
            }
        }

        Integer maxArtifacts = policy.getMaxArtifacts();
        int excess = !cancelled && maxArtifacts != null
                ? Math.min(survivors.size(), survivors.size() + liveOutsideScope(policy, candidates) - maxArtifacts)
                : 0;
        if (excess > 0) {
            List<MemoryArtifact> victims = evictionOrder(survivors, startedAt).subList(0, excess);
            for (MemoryArtifact victim : victims) {
                if (cancellation.isCancelled()) {
                    cancelled = true;
                    break;
                }
                try {
                    boolean done = policy.isDryRun()
                            || locks.withLock(victim.getReference(),
                                    () -> evict(victim.getReference(), maxArtifacts, policyName, startedAt));
                    if (done) {
                        evicted++;
                        archived++;
                    }
                } catch (RuntimeException e) {
                    failed++;
                    log.warn("{} Failed to evict {}: {}", LOG_PREFIX, victim.getReference(), e.getMessage());
                }
            }
        }

        GcSummary summary = GcSummary.builder()
                .policyName(policyName)
                .scanned(scanned)
                .archived(archived)
                .deleted(deleted)
                .evicted(evicted)
                .failed(failed)
                .dryRun(policy.isDryRun())
                .cancelled(cancelled)
                .duration(Duration.between(startedAt, clock.instant()))
                .timestamp(startedAt)
                .build();
        ledger.recordGcRun(GcLogEntry.of(policy, summary));

        log.info("{} Run '{}' {}: scanned={}, archived={} (evicted={}), deleted={}, failed={}{}",
                LOG_PREFIX, policyName, cancelled ? "cancelled" : "finished",
                scanned, archived, evicted, deleted, failed, policy.isDryRun() ? " [dry run]" : "");
        return summary;
    }

    Decision decide(MemoryArtifact artifact, GcPolicy policy, Instant now) {
        double trust = scoreModel.currentTrust(artifact, now);
        if (trust < policy.getDeleteThreshold()) {
            return new Decision(Action.DELETE, trust, String.format(Locale.ROOT,
                    "trust %.3f below delete threshold %.3f", trust, policy.getDeleteThreshold()));
        }
        if (trust < policy.getArchiveThreshold()) {
            return new Decision(Action.ARCHIVE, trust, String.format(Locale.ROOT,
                    "trust %.3f below archive threshold %.3f", trust, policy.getArchiveThreshold()));
        }
        if (policy.getMaxAge() != null && artifact.getCreatedAt() != null) {
            Duration age = Duration.between(artifact.getCreatedAt(), now);
            if (age.compareTo(policy.getMaxAge()) > 0) {
                return new Decision(Action.ARCHIVE, trust,
                        "age " + age + " exceeds max age " + policy.getMaxAge());
            }
        }
        if (artifact.isExpired(now)) {
            return new Decision(Action.ARCHIVE, trust, "expired at " + artifact.getExpiresAt());
        }
        return Decision.keep(trust);
    }

    private Action apply(String reference, GcPolicy policy, String policyName, Instant now) {
        Optional<MemoryArtifact> current = repository.find(reference);
        if (current.isEmpty() || !current.get().isLive()) {
            return Action.KEEP;
        }
        MemoryArtifact artifact = current.get();
        Decision decision = decide(artifact, policy, now);
        if (decision.action() == Action.ARCHIVE) {
            archive(artifact, decision.trust(), decision.reason(), policyName, now);
        } else if (decision.action() == Action.DELETE) {
            delete(artifact, decision.trust(), decision.reason(), policyName, now);
        }
        return decision.action();
    }

    private boolean evict(String reference, int maxArtifacts, String policyName, Instant now) {
        Optional<MemoryArtifact> current = repository.find(reference);
        if (current.isEmpty() || !current.get().isLive()) {
            return false;
        }
        double trust = scoreModel.currentTrust(current.get(), now);
        archive(current.get(), trust, "over capacity (max " + maxArtifacts + " live artifacts)", policyName, now);
        return true;
    }

    private void archive(MemoryArtifact artifact, double trust, String reason, String policyName, Instant now) {
        repository.save(artifact.toBuilder()
                .archived(true)
                .updatedAt(now)
                .lifecycleReason(reason)
                .build());
        record(artifact, TrustEventKind.GC_ARCHIVE, trust, reason, policyName, now);
        log.debug("{} Archived {}: {}", LOG_PREFIX, artifact.getReference(), reason);
    }

    private void delete(MemoryArtifact artifact, double trust, String reason, String policyName, Instant now) {
        String reference = artifact.getReference();
        repository.save(artifact.toBuilder()
                .deleted(true)
                .updatedAt(now)
                .lifecycleReason(reason)
                .build());
        index.remove(reference);
        if (properties.getGc().isPurgeDeleted()) {
            repository.delete(reference);
        }
        record(artifact, TrustEventKind.GC_DELETE, trust, reason, policyName, now);
        log.debug("{} Deleted {}: {}", LOG_PREFIX, reference, reason);
    }

    private void record(MemoryArtifact artifact, TrustEventKind kind, double decayedTrust, String reason,
            String policyName, Instant now) {
        ledger.record(TrustEvent.builder()
                .reference(artifact.getReference())
                .kind(kind)
                .reason(reason)
                .trustBefore(artifact.getTrust())
                .trustAfter(decayedTrust)
                .actor("gc:" + policyName)
                .timestamp(now)
                .build());
    }

    /**
     * Live artifacts the scope did not select. They count toward the capacity
     * but are never evicted by a scoped run.
     */
    private int liveOutsideScope(GcPolicy policy, List<String> candidates) {
        if (policy.getScope() == null || !policy.getScope().hasIndexedFilter()) {
            return 0;
        }
        Set<String> scoped = new HashSet<>(candidates);
        return (int) repository.findAll().stream()
                .filter(MemoryArtifact::isLive)
                .filter(artifact -> !scoped.contains(artifact.getReference()))
                .count();
    }

    /**
     * Lowest eviction rank first: rank with zero relevance and recency, then
     * lower trust, then older, then reference order.
     */
    private List<MemoryArtifact> evictionOrder(List<MemoryArtifact> survivors, Instant now) {
        record Candidate(MemoryArtifact artifact, double trust, double rank) {
        }
        return survivors.stream()
                .map(a -> {
                    double trust = scoreModel.currentTrust(a, now);
                    return new Candidate(a, trust, scoreModel.computeRank(trust, 0.0, 0.0, a.getImportance()));
                })
                .sorted(Comparator.comparingDouble(Candidate::rank)
                        .thenComparingDouble(Candidate::trust)
                        .thenComparing(c -> c.artifact().getCreatedAt(),
                                Comparator.nullsFirst(Comparator.naturalOrder()))
                        .thenComparing(c -> c.artifact().getReference()))
                .map(Candidate::artifact)
                .toList();
    }

    private static void checkThreshold(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new MemoryValidationException(name + " must be within [0, 1]: " + value);
        }
    }
}
