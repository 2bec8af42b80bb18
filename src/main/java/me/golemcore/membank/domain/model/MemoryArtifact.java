package me.golemcore.membank.domain.model;

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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A single producer output held by the memory bank together with its trust
 * signals, decay configuration, usage counters and lifecycle flags.
 *
 * <p>
 * Instances handed out by the repository are private snapshots: writers copy
 * them via {@code toBuilder()} and save the copy, and changing a snapshot never
 * changes the stored artifact.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class MemoryArtifact {

    private String reference;
    private String loopId;
    private String component;
    private OutputCategory category;

    @Builder.Default
    private Map<String, Object> payload = new LinkedHashMap<>();

    @Builder.Default
    private List<String> tags = new ArrayList<>();

    private String domain;

    private double trust;
    private double provenance;
    private double consensus;
    private double governance;
    private double usage;

    private double producerConfidence;
    private double importance;

    private DecayCurve decayCurve;
    private Duration halfLife;

    private long accessCount;
    private long successCount;
    private long failureCount;
    private Instant lastAccessedAt;

    private boolean constitutionalCompliance;

    @Builder.Default
    private List<String> violations = new ArrayList<>();

    private boolean requiresManualReview;

    private Instant createdAt;
    private Instant updatedAt;
    private Instant expiresAt;
    private Instant lastRescoredAt;

    private boolean archived;
    private boolean deleted;
    private String lifecycleReason;

    /**
     * Independent copy; payload, tags and violations are copied too.
     */
    public MemoryArtifact copy() {
        return toBuilder()
                .payload(payload != null ? new LinkedHashMap<>(payload) : new LinkedHashMap<>())
                .tags(tags != null ? new ArrayList<>(tags) : new ArrayList<>())
                .violations(violations != null ? new ArrayList<>(violations) : new ArrayList<>())
                .build();
    }

    @JsonIgnore
    public boolean isLive() {
        return !archived && !deleted;
    }

    @JsonIgnore
    public boolean isExpired(Instant now) {
        return expiresAt != null && now.isAfter(expiresAt);
    }

    /**
     * Start of the decay clock: the last explicit re-score, or creation.
     */
    @JsonIgnore
    public Instant getDecayReference() {
        return lastRescoredAt != null ? lastRescoredAt : createdAt;
    }

    @JsonIgnore
    public TrustSignals getSignals() {
        return TrustSignals.builder()
                .provenance(provenance)
                .consensus(consensus)
                .governance(governance)
                .usage(usage)
                .build();
    }

    @JsonIgnore
    public double getSuccessRate() {
        long judged = successCount + failureCount;
        if (judged == 0) {
            return 0.0;
        }
        return (double) successCount / (double) judged;
    }
}
