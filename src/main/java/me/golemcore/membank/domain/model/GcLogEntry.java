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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * Persisted row of the garbage collection log, one per run.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GcLogEntry {

    private String policyName;
    private int scanned;
    private int archived;
    private int deleted;
    private int evicted;
    private int failed;
    private double archiveThreshold;
    private double deleteThreshold;
    private Duration maxAge;
    private Integer maxArtifacts;
    private boolean dryRun;
    private boolean cancelled;
    private Duration duration;
    private Instant timestamp;

    public static GcLogEntry of(GcPolicy policy, GcSummary summary) {
        return GcLogEntry.builder()
                .policyName(summary.getPolicyName())
                .scanned(summary.getScanned())
                .archived(summary.getArchived())
                .deleted(summary.getDeleted())
                .evicted(summary.getEvicted())
                .failed(summary.getFailed())
                .archiveThreshold(policy.getArchiveThreshold())
                .deleteThreshold(policy.getDeleteThreshold())
                .maxAge(policy.getMaxAge())
                .maxArtifacts(policy.getMaxArtifacts())
                .dryRun(summary.isDryRun())
                .cancelled(summary.isCancelled())
                .duration(summary.getDuration())
                .timestamp(summary.getTimestamp())
                .build();
    }
}
