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

import lombok.Builder;
import lombok.Data;

/**
 * Point-in-time counters for operators: artifact population by lifecycle
 * state, candidates skipped by reads, and ledger appends that failed.
 */
@Data
@Builder
public class MemoryBankDiagnostics {

    private int liveArtifacts;
    private int archivedArtifacts;
    private int deletedArtifacts;
    private int nonCompliantArtifacts;
    private int indexedReferences;
    private long readSkips;
    private long auditGaps;
    private boolean running;
}
