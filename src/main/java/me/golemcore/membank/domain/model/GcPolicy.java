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

/**
 * Named garbage collection policy.
 *
 * <p>
 * Artifacts whose decayed trust falls below {@code deleteThreshold} are
 * deleted; those below {@code archiveThreshold}, older than {@code maxAge} or
 * past their expiry are archived. When more than {@code maxArtifacts} live
 * artifacts remain, the lowest ranked are archived until the cap holds.
 * {@code scope} optionally narrows the sweep with the same filters reads use.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GcPolicy {

    private String name;

    @Builder.Default
    private double archiveThreshold = 0.2;

    @Builder.Default
    private double deleteThreshold = 0.1;

    private Duration maxAge;
    private Integer maxArtifacts;
    private boolean dryRun;
    private MemoryFilters scope;
}
