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

import java.time.Duration;
import java.time.Instant;

/**
 * Result of one garbage collection run. In dry-run mode the counts are
 * projections. {@code evicted} is the part of {@code archived} caused by the
 * artifact cap.
 */
@Data
@Builder
public class GcSummary {

    private String policyName;
    private int scanned;
    private int archived;
    private int deleted;
    private int evicted;
    private int failed;
    private boolean dryRun;
    private boolean cancelled;
    private Duration duration;
    private Instant timestamp;
}
