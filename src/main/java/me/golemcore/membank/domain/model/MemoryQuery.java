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
import java.util.function.ToDoubleFunction;

/**
 * Ranking inputs for a read. Relevance is computed outside the bank and
 * supplied per artifact through {@code relevanceScorer}; when absent every
 * candidate gets {@code defaultRelevance}. Recency is normalized over
 * {@code recencyWindow}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MemoryQuery {

    private ToDoubleFunction<MemoryArtifact> relevanceScorer;
    private Double defaultRelevance;
    private Duration recencyWindow;

    public static MemoryQuery defaults() {
        return new MemoryQuery();
    }
}
