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
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured output a producer hands to {@code MemoryBank.store()}. The payload
 * is opaque to the bank; only tags, domain and category feed indexing.
 *
 * <p>
 * {@code category} stays a string so malformed values can be rejected with a
 * validation error instead of failing during deserialization.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ProducerOutput {

    private String loopId;
    private String component;
    private String category;

    @Builder.Default
    private Map<String, Object> payload = new LinkedHashMap<>();

    @Builder.Default
    private List<String> tags = new ArrayList<>();

    private String domain;
    private Double producerConfidence;
    private Double consensusQuality;
    private Boolean constitutionalCompliance;

    @Builder.Default
    private List<String> violations = new ArrayList<>();

    private Double importance;
    private DecayCurve decayCurve;
    private Duration halfLife;
    private Instant expiresAt;
}
