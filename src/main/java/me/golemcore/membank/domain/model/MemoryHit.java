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

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Ranked read result. {@code trust} is the decayed trust at query time.
 */
@Data
@Builder
public class MemoryHit {

    private String reference;
    private Map<String, Object> payload;
    private double trust;
    private double rank;
    private String component;
    private OutputCategory category;
    private Instant createdAt;

    private String loopId;
    private String domain;
    private List<String> tags;
    private long accessCount;
    private Instant lastAccessedAt;
}
