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

/**
 * Retrieval filters. {@code minTrust} applies to decayed trust. The two
 * {@code include*} flags are meant for audit tooling only.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MemoryFilters {

    private String component;
    private OutputCategory category;
    private String loopId;
    private String domain;
    private String tag;
    private Double minTrust;
    private boolean includeNonCompliant;
    private boolean includeArchived;

    public static MemoryFilters none() {
        return new MemoryFilters();
    }

    public boolean hasIndexedFilter() {
        return component != null || category != null || loopId != null || domain != null || tag != null;
    }
}
