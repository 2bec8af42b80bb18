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

import me.golemcore.membank.domain.model.MemoryArtifact;
import me.golemcore.membank.domain.model.MemoryFilters;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory secondary indexes over live and archived artifacts, keyed by
 * component, category, loop, domain and tag. Values are normalized to trimmed
 * lower case. Deleted artifacts are removed from every index.
 */
@Component
public class MemoryIndex {

    enum Dimension {
        COMPONENT, CATEGORY, LOOP_ID, DOMAIN, TAG
    }

    private final Map<Dimension, Map<String, Set<String>>> indexes = new EnumMap<>(Dimension.class);
    private final Set<String> allReferences = ConcurrentHashMap.newKeySet();

    public MemoryIndex() {
        for (Dimension dimension : Dimension.values()) {
            indexes.put(dimension, new ConcurrentHashMap<>());
        }
    }

    public void add(MemoryArtifact artifact) {
        String reference = artifact.getReference();
        put(Dimension.COMPONENT, artifact.getComponent(), reference);
        put(Dimension.CATEGORY, artifact.getCategory() != null ? artifact.getCategory().value() : null, reference);
        put(Dimension.LOOP_ID, artifact.getLoopId(), reference);
        put(Dimension.DOMAIN, artifact.getDomain(), reference);
        if (artifact.getTags() != null) {
            for (String tag : artifact.getTags()) {
                put(Dimension.TAG, tag, reference);
            }
        }
        allReferences.add(reference);
    }

    public void remove(String reference) {
        allReferences.remove(reference);
        for (Map<String, Set<String>> index : indexes.values()) {
            for (String key : List.copyOf(index.keySet())) {
                // per-key atomic with put(): an emptied set never swallows a concurrent add
                index.computeIfPresent(key, (k, refs) -> {
                    refs.remove(reference);
                    return refs.isEmpty() ? null : refs;
                });
            }
        }
    }

    /**
     * Candidate references for the given filters: the intersection of every
     * indexed filter that is set, or every known reference when none is.
     * Non-indexed filters ({@code minTrust}, compliance, archival) are left to
     * the caller.
     */
    public List<String> lookup(MemoryFilters filters) {
        if (filters == null || !filters.hasIndexedFilter()) {
            return allReferences.stream().sorted().toList();
        }

        List<Set<String>> matches = new ArrayList<>();
        addMatch(matches, Dimension.COMPONENT, filters.getComponent());
        addMatch(matches, Dimension.CATEGORY, filters.getCategory() != null ? filters.getCategory().value() : null);
        addMatch(matches, Dimension.LOOP_ID, filters.getLoopId());
        addMatch(matches, Dimension.DOMAIN, filters.getDomain());
        addMatch(matches, Dimension.TAG, filters.getTag());

        if (matches.isEmpty()) {
            return allReferences.stream().sorted().toList();
        }
        matches.sort(Comparator.comparingInt(Set::size));
        Set<String> result = new LinkedHashSet<>(matches.get(0));
        for (int i = 1; i < matches.size() && !result.isEmpty(); i++) {
            result.retainAll(matches.get(i));
        }
        return result.stream().sorted().toList();
    }

    public void clear() {
        allReferences.clear();
        indexes.values().forEach(Map::clear);
    }

    public int size() {
        return allReferences.size();
    }

    private void addMatch(List<Set<String>> matches, Dimension dimension, String value) {
        String key = normalize(value);
        if (key == null) {
            return;
        }
        Set<String> refs = indexes.get(dimension).get(key);
        matches.add(refs != null ? Set.copyOf(refs) : Set.of());
    }

    private void put(Dimension dimension, String value, String reference) {
        String key = normalize(value);
        if (key == null) {
            return;
        }
        indexes.get(dimension).compute(key, (k, refs) -> {
            Set<String> target = refs != null ? refs : ConcurrentHashMap.<String>newKeySet();
            target.add(reference);
            return target;
        });
    }

    static String normalize(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim().toLowerCase(Locale.ROOT);
    }
}
