package me.golemcore.membank.port.outbound;

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

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Durable home of memory artifacts, keyed by reference.
 *
 * <p>
 * Implementations return immutable snapshots from {@link #find} and
 * {@link #findAll}; callers must {@link #save} a modified copy rather than
 * mutate what they were given.
 */
public interface ArtifactRepositoryPort {

    Optional<MemoryArtifact> find(String reference);

    /**
     * Persist the artifact, replacing any previous version. The artifact is
     * visible to {@link #find} only once it is durable.
     */
    void save(MemoryArtifact artifact);

    /**
     * Physically remove an artifact document.
     */
    void delete(String reference);

    List<MemoryArtifact> findAll();

    List<MemoryArtifact> findAll(Collection<String> references);

    int count();
}
