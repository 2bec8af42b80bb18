package me.golemcore.membank.adapter.outbound.storage;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.membank.domain.exception.MemoryStorageException;
import me.golemcore.membank.domain.model.MemoryArtifact;
import me.golemcore.membank.infrastructure.config.MemoryBankProperties;
import me.golemcore.membank.port.outbound.ArtifactRepositoryPort;
import me.golemcore.membank.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Artifact repository backed by {@link StoragePort}: one JSON document per
 * artifact at {@code artifacts/<reference>.json}, fronted by an in-memory
 * cache that is populated at startup.
 *
 * <p>
 * The cache only ever holds snapshots that are already on disk; a failed write
 * leaves the previous version visible. Artifacts are copied on the way in and
 * on the way out, so callers never share an instance with the cache.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StorageArtifactRepository implements ArtifactRepositoryPort {

    private static final String LOG_PREFIX = "[Artifacts]";
    private static final String JSON_EXTENSION = ".json";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final MemoryBankProperties properties;

    private final Map<String, MemoryArtifact> cache = new ConcurrentHashMap<>();

    @PostConstruct
    public void load() {
        String dir = artifactsDir();
        List<String> files;
        try {
            files = storagePort.listObjects(dir, "").join();
        } catch (RuntimeException e) {
            throw new MemoryStorageException("Failed to list stored artifacts", e);
        }

        int loaded = 0;
        int skipped = 0;
        for (String file : files) {
            if (!file.endsWith(JSON_EXTENSION)) {
                continue;
            }
            Optional<MemoryArtifact> artifact = readFile(dir, file);
            if (artifact.isPresent() && artifact.get().getReference() != null) {
                cache.put(artifact.get().getReference(), artifact.get());
                loaded++;
            } else {
                skipped++;
            }
        }
        log.info("{} Loaded {} artifacts from storage (skipped {} unreadable)", LOG_PREFIX, loaded, skipped);
    }

    @Override
    public Optional<MemoryArtifact> find(String reference) {
        if (reference == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(cache.get(reference)).map(MemoryArtifact::copy);
    }

    @Override
    public void save(MemoryArtifact artifact) {
        String reference = Objects.requireNonNull(artifact.getReference(), "reference");
        String json;
        try {
            json = objectMapper.writeValueAsString(artifact);
        } catch (JsonProcessingException e) {
            throw new MemoryStorageException("Failed to serialize artifact: " + reference, e);
        }
        try {
            storagePort.putTextAtomic(artifactsDir(), fileName(reference), json).join();
        } catch (RuntimeException e) {
            throw new MemoryStorageException("Failed to persist artifact: " + reference, e);
        }
        cache.put(reference, artifact.copy());
        log.debug("{} Saved artifact: {}", LOG_PREFIX, reference);
    }

    @Override
    public void delete(String reference) {
        try {
            storagePort.deleteObject(artifactsDir(), fileName(reference)).join();
        } catch (RuntimeException e) {
            throw new MemoryStorageException("Failed to delete artifact: " + reference, e);
        }
        cache.remove(reference);
        log.debug("{} Purged artifact: {}", LOG_PREFIX, reference);
    }

    @Override
    public List<MemoryArtifact> findAll() {
        return cache.values().stream()
                .sorted(Comparator.comparing(MemoryArtifact::getReference))
                .map(MemoryArtifact::copy)
                .toList();
    }

    @Override
    public List<MemoryArtifact> findAll(Collection<String> references) {
        return references.stream()
                .map(cache::get)
                .filter(Objects::nonNull)
                .map(MemoryArtifact::copy)
                .toList();
    }

    @Override
    public int count() {
        return cache.size();
    }

    private Optional<MemoryArtifact> readFile(String dir, String file) {
        try {
            String json = storagePort.getText(dir, file).join();
            if (json == null || json.isBlank()) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json, MemoryArtifact.class));
        } catch (JsonProcessingException | RuntimeException e) { // NOSONAR - a corrupt file must not block startup
            log.warn("{} Skipping unreadable artifact file {}: {}", LOG_PREFIX, file, e.getMessage());
            return Optional.empty();
        }
    }

    private String artifactsDir() {
        return properties.getStorage().getDirectories().getArtifacts();
    }

    private static String fileName(String reference) {
        return reference + JSON_EXTENSION;
    }
}
