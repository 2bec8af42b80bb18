package me.golemcore.membank.adapter.outbound.storage;

import me.golemcore.membank.domain.exception.MemoryStorageException;
import me.golemcore.membank.domain.model.DecayCurve;
import me.golemcore.membank.domain.model.MemoryArtifact;
import me.golemcore.membank.domain.model.OutputCategory;
import me.golemcore.membank.infrastructure.config.MemoryBankConfiguration;
import me.golemcore.membank.infrastructure.config.MemoryBankProperties;
import me.golemcore.membank.testsupport.InMemoryStoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StorageArtifactRepositoryTest {

    private static final Instant CREATED = Instant.parse("2026-03-01T12:00:00Z");

    private MemoryBankProperties properties;
    private InMemoryStoragePort storage;
    private StorageArtifactRepository repository;

    @BeforeEach
    void setUp() {
        properties = new MemoryBankProperties();
        storage = new InMemoryStoragePort();
        repository = newRepository();
    }

    @Test
    void shouldPersistAndReloadArtifact() {
        repository.save(artifact("mem_a", 0.75));

        StorageArtifactRepository reloaded = newRepository();
        reloaded.load();

        MemoryArtifact loaded = reloaded.find("mem_a").orElseThrow();
        assertEquals(0.75, loaded.getTrust());
        assertEquals(OutputCategory.REASONING, loaded.getCategory());
        assertEquals(DecayCurve.HYPERBOLIC, loaded.getDecayCurve());
        assertEquals(Duration.ofDays(7), loaded.getHalfLife());
        assertEquals(CREATED, loaded.getCreatedAt());
        assertEquals(List.of("cve"), loaded.getTags());
        assertEquals("exploit found", loaded.getPayload().get("summary"));
    }

    @Test
    void shouldWriteIsoDatesAndDurations() {
        repository.save(artifact("mem_a", 0.75));

        String json = storage.raw("artifacts", "mem_a.json");

        assertTrue(json.contains("\"createdAt\":\"2026-03-01T12:00:00Z\""));
        assertTrue(json.contains("\"halfLife\":\"PT168H\""));
        assertTrue(json.contains("\"category\":\"REASONING\""));
    }

    @Test
    void shouldSkipCorruptFilesOnLoad() {
        repository.save(artifact("mem_a", 0.75));
        storage.putRaw("artifacts", "mem_broken.json", "{not json");
        storage.putRaw("artifacts", "mem_empty.json", "");
        storage.putRaw("artifacts", "notes.txt", "ignored");

        StorageArtifactRepository reloaded = newRepository();
        reloaded.load();

        assertEquals(1, reloaded.count());
        assertTrue(reloaded.find("mem_a").isPresent());
    }

    @Test
    void shouldKeepPreviousVersionWhenWriteFails() {
        repository.save(artifact("mem_a", 0.75));
        storage.failWritesTo("artifacts", true);

        assertThrows(MemoryStorageException.class, () -> repository.save(artifact("mem_a", 0.10)));

        assertEquals(0.75, repository.find("mem_a").orElseThrow().getTrust());
        assertTrue(storage.raw("artifacts", "mem_a.json").contains("0.75"));
    }

    @Test
    void shouldPurgeArtifact() {
        repository.save(artifact("mem_a", 0.75));

        repository.delete("mem_a");

        assertFalse(repository.find("mem_a").isPresent());
        assertEquals(0, storage.fileCount("artifacts"));
    }

    @Test
    void shouldListArtifactsInReferenceOrder() {
        repository.save(artifact("mem_c", 0.1));
        repository.save(artifact("mem_a", 0.2));
        repository.save(artifact("mem_b", 0.3));

        assertEquals(List.of("mem_a", "mem_b", "mem_c"),
                repository.findAll().stream().map(MemoryArtifact::getReference).toList());
        assertEquals(List.of("mem_b", "mem_c"),
                repository.findAll(List.of("mem_b", "mem_missing", "mem_c")).stream()
                        .map(MemoryArtifact::getReference)
                        .toList());
    }

    @Test
    void shouldIsolateCachedArtifactFromCallers() {
        MemoryArtifact saved = artifact("mem_a", 0.75);
        saved.setTags(new ArrayList<>(List.of("cve")));
        repository.save(saved);
        saved.setTrust(0.01);
        saved.getTags().clear();

        MemoryArtifact found = repository.find("mem_a").orElseThrow();
        found.setDeleted(true);
        found.getViolations().add("injected");
        repository.findAll().get(0).setArchived(true);

        MemoryArtifact stored = repository.find("mem_a").orElseThrow();
        assertEquals(0.75, stored.getTrust());
        assertEquals(List.of("cve"), stored.getTags());
        assertFalse(stored.isDeleted());
        assertFalse(stored.isArchived());
        assertTrue(stored.getViolations().isEmpty());
    }

    @Test
    void shouldReturnEmptyForNullReference() {
        assertTrue(repository.find(null).isEmpty());
    }

    private StorageArtifactRepository newRepository() {
        return new StorageArtifactRepository(storage, MemoryBankConfiguration.objectMapper(), properties);
    }

    private static MemoryArtifact artifact(String reference, double trust) {
        return MemoryArtifact.builder()
                .reference(reference)
                .loopId("loop-1")
                .component("hunter")
                .category(OutputCategory.REASONING)
                .payload(Map.of("summary", "exploit found"))
                .tags(List.of("cve"))
                .trust(trust)
                .decayCurve(DecayCurve.HYPERBOLIC)
                .halfLife(Duration.ofDays(7))
                .constitutionalCompliance(true)
                .createdAt(CREATED)
                .build();
    }
}
