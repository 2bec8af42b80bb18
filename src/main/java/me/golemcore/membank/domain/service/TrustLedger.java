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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.membank.domain.model.GcLogEntry;
import me.golemcore.membank.domain.model.TrustEvent;
import me.golemcore.membank.infrastructure.config.MemoryBankProperties;
import me.golemcore.membank.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Append-only audit trail of trust changes and garbage collection runs.
 *
 * <p>
 * Each artifact has its own JSONL file under the ledger directory; every
 * collection run appends one row to {@code gc/runs.jsonl}. Rows are never
 * rewritten. A failed append is logged as an audit gap and counted; it never
 * fails the operation that produced the event.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TrustLedger {

    private static final String LOG_PREFIX = "[Ledger]";
    private static final String JSONL_EXTENSION = ".jsonl";
    private static final String GC_RUNS_FILE = "runs" + JSONL_EXTENSION;
    private static final String NEWLINE = "\n";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final MemoryBankProperties properties;

    private final AtomicLong auditGaps = new AtomicLong();

    /**
     * Append a trust event to the artifact's ledger.
     *
     * @return {@code true} if the row was written
     */
    public boolean record(TrustEvent event) {
        return append(ledgerDir(), event.getReference() + JSONL_EXTENSION, event,
                event.getKind() + " for " + event.getReference());
    }

    /**
     * Trust history of one artifact, oldest first. Malformed rows are skipped.
     */
    public List<TrustEvent> history(String reference) {
        List<TrustEvent> events = readLines(ledgerDir(), reference + JSONL_EXTENSION, TrustEvent.class);
        return events.stream()
                .sorted(Comparator.comparing(TrustEvent::getTimestamp,
                        Comparator.nullsFirst(Comparator.naturalOrder())))
                .toList();
    }

    public boolean hasHistory(String reference) {
        try {
            return Boolean.TRUE.equals(storagePort.exists(ledgerDir(), reference + JSONL_EXTENSION).join());
        } catch (RuntimeException e) {
            log.warn("{} Failed to check ledger for {}: {}", LOG_PREFIX, reference, e.getMessage());
            return false;
        }
    }

    public boolean recordGcRun(GcLogEntry entry) {
        return append(gcDir(), GC_RUNS_FILE, entry, "GC run " + entry.getPolicyName());
    }

    /**
     * Most recent garbage collection runs, newest first.
     */
    public List<GcLogEntry> recentGcRuns(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        List<GcLogEntry> runs = readLines(gcDir(), GC_RUNS_FILE, GcLogEntry.class);
        List<GcLogEntry> newestFirst = new ArrayList<>(runs);
        Collections.reverse(newestFirst);
        return newestFirst.stream().limit(limit).toList();
    }

    public long getAuditGapCount() {
        return auditGaps.get();
    }

    private boolean append(String dir, String file, Object row, String description) {
        try {
            String line = objectMapper.writeValueAsString(row) + NEWLINE;
            storagePort.appendText(dir, file, line).join();
            return true;
        } catch (JsonProcessingException | RuntimeException e) {
            long gaps = auditGaps.incrementAndGet();
            log.warn("{} Audit gap #{}: failed to record {}: {}", LOG_PREFIX, gaps, description, e.getMessage());
            return false;
        }
    }

    private <T> List<T> readLines(String dir, String file, Class<T> type) {
        String content;
        try {
            content = storagePort.getText(dir, file).join();
        } catch (RuntimeException e) {
            log.warn("{} Failed to read {}/{}: {}", LOG_PREFIX, dir, file, e.getMessage());
            return List.of();
        }
        if (content == null || content.isBlank()) {
            return List.of();
        }

        List<T> rows = new ArrayList<>();
        int skipped = 0;
        for (String line : content.split("\\R")) {
            if (line.isBlank()) {
                continue;
            }
            try {
                rows.add(objectMapper.readValue(line, type));
            } catch (JsonProcessingException e) {
                skipped++;
            }
        }
        if (skipped > 0) {
            log.warn("{} Skipped {} malformed rows in {}/{}", LOG_PREFIX, skipped, dir, file);
        }
        return rows;
    }

    private String ledgerDir() {
        return properties.getStorage().getDirectories().getLedger();
    }

    private String gcDir() {
        return properties.getStorage().getDirectories().getGc();
    }
}
