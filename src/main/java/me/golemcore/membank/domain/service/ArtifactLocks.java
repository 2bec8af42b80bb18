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

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-artifact mutual exclusion for read-modify-write sequences. Updates to
 * different artifacts never contend; readers never lock. A lock lives only
 * while some thread holds or waits for it, so the registry stays bounded by
 * the number of in-flight updates.
 */
@Component
public class ArtifactLocks {

    private final Map<String, LockEntry> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String reference, Supplier<T> action) {
        LockEntry entry = locks.compute(reference, (ref, existing) -> {
            LockEntry target = existing != null ? existing : new LockEntry();
            target.users++;
            return target;
        });
        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            locks.computeIfPresent(reference, (ref, existing) -> --existing.users == 0 ? null : existing);
        }
    }

    int size() {
        return locks.size();
    }

    // users is only touched inside compute/computeIfPresent for the entry's key
    private static final class LockEntry {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
