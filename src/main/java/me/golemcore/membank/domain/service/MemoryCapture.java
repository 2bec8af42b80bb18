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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.membank.domain.model.MemoryRef;
import me.golemcore.membank.domain.model.ProducerOutput;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Higher-order wrapper that stores a producer's return value in the memory
 * bank after the producer completes.
 *
 * <p>
 * The producer's own result and exceptions always win: a mapping or storage
 * failure is logged and the producer's result is still returned. A mapper may
 * return {@code null} to skip capturing a particular result.
 *
 * <pre>{@code
 * Function<Query, Plan> planner = capture.wrap(this::plan,
 *         (query, plan) -> ProducerOutput.builder()
 *                 .loopId(query.loopId())
 *                 .component("planner")
 *                 .category("decision")
 *                 .payload(plan.toMap())
 *                 .producerConfidence(plan.confidence())
 *                 .build());
 * }</pre>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MemoryCapture {

    private final MemoryBank memoryBank;

    /**
     * Run {@code producer} once and capture its result.
     */
    public <T> T capture(Supplier<T> producer, Function<? super T, ProducerOutput> mapper) {
        T result = producer.get();
        store(() -> mapper.apply(result));
        return result;
    }

    /**
     * Wrap {@code producer} so every invocation captures its result.
     */
    public <I, T> Function<I, T> wrap(Function<I, T> producer,
            BiFunction<? super I, ? super T, ProducerOutput> mapper) {
        return input -> {
            T result = producer.apply(input);
            store(() -> mapper.apply(input, result));
            return result;
        };
    }

    Optional<MemoryRef> store(Supplier<ProducerOutput> output) {
        try {
            ProducerOutput mapped = output.get();
            if (mapped == null) {
                return Optional.empty();
            }
            MemoryRef ref = memoryBank.store(mapped);
            log.debug("[MemoryCapture] Captured {} from {} as {}", mapped.getCategory(), mapped.getComponent(),
                    ref.getReference());
            return Optional.of(ref);
        } catch (RuntimeException e) {
            log.warn("[MemoryCapture] Failed to capture producer output: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
