package me.golemcore.membank.domain.service;

import me.golemcore.membank.domain.exception.MemoryStorageException;
import me.golemcore.membank.domain.model.MemoryRef;
import me.golemcore.membank.domain.model.ProducerOutput;
import me.golemcore.membank.domain.model.StoreStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MemoryCaptureTest {

    private MemoryBank memoryBank;
    private MemoryCapture capture;

    @BeforeEach
    void setUp() {
        memoryBank = mock(MemoryBank.class);
        capture = new MemoryCapture(memoryBank);
        when(memoryBank.store(any())).thenReturn(MemoryRef.builder()
                .reference("mem_0123456789abcdef")
                .status(StoreStatus.ACCEPTED)
                .build());
    }

    @Test
    void shouldStoreMappedResultAndReturnIt() {
        String result = capture.capture(() -> "plan-a", plan -> output(plan));

        assertEquals("plan-a", result);
        verify(memoryBank).store(output("plan-a"));
    }

    @Test
    void shouldCaptureEveryInvocationOfWrappedProducer() {
        Function<Integer, String> producer = capture.wrap(n -> "step-" + n,
                (n, step) -> ProducerOutput.builder()
                        .loopId("loop-" + n)
                        .component("planner")
                        .category("action")
                        .payload(Map.of("step", step))
                        .build());

        assertEquals("step-1", producer.apply(1));
        assertEquals("step-2", producer.apply(2));

        verify(memoryBank, times(2)).store(any());
    }

    @Test
    void shouldSkipWhenMapperReturnsNull() {
        String result = capture.capture(() -> "ignored", value -> null);

        assertEquals("ignored", result);
        verify(memoryBank, never()).store(any());
    }

    @Test
    void shouldReturnProducerResultWhenStoreFails() {
        when(memoryBank.store(any())).thenThrow(new MemoryStorageException("disk full"));

        String result = capture.capture(() -> "still-here", plan -> output(plan));

        assertEquals("still-here", result);
    }

    @Test
    void shouldReturnProducerResultWhenMapperFails() {
        String result = capture.capture(() -> "still-here", plan -> {
            throw new IllegalStateException("bad mapping");
        });

        assertEquals("still-here", result);
        verify(memoryBank, never()).store(any());
    }

    @Test
    void shouldPropagateProducerFailureWithoutStoring() {
        assertThrows(IllegalArgumentException.class, () -> capture.capture(() -> {
            throw new IllegalArgumentException("producer failed");
        }, value -> output("unused")));

        verify(memoryBank, never()).store(any());
    }

    @Test
    void shouldExposeStoredReference() {
        Optional<MemoryRef> ref = capture.store(() -> output("plan-b"));

        assertTrue(ref.isPresent());
        assertEquals("mem_0123456789abcdef", ref.get().getReference());
    }

    private static ProducerOutput output(String plan) {
        return ProducerOutput.builder()
                .loopId("loop-1")
                .component("planner")
                .category("decision")
                .payload(Map.of("plan", plan))
                .build();
    }
}
