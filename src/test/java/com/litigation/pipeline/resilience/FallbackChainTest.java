package com.litigation.pipeline.resilience;

import com.litigation.pipeline.core.OperationCancelledException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class FallbackChainTest {

    @Test
    @DisplayName("Should return the first strategy that produces a value")
    void testFirstValueWins() {
        List<String> called = new ArrayList<>();
        FallbackChain<String> chain = FallbackChain.<String>builder("test")
                .then("primary", () -> {
                    called.add("primary");
                    return Optional.empty();
                })
                .then("secondary", () -> {
                    called.add("secondary");
                    return Optional.of("value");
                })
                .then("tertiary", () -> {
                    called.add("tertiary");
                    return Optional.of("unused");
                })
                .build();

        FallbackChain.Outcome<String> outcome = chain.execute();

        assertEquals("value", outcome.value());
        assertEquals("secondary", outcome.strategy());
        assertEquals(List.of("primary", "secondary"), called);
        assertEquals("declined", outcome.attempts().get(0).detail());
    }

    @Test
    @DisplayName("Should move past a strategy that throws")
    void testFailureMovesOn() {
        FallbackChain.Outcome<String> outcome = FallbackChain.<String>builder("test")
                .then("broken", () -> {
                    throw new IllegalStateException("boom");
                })
                .then("backup", () -> Optional.of("ok"))
                .build()
                .execute();

        assertEquals("backup", outcome.strategy());
        assertFalse(outcome.attempts().get(0).succeeded());
        assertTrue(outcome.attempts().get(0).detail().contains("boom"));
    }

    @Test
    @DisplayName("Should abort on propagated exception types")
    void testPropagate() {
        FallbackChain<String> chain = FallbackChain.<String>builder("test")
                .propagate(OperationCancelledException.class)
                .then("cancelled", () -> {
                    throw new OperationCancelledException("stop");
                })
                .then("never", () -> Optional.of("unreachable"))
                .build();

        assertThrows(OperationCancelledException.class, chain::execute);
    }

    @Test
    @DisplayName("Should report an empty outcome when every strategy declines")
    void testAllDecline() {
        FallbackChain.Outcome<String> outcome = FallbackChain.<String>builder("test")
                .then("a", Optional::empty)
                .then("b", Optional::empty)
                .build()
                .execute();

        assertFalse(outcome.isPresent());
        assertNull(outcome.strategy());
        assertEquals(2, outcome.attempts().size());
    }

    @Test
    @DisplayName("Should refuse to build an empty chain")
    void testEmptyChain() {
        assertThrows(IllegalStateException.class, () -> FallbackChain.<String>builder("empty").build());
    }
}
