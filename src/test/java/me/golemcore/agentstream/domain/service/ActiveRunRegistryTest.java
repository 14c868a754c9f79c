package me.golemcore.agentstream.domain.service;

import me.golemcore.agentstream.domain.model.RunCancellation;
import me.golemcore.agentstream.domain.model.StopReason;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ActiveRunRegistryTest {

    private final ActiveRunRegistry registry = new ActiveRunRegistry();

    @Test
    void shouldRejectSecondRunOnSameConnection() {
        assertTrue(registry.register("conn-1", "run-1", "thread-1").isPresent());
        assertTrue(registry.register("conn-1", "run-2", "thread-1").isEmpty());
        assertTrue(registry.register("conn-2", "run-3", "thread-2").isPresent());

        assertEquals(2, registry.getActiveRunCount());
    }

    @Test
    void shouldCancelActiveRunOnce() {
        RunCancellation cancellation = registry.register("conn-1", "run-1", "thread-1").orElseThrow();

        assertTrue(registry.cancel("conn-1", StopReason.CLIENT_DISCONNECT));
        assertFalse(registry.cancel("conn-1", StopReason.ABORTED));

        assertEquals(Optional.of(StopReason.CLIENT_DISCONNECT), cancellation.getReason());
        StepVerifier.create(cancellation.whenCancelled())
                .expectNext(StopReason.CLIENT_DISCONNECT)
                .verifyComplete();
    }

    @Test
    void shouldIgnoreCancelWithoutActiveRun() {
        assertFalse(registry.cancel("conn-unknown", StopReason.CLIENT_DISCONNECT));
    }

    @Test
    void shouldReleaseOnlyMatchingRun() {
        registry.register("conn-1", "run-1", "thread-1");

        registry.release("conn-1", "run-other");
        assertTrue(registry.hasActiveRun("conn-1"));

        registry.release("conn-1", "run-1");
        assertFalse(registry.hasActiveRun("conn-1"));
        assertTrue(registry.register("conn-1", "run-2", "thread-1").isPresent());
    }
}
