package me.golemcore.agentstream.domain.service;

import me.golemcore.agentstream.domain.model.RawEngineEvent;
import me.golemcore.agentstream.domain.model.RunRequest;
import me.golemcore.agentstream.infrastructure.config.AgentStreamProperties;
import me.golemcore.agentstream.port.outbound.AgentEnginePort;
import me.golemcore.agentstream.port.outbound.AgentEngineProvider;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AgentEngineRegistryTest {

    @Test
    void shouldResolveDefaultAgentForBlankName() {
        CountingProvider provider = new CountingProvider("general");
        AgentEngineRegistry registry = new AgentEngineRegistry(List.of(provider), new AgentStreamProperties());

        AgentEnginePort engine = registry.resolve(" ");

        assertEquals("general", engine.getAgentName());
        assertTrue(registry.isInitialized("general"));
    }

    @Test
    void shouldCreateEngineLazily() {
        CountingProvider provider = new CountingProvider("general");
        AgentEngineRegistry registry = new AgentEngineRegistry(List.of(provider), new AgentStreamProperties());

        assertFalse(registry.isInitialized("general"));
        assertEquals(0, provider.created.get());
        assertEquals(Set.of("general"), registry.getAgentNames());
    }

    @Test
    void shouldRejectUnknownAgent() {
        AgentEngineRegistry registry = new AgentEngineRegistry(List.of(new CountingProvider("general")),
                new AgentStreamProperties());

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> registry.resolve("missing"));

        assertEquals("Unknown agent: missing", ex.getMessage());
    }

    @Test
    void shouldRejectDuplicateProviders() {
        List<AgentEngineProvider> providers = List.of(new CountingProvider("general"),
                new CountingProvider("general"));
        AgentStreamProperties properties = new AgentStreamProperties();

        assertThrows(IllegalStateException.class, () -> new AgentEngineRegistry(providers, properties));
    }

    @Test
    void shouldInitializeEngineOnceUnderConcurrentResolution() throws Exception {
        CountingProvider provider = new CountingProvider("general");
        AgentEngineRegistry registry = new AgentEngineRegistry(List.of(provider), new AgentStreamProperties());
        int callers = 16;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(callers);
        try {
            List<Future<AgentEnginePort>> futures = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return registry.resolve("general");
                }));
            }
            start.countDown();

            AgentEnginePort first = futures.get(0).get(5, TimeUnit.SECONDS);
            for (Future<AgentEnginePort> future : futures) {
                assertSame(first, future.get(5, TimeUnit.SECONDS));
            }
            assertEquals(1, provider.created.get());
        } finally {
            executor.shutdownNow();
        }
    }

    private static final class CountingProvider implements AgentEngineProvider {

        private final String agentName;
        private final AtomicInteger created = new AtomicInteger();

        private CountingProvider(String agentName) {
            this.agentName = agentName;
        }

        @Override
        public String getAgentName() {
            return agentName;
        }

        @Override
        public AgentEnginePort create() {
            created.incrementAndGet();
            return new AgentEnginePort() {
                @Override
                public String getAgentName() {
                    return agentName;
                }

                @Override
                public Flux<RawEngineEvent> stream(RunRequest request) {
                    return Flux.empty();
                }

                @Override
                public boolean isAvailable() {
                    return true;
                }
            };
        }
    }
}
