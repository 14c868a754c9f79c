package me.golemcore.agentstream.adapter.inbound.web.filter;

import org.junit.jupiter.api.Test;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class RequestIdWebFilterTest {

    private final RequestIdWebFilter filter = new RequestIdWebFilter();
    private final WebFilterChain chain = exchange -> Mono.empty();

    @Test
    void shouldKeepWellFormedClientRequestId() {
        MockServerWebExchange exchange = MockServerWebExchange.from(
                MockServerHttpRequest.get("/health").header(RequestIdWebFilter.HEADER, "client-123"));

        StepVerifier.create(filter.filter(exchange, chain)).verifyComplete();

        assertEquals("client-123", exchange.getResponse().getHeaders().getFirst(RequestIdWebFilter.HEADER));
        assertEquals("client-123", RequestIdWebFilter.requestIdOf(exchange));
    }

    @Test
    void shouldGenerateRequestIdWhenMissingOrMalformed() {
        MockServerWebExchange exchange = MockServerWebExchange.from(
                MockServerHttpRequest.get("/health").header(RequestIdWebFilter.HEADER, "bad id; drop"));

        StepVerifier.create(filter.filter(exchange, chain)).verifyComplete();

        String requestId = exchange.getResponse().getHeaders().getFirst(RequestIdWebFilter.HEADER);
        assertNotNull(requestId);
        assertNotEquals("bad id; drop", requestId);
        assertEquals(36, requestId.length());
    }
}
