package com.reelpipe.orchestrator.driver;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.reelpipe.orchestrator.api.dto.TickResponse;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for PipelineApiClient against a throwaway local HTTP server.
 */
class PipelineApiClientTest {

    private HttpServer              server;
    private PipelineApiClient       client;
    private final AtomicReference<String> lastBody = new AtomicReference<>();
    private volatile int            status = 200;
    private volatile String         response = "{}";

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/jobs", exchange -> {
            lastBody.set(exchange.getRequestURI().getPath() + " "
                    + new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            byte[] bytes = response.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
        server.start();
        ObjectMapper mapper = new ObjectMapper().registerModule(new JavaTimeModule());
        client = new PipelineApiClient("http://127.0.0.1:" + server.getAddress().getPort() + "/",
                mapper, Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void tick_postsLimitAndParsesResponse() {
        UUID jobId = UUID.randomUUID();
        response = """
                {"done":false,"blocked":false,"processedCount":1,
                 "job":{"id":"%s","kind":"DOCUMENT_AUTORUN","projectRef":"proj-1","format":"film",
                        "status":"RUNNING","totalCount":5,"completedCount":2,"errorCount":0,
                        "currentStageIndex":2,"awaitingApproval":false,"nextAction":"tick",
                        "createdAt":"2026-03-01T10:00:00Z"}}
                """.formatted(jobId);

        TickResponse tick = client.tick(jobId, 2);

        assertThat(tick.processedCount()).isEqualTo(1);
        assertThat(tick.job().status()).isEqualTo("RUNNING");
        assertThat(tick.job().completedCount()).isEqualTo(2);
        assertThat(lastBody.get()).isEqualTo("/jobs/" + jobId + "/tick {\"maxItemsPerTick\":2}");
    }

    @Test
    void serverError_isTransient() {
        status = 503;
        response = "{\"error\":\"busy\"}";

        assertThatThrownBy(() -> client.tick(UUID.randomUUID(), null))
                .isInstanceOf(TickClientException.class)
                .satisfies(e -> assertThat(((TickClientException) e).isTransient()).isTrue());
    }

    @Test
    void clientError_isNotTransient() {
        status = 409;
        response = "{\"error\":\"awaiting approval\"}";

        assertThatThrownBy(() -> client.resume(UUID.randomUUID()))
                .isInstanceOf(TickClientException.class)
                .hasMessageContaining("409")
                .satisfies(e -> assertThat(((TickClientException) e).isTransient()).isFalse());
    }

    @Test
    void unreachableServer_isTransient() {
        server.stop(0);
        server = null;

        assertThatThrownBy(() -> client.tick(UUID.randomUUID(), null))
                .isInstanceOf(TickClientException.class)
                .satisfies(e -> assertThat(((TickClientException) e).isTransient()).isTrue());
    }
}
