package com.reelpipe.orchestrator.driver;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.reelpipe.orchestrator.api.dto.JobResponse;
import com.reelpipe.orchestrator.api.dto.TickRequest;
import com.reelpipe.orchestrator.api.dto.TickResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.UUID;

/**
 * HTTP transport for a run loop hosted outside the orchestrator process.
 *
 * Connection errors, timeouts and 5xx responses are transient; 4xx
 * responses (unknown job, refused transition) are not.
 *
 * Example:
 * <pre>
 * RunLoop loop = new RunLoop(jobId,
 *         new PipelineApiClient("http://orchestrator:8080", objectMapper, Duration.ofSeconds(150)),
 *         props.driver(), Sleeper.THREAD);
 * loop.run();
 * </pre>
 */
public class PipelineApiClient implements TickClient {

    private static final Logger log = LoggerFactory.getLogger(PipelineApiClient.class);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final Duration     timeout;

    /**
     * @param timeout per-request timeout; must cover a whole tick
     *                (maxItemsPerTick times the generation timeout)
     */
    public PipelineApiClient(String baseUrl, ObjectMapper objectMapper, Duration timeout) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.json    = objectMapper;
        this.timeout = timeout;
        this.http    = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public TickResponse tick(UUID jobId, Integer maxItemsPerTick) {
        return post("/jobs/" + jobId + "/tick", toJson(new TickRequest(maxItemsPerTick)), TickResponse.class);
    }

    @Override
    public JobResponse pause(UUID jobId) {
        return post("/jobs/" + jobId + "/pause", "{}", JobResponse.class);
    }

    @Override
    public JobResponse resume(UUID jobId) {
        return post("/jobs/" + jobId + "/resume", "{}", JobResponse.class);
    }

    @Override
    public JobResponse stop(UUID jobId) {
        return post("/jobs/" + jobId + "/stop", "{}", JobResponse.class);
    }

    private <T> T post(String path, String body, Class<T> type) {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("Accept",       "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        HttpResponse<String> resp;
        try {
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new TickClientException("POST " + path + " failed: " + e.getMessage(), e, true);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TickClientException("POST " + path + " interrupted", e, false);
        }

        int status = resp.statusCode();
        if (status >= 500) {
            log.warn("POST {} returned HTTP {}", path, status);
            throw new TickClientException("POST " + path + " failed: HTTP " + status + ": " + resp.body(), true);
        }
        if (status < 200 || status >= 300) {
            throw new TickClientException("POST " + path + " refused: HTTP " + status + ": " + resp.body(), false);
        }
        try {
            return json.readValue(resp.body(), type);
        } catch (JsonProcessingException e) {
            throw new TickClientException("Failed to parse response of POST " + path, e, false);
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new TickClientException("JSON serialization failed", e, false);
        }
    }
}
