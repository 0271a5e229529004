package com.reelpipe.orchestrator.generation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.reelpipe.orchestrator.config.PipelineProperties;
import com.reelpipe.orchestrator.generation.dto.GenerationRequest;
import com.reelpipe.orchestrator.generation.dto.GenerationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * HTTP client for the external generation service.
 *
 * One {@link #generate} call is one provider invocation. The idempotency key
 * travels both in the body and as an {@code Idempotency-Key} header, so a
 * provider that deduplicates can return the earlier result on re-invocation.
 *
 * Never retries: a failure surfaces as {@link GenerationException} and the
 * step executor records it on the item.
 */
@Component
public class GenerationClient {

    private static final Logger log = LoggerFactory.getLogger(GenerationClient.class);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final Duration     timeout;

    public GenerationClient(PipelineProperties props, ObjectMapper objectMapper) {
        this.baseUrl = props.generation().baseUrl();
        this.timeout = props.generation().timeout();
        this.json    = objectMapper;
        this.http    = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    /**
     * Generate the artifact for one unit (or one chunk of it).
     *
     * @throws GenerationException on transport failure, non-2xx status or an unreadable body
     */
    public GenerationResult generate(GenerationRequest request) {
        String opName = "generate " + request.stageKey()
                + (request.chunkKey() != null ? "/" + request.chunkKey() : "")
                + " for " + request.projectRef();
        log.info("Calling generation service: {}", opName);
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/generate"))
                    .timeout(timeout)
                    .header("Content-Type",    "application/json")
                    .header("Accept",          "application/json")
                    .header("Idempotency-Key", request.idempotencyKey())
                    .POST(HttpRequest.BodyPublishers.ofString(toJson(request)))
                    .build();
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new GenerationException(
                        opName + " failed: HTTP " + resp.statusCode() + ": " + resp.body());
            }
            return json.readValue(resp.body(), GenerationResult.class);
        } catch (GenerationException e) {
            throw e;
        } catch (JsonProcessingException e) {
            throw new GenerationException("Failed to parse response of " + opName, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GenerationException(opName + " interrupted", e);
        } catch (Exception e) {
            throw new GenerationException(opName + " failed", e);
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new GenerationException("JSON serialization failed", e);
        }
    }
}
