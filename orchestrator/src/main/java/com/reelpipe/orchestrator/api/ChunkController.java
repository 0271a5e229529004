package com.reelpipe.orchestrator.api;

import com.reelpipe.orchestrator.api.dto.ChunkGroupResponse;
import com.reelpipe.orchestrator.api.dto.ChunkRegenRequest;
import com.reelpipe.orchestrator.api.dto.ChunkRegenResponse;
import com.reelpipe.orchestrator.driver.EmbeddedDriver;
import com.reelpipe.orchestrator.service.ChunkGroup;
import com.reelpipe.orchestrator.service.ChunkGroupNotFoundException;
import com.reelpipe.orchestrator.service.ChunkTracker;
import com.reelpipe.orchestrator.service.JobService;
import org.springframework.web.bind.annotation.*;

import java.util.Optional;

/**
 * Chunk groups of a document version.
 *
 * GET  /documents/{documentId}/versions/{versionId}/chunks   per-chunk status
 * POST /documents/{documentId}/versions/{versionId}/regen    re-enqueue missing chunks
 */
@RestController
@RequestMapping("/documents/{documentId}/versions/{versionId}")
public class ChunkController {

    private final ChunkTracker             chunkTracker;
    private final JobService               jobService;
    private final Optional<EmbeddedDriver> driver;

    public ChunkController(ChunkTracker chunkTracker, JobService jobService, Optional<EmbeddedDriver> driver) {
        this.chunkTracker = chunkTracker;
        this.jobService   = jobService;
        this.driver       = driver;
    }

    @GetMapping("/chunks")
    public ChunkGroupResponse chunks(@PathVariable String documentId, @PathVariable String versionId) {
        ChunkGroup group = chunkTracker.chunkStatus(documentId, versionId);
        if (group.isEmpty()) {
            throw new ChunkGroupNotFoundException(documentId, versionId);
        }
        return ChunkGroupResponse.from(group);
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/documents/proj-42:episode_beats/versions/r1/regen \
     *     -H "Content-Type: application/json" -d '{"resumeChunks":true}'
     */
    @PostMapping("/regen")
    public ChunkRegenResponse regen(@PathVariable String documentId,
                                    @PathVariable String versionId,
                                    @RequestBody(required = false) ChunkRegenRequest req) {
        boolean resume = req == null || req.resume();
        JobService.ChunkRegenOutcome outcome = jobService.startChunkRegen(documentId, versionId, resume);
        if (outcome.job() != null) {
            driver.ifPresent(d -> d.launch(outcome.job().getId()));
        }
        return ChunkRegenResponse.from(outcome);
    }
}
