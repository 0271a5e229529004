package com.reelpipe.orchestrator.api;

import com.reelpipe.orchestrator.model.*;
import com.reelpipe.orchestrator.service.*;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Slice test for the job and chunk endpoints.
 *
 * @WebMvcTest spins up only the web layer (no DB, no generation service).
 * Services are mocks; ApiExceptionHandler maps their exceptions to statuses.
 */
@WebMvcTest({PipelineController.class, ChunkController.class})
class PipelineControllerTest {

    @Autowired MockMvc mockMvc;

    @MockitoBean JobService     jobService;
    @MockitoBean TickController tickController;
    @MockitoBean ApprovalGate   approvalGate;
    @MockitoBean ChunkTracker   chunkTracker;

    // ------------------------------------------------------------------
    // POST /jobs
    // ------------------------------------------------------------------

    @Test
    void start_validRequest_returns201WithItems() throws Exception {
        Job job = fakeJob(JobStatus.QUEUED);
        job.setCounters(2, 0, 0);
        when(jobService.start(any())).thenReturn(job);
        when(jobService.getItems(job.getId())).thenReturn(List.of(
                new Item(job.getId(), 0, "idea", "idea"),
                new Item(job.getId(), 1, "concept_brief", "concept_brief")));

        mockMvc.perform(post("/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"kind":"DOCUMENT_AUTORUN","projectRef":"proj-1","format":"documentary",
                                 "policy":{"maxItemsPerTick":1}}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.jobId").value(job.getId().toString()))
                .andExpect(jsonPath("$.totalCount").value(2))
                .andExpect(jsonPath("$.items[1].stageKey").value("concept_brief"))
                .andExpect(jsonPath("$.job.status").value("QUEUED"))
                .andExpect(jsonPath("$.job.nextAction").value("tick"));
    }

    @Test
    void start_missingProjectRef_returns400() throws Exception {
        mockMvc.perform(post("/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"kind":"DOCUMENT_AUTORUN"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("projectRef is required"));
        verify(jobService, never()).start(any());
    }

    @Test
    void start_badPolicy_returns400() throws Exception {
        mockMvc.perform(post("/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"kind":"DOCUMENT_AUTORUN","projectRef":"proj-1","policy":{"maxItemsPerTick":0}}
                                """))
                .andExpect(status().isBadRequest());
    }

    // ------------------------------------------------------------------
    // POST /jobs/{id}/tick
    // ------------------------------------------------------------------

    @Test
    void tick_returnsDoneFlagAndProcessedCount() throws Exception {
        Job job = fakeJob(JobStatus.COMPLETED);
        when(tickController.tick(job.getId(), 1)).thenReturn(TickResult.of(job, 1));

        mockMvc.perform(post("/jobs/{id}/tick", job.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"maxItemsPerTick\":1}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.done").value(true))
                .andExpect(jsonPath("$.processedCount").value(1))
                .andExpect(jsonPath("$.job.nextAction").value("none"));
    }

    @Test
    void tick_withoutBody_usesJobPolicy() throws Exception {
        Job job = fakeJob(JobStatus.RUNNING);
        when(tickController.tick(job.getId(), null)).thenReturn(TickResult.of(job, 0));

        mockMvc.perform(post("/jobs/{id}/tick", job.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.done").value(false));
    }

    @Test
    void tick_unknownJob_returns404() throws Exception {
        UUID unknown = UUID.randomUUID();
        when(tickController.tick(unknown, null)).thenThrow(new JobNotFoundException(unknown));

        mockMvc.perform(post("/jobs/{id}/tick", unknown))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value(404));
    }

    // ------------------------------------------------------------------
    // GET /jobs/{id}, /jobs/latest
    // ------------------------------------------------------------------

    @Test
    void getJob_existingId_returnsJobItemsAndProgress() throws Exception {
        Job job = fakeJob(JobStatus.PAUSED);
        when(jobService.findById(job.getId())).thenReturn(Optional.of(job));
        when(jobService.getItems(job.getId())).thenReturn(List.of());
        when(jobService.progress(job.getId())).thenReturn(new Progress(5, 2, 0, 3, 40, 60_000, 30_000, 90_000L));

        mockMvc.perform(get("/jobs/{id}", job.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.job.status").value("PAUSED"))
                .andExpect(jsonPath("$.job.nextAction").value("resume"))
                .andExpect(jsonPath("$.progress.etaMs").value(90_000));
    }

    @Test
    void getJob_unknownId_returns404() throws Exception {
        UUID unknown = UUID.randomUUID();
        when(jobService.findById(unknown)).thenReturn(Optional.empty());

        mockMvc.perform(get("/jobs/{id}", unknown))
                .andExpect(status().isNotFound());
    }

    @Test
    void latest_returnsNewestJobOfKind() throws Exception {
        Job job = fakeJob(JobStatus.RUNNING);
        when(jobService.findLatest("proj-1", JobKind.DOCUMENT_AUTORUN)).thenReturn(Optional.of(job));
        when(jobService.getItems(job.getId())).thenReturn(List.of());

        mockMvc.perform(get("/jobs/latest").param("projectRef", "proj-1").param("kind", "DOCUMENT_AUTORUN"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.job.id").value(job.getId().toString()));
    }

    @Test
    void latest_noJob_returns404() throws Exception {
        when(jobService.findLatest("proj-2", null)).thenReturn(Optional.empty());

        mockMvc.perform(get("/jobs/latest").param("projectRef", "proj-2"))
                .andExpect(status().isNotFound());
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    @Test
    void pause_refusedTransition_returns409() throws Exception {
        UUID id = UUID.randomUUID();
        when(jobService.pause(id)).thenThrow(new IllegalJobStateException("Cannot pause job " + id + " in state COMPLETED"));

        mockMvc.perform(post("/jobs/{id}/pause", id))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Cannot pause job " + id + " in state COMPLETED"));
    }

    @Test
    void retry_returnsRunningJob() throws Exception {
        Job job = fakeJob(JobStatus.RUNNING);
        when(jobService.retry(job.getId())).thenReturn(job);

        mockMvc.perform(post("/jobs/{id}/retry", job.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("RUNNING"));
    }

    // ------------------------------------------------------------------
    // POST /jobs/{id}/decisions
    // ------------------------------------------------------------------

    @Test
    void decide_approve_returnsUpdatedJob() throws Exception {
        Job job = fakeJob(JobStatus.RUNNING);
        when(approvalGate.decide(job.getId(), "treatment", true, "looks good")).thenReturn(job);

        mockMvc.perform(post("/jobs/{id}/decisions", job.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"stageKey":"treatment","approved":true,"note":"looks good"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("RUNNING"));
    }

    @Test
    void decide_missingApproved_returns400() throws Exception {
        mockMvc.perform(post("/jobs/{id}/decisions", UUID.randomUUID())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"stageKey\":\"treatment\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void decide_notAwaiting_returns409() throws Exception {
        UUID id = UUID.randomUUID();
        when(approvalGate.decide(eq(id), eq("deck"), eq(false), any()))
                .thenThrow(new IllegalJobStateException("Job " + id + " is not awaiting approval for stage deck"));

        mockMvc.perform(post("/jobs/{id}/decisions", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"stageKey\":\"deck\",\"approved\":false}"))
                .andExpect(status().isConflict());
    }

    // ------------------------------------------------------------------
    // Regeneration and chunks
    // ------------------------------------------------------------------

    @Test
    void regenItems_withoutBody_regeneratesValidationFailures() throws Exception {
        Job job = fakeJob(JobStatus.RUNNING);
        when(jobService.regenItems(job.getId(), null)).thenReturn(job);

        mockMvc.perform(post("/jobs/{id}/items/regen", job.getId()))
                .andExpect(status().isOk());
        verify(jobService).regenItems(job.getId(), null);
    }

    @Test
    void chunks_unknownGroup_returns404() throws Exception {
        when(chunkTracker.chunkStatus("proj-1:episode_beats", "r1"))
                .thenReturn(ChunkGroup.of("proj-1:episode_beats", "r1", List.of()));

        mockMvc.perform(get("/documents/{doc}/versions/{ver}/chunks", "proj-1:episode_beats", "r1"))
                .andExpect(status().isNotFound());
    }

    @Test
    void chunks_returnsPerChunkStatus() throws Exception {
        Chunk done = new Chunk("doc-1", "r1", 0, "episodes-01-08");
        done.setStatus(ChunkStatus.DONE);
        Chunk failed = new Chunk("doc-1", "r1", 1, "episodes-09-12");
        failed.setStatus(ChunkStatus.FAILED);
        when(chunkTracker.chunkStatus("doc-1", "r1")).thenReturn(ChunkGroup.of("doc-1", "r1", List.of(done, failed)));

        mockMvc.perform(get("/documents/{doc}/versions/{ver}/chunks", "doc-1", "r1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.complete").value(false))
                .andExpect(jsonPath("$.doneCount").value(1))
                .andExpect(jsonPath("$.chunks[1].status").value("FAILED"));
    }

    @Test
    void regenChunks_returnsEnqueuedIndicesAndJob() throws Exception {
        Job regen = fakeJob(JobStatus.QUEUED);
        when(jobService.startChunkRegen("doc-1", "r1", true))
                .thenReturn(new JobService.ChunkRegenOutcome("doc-1", "r1", List.of(1, 3), regen));

        mockMvc.perform(post("/documents/{doc}/versions/{ver}/regen", "doc-1", "r1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"resumeChunks\":true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.enqueuedIndices[0]").value(1))
                .andExpect(jsonPath("$.enqueuedIndices[1]").value(3))
                .andExpect(jsonPath("$.jobId").value(regen.getId().toString()));
    }

    @Test
    void regenChunks_unknownGroup_returns404() throws Exception {
        when(jobService.startChunkRegen("doc-9", "r1", true))
                .thenThrow(new ChunkGroupNotFoundException("doc-9", "r1"));

        mockMvc.perform(post("/documents/{doc}/versions/{ver}/regen", "doc-9", "r1"))
                .andExpect(status().isNotFound());
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Job fakeJob(JobStatus status) {
        Job job = new Job(JobKind.DOCUMENT_AUTORUN, "proj-1", "documentary", JobPolicy.defaults(), Instant.now());
        job.setStatus(status);
        try {
            var f = job.getClass().getDeclaredField("id");
            f.setAccessible(true);
            f.set(job, UUID.randomUUID());
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
        return job;
    }
}
