package com.reelpipe.orchestrator.repository;

import com.reelpipe.orchestrator.model.ApprovalCheckpoint;
import com.reelpipe.orchestrator.model.ApprovalState;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ApprovalCheckpointRepository extends JpaRepository<ApprovalCheckpoint, UUID> {

    Optional<ApprovalCheckpoint> findFirstByJobIdAndStageKeyAndStateOrderByRevisionDesc(
            UUID jobId, String stageKey, ApprovalState state);

    /** Latest checkpoint for an item, by revision. */
    Optional<ApprovalCheckpoint> findFirstByItemIdOrderByRevisionDesc(UUID itemId);

    List<ApprovalCheckpoint> findByJobIdOrderByRequestedAtAsc(UUID jobId);
}
