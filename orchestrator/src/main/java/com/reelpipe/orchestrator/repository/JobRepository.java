package com.reelpipe.orchestrator.repository;

import com.reelpipe.orchestrator.model.Job;
import com.reelpipe.orchestrator.model.JobKind;
import com.reelpipe.orchestrator.model.JobStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD + status transitions for the jobs table.
 */
public interface JobRepository extends JpaRepository<Job, UUID> {

    /**
     * Load a job and hold its row lock until the surrounding transaction ends.
     *
     * Every job-level read-modify-write (counter refresh, pause, decision)
     * goes through this, so concurrent ticks and API calls serialize on the
     * job row instead of overwriting each other's status.
     * Must run inside a @Transactional service method.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT j FROM Job j WHERE j.id = :id")
    Optional<Job> findByIdForUpdate(@Param("id") UUID id);

    /** Status only; used between items of a tick to notice a pause or stop. */
    @Query("SELECT j.status FROM Job j WHERE j.id = :id")
    Optional<JobStatus> findStatusById(@Param("id") UUID id);

    /** Newest job of a kind for a project whose status is one of {@code statuses}. */
    Optional<Job> findFirstByKindAndProjectRefAndStatusInOrderByCreatedAtDesc(
            JobKind kind, String projectRef, Collection<JobStatus> statuses);

    Optional<Job> findFirstByProjectRefOrderByCreatedAtDesc(String projectRef);

    Optional<Job> findFirstByProjectRefAndKindOrderByCreatedAtDesc(String projectRef, JobKind kind);

    /** Active (queued, running or paused) job of this kind for the project, if any. */
    default Optional<Job> findActive(JobKind kind, String projectRef) {
        return findFirstByKindAndProjectRefAndStatusInOrderByCreatedAtDesc(
                kind, projectRef, EnumSet.of(JobStatus.QUEUED, JobStatus.RUNNING, JobStatus.PAUSED));
    }

    /**
     * Conditional status change (from → to), used for QUEUED → RUNNING on the
     * first tick. Two first ticks racing on a new job both see it running
     * afterwards and only one of them sets started_at.
     *
     * @return 1 if this call made the transition, 0 otherwise
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("""
            UPDATE Job j
               SET j.status = :toStatus, j.startedAt = :now, j.updatedAt = :now
             WHERE j.id = :id AND j.status = :fromStatus
            """)
    int transition(@Param("id") UUID id,
                   @Param("fromStatus") JobStatus from,
                   @Param("toStatus") JobStatus to,
                   @Param("now") Instant now);

    default int markRunningIfQueued(UUID id, Instant now) {
        return transition(id, JobStatus.QUEUED, JobStatus.RUNNING, now);
    }
}
