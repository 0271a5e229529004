package com.reelpipe.orchestrator.repository;

import com.reelpipe.orchestrator.model.Item;
import com.reelpipe.orchestrator.model.ItemStatus;
import com.reelpipe.orchestrator.model.Job;
import com.reelpipe.orchestrator.model.JobKind;
import com.reelpipe.orchestrator.model.JobPolicy;
import com.reelpipe.orchestrator.model.JobStatus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Flyway schema on a real PostgreSQL (Testcontainers).
 * Not part of the default test run; needs a Docker daemon.
 */
@DataJpaTest
@Testcontainers
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
class PipelineSchemaIT {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine")
            .withDatabaseName("reelpipe")
            .withUsername("reelpipe")
            .withPassword("reelpipe");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.datasource.driver-class-name", () -> "org.postgresql.Driver");
        registry.add("spring.flyway.enabled", () -> "true");
        registry.add("spring.jpa.hibernate.ddl-auto", () -> "validate");
    }

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Autowired JobRepository  jobRepo;
    @Autowired ItemRepository itemRepo;

    @Test
    void secondActiveJobForSameProject_isRejected() {
        jobRepo.saveAndFlush(new Job(JobKind.DOCUMENT_AUTORUN, "proj-dup", "film", JobPolicy.defaults(), NOW));

        assertThatThrownBy(() -> jobRepo.saveAndFlush(
                new Job(JobKind.DOCUMENT_AUTORUN, "proj-dup", "film", JobPolicy.defaults(), NOW)))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    void finishedJob_doesNotBlockANewRun() {
        Job first = new Job(JobKind.DOCUMENT_AUTORUN, "proj-rerun", "film", JobPolicy.defaults(), NOW);
        first.setStatus(JobStatus.COMPLETED);
        jobRepo.saveAndFlush(first);

        Job second = jobRepo.saveAndFlush(
                new Job(JobKind.DOCUMENT_AUTORUN, "proj-rerun", "film", JobPolicy.defaults(), NOW));

        assertThat(jobRepo.findActive(JobKind.DOCUMENT_AUTORUN, "proj-rerun")).map(Job::getId).contains(second.getId());
    }

    @Test
    void claimIsConditional() {
        Job job = jobRepo.saveAndFlush(new Job(JobKind.TRAILER_CLIPS, "proj-claim", "film", JobPolicy.defaults(), NOW));
        Item item = itemRepo.saveAndFlush(new Item(job.getId(), 0, "clip", "clip-hook"));
        Instant expires = NOW.plus(Duration.ofSeconds(90));

        assertThat(itemRepo.tryClaim(item.getId(), "tick-a", "k", NOW, expires, 3)).isEqualTo(1);
        assertThat(itemRepo.tryClaim(item.getId(), "tick-b", "k", NOW, expires, 3)).isZero();
        assertThat(itemRepo.findById(item.getId())).get()
                .extracting(Item::getStatus, Item::getClaimOwner)
                .containsExactly(ItemStatus.RUNNING, "tick-a");
    }
}
