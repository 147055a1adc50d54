package ru.oparin.dreamboat.repository;

import io.r2dbc.spi.ConnectionFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.data.r2dbc.DataR2dbcTest;
import org.springframework.core.io.ClassPathResource;
import org.springframework.r2dbc.connection.init.ResourceDatabasePopulator;
import reactor.test.StepVerifier;
import ru.oparin.dreamboat.model.entity.GenerationJob;
import ru.oparin.dreamboat.model.enums.GenerationStatus;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DataR2dbcTest
class GenerationJobRepositoryTest {

    @Autowired
    private ConnectionFactory connectionFactory;

    @Autowired
    private GenerationJobRepository generationJobRepository;

    @BeforeEach
    void setUp() {
        new ResourceDatabasePopulator(new ClassPathResource("schema.sql")).populate(connectionFactory).block();
        generationJobRepository.deleteAll().block();
    }

    @Test
    void finalizeJob_shouldUpdateOnlyOnce() {
        // Given
        GenerationJob job = generationJobRepository.save(job(LocalDateTime.now())).block();
        LocalDateTime completedAt = LocalDateTime.now();

        // When / Then
        StepVerifier.create(generationJobRepository.finalizeJob(job.getId(), GenerationStatus.FAILED.name(), 2, completedAt))
                .expectNext(1)
                .verifyComplete();
        StepVerifier.create(generationJobRepository.finalizeJob(job.getId(), GenerationStatus.COMPLETED.name(), 3, completedAt))
                .expectNext(0)
                .verifyComplete();

        GenerationJob stored = generationJobRepository.findById(job.getId()).block();
        assertEquals(GenerationStatus.FAILED, stored.getStatus());
        assertEquals(2, stored.getCompletedTasks());
        assertEquals(List.of("photoshoot", "beach"), stored.getScenarios());
    }

    @Test
    void findInProgressSilentSince_shouldReturnOnlyStaleActiveJobs() {
        LocalDateTime now = LocalDateTime.now();
        GenerationJob stale = generationJobRepository.save(job(now.minusHours(1))).block();
        generationJobRepository.save(job(now)).block();

        StepVerifier.create(generationJobRepository.findInProgressSilentSince(now.minusMinutes(30)))
                .assertNext(found -> assertEquals(stale.getId(), found.getId()))
                .verifyComplete();
    }

    @Test
    void findInProgressSilentSince_shouldSkipOldJob_whenHeartbeatIsRecent() {
        // Given - created an hour ago, last batch settled a minute ago
        LocalDateTime now = LocalDateTime.now();
        GenerationJob running = generationJobRepository.save(job(now.minusHours(1))).block();

        // When
        StepVerifier.create(generationJobRepository.touchHeartbeat(running.getId(), now.minusMinutes(1)))
                .expectNext(1)
                .verifyComplete();

        // Then
        StepVerifier.create(generationJobRepository.findInProgressSilentSince(now.minusMinutes(30)))
                .verifyComplete();
    }

    @Test
    void touchHeartbeat_shouldNotChangeFinalizedJob() {
        GenerationJob job = generationJobRepository.save(job(LocalDateTime.now())).block();
        generationJobRepository.finalizeJob(job.getId(), GenerationStatus.FAILED.name(), 1, LocalDateTime.now()).block();

        StepVerifier.create(generationJobRepository.touchHeartbeat(job.getId(), LocalDateTime.now()))
                .expectNext(0)
                .verifyComplete();
    }

    @Test
    void findActiveByUserId_shouldIgnoreFinishedJobs() {
        GenerationJob job = generationJobRepository.save(job(LocalDateTime.now())).block();
        generationJobRepository.finalizeJob(job.getId(), GenerationStatus.COMPLETED.name(), 3, LocalDateTime.now()).block();

        StepVerifier.create(generationJobRepository.findActiveByUserId(1L))
                .verifyComplete();
    }

    private GenerationJob job(LocalDateTime createdAt) {
        GenerationJob job = GenerationJob.builder()
                .userId(1L)
                .paymentCreditId(1L)
                .status(GenerationStatus.IN_PROGRESS)
                .totalTasks(3)
                .completedTasks(0)
                .createdAt(createdAt)
                .build();
        job.setScenarios(List.of("photoshoot", "beach"));
        return job;
    }
}
