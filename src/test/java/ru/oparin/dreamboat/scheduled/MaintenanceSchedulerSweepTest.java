package ru.oparin.dreamboat.scheduled;

import io.r2dbc.spi.ConnectionFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.data.r2dbc.DataR2dbcTest;
import org.springframework.core.io.ClassPathResource;
import org.springframework.r2dbc.connection.init.ResourceDatabasePopulator;
import reactor.test.StepVerifier;
import ru.oparin.dreamboat.config.properties.GenerationProperties;
import ru.oparin.dreamboat.model.entity.GenerationJob;
import ru.oparin.dreamboat.model.enums.GenerationStatus;
import ru.oparin.dreamboat.repository.GeneratedResultRepository;
import ru.oparin.dreamboat.repository.GenerationJobRepository;
import ru.oparin.dreamboat.service.generation.GenerationTracker;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Финализация зависших заданий на H2: задание, которое еще выполняет пакеты,
 * не должно финализироваться планировщиком.
 */
@DataR2dbcTest
class MaintenanceSchedulerSweepTest {

    private static final Instant STARTED_AT = Instant.parse("2026-03-01T12:00:00Z");

    @Autowired
    private ConnectionFactory connectionFactory;

    @Autowired
    private GenerationJobRepository generationJobRepository;

    @Autowired
    private GeneratedResultRepository generatedResultRepository;

    @BeforeEach
    void setUp() {
        new ResourceDatabasePopulator(new ClassPathResource("schema.sql")).populate(connectionFactory).block();
        generatedResultRepository.deleteAll()
                .then(generationJobRepository.deleteAll())
                .block();
    }

    @Test
    void sweepOrphans_shouldKeepRunningJob_whenBatchSettledRecently() {
        // Given - job opened at T, its last batch settled at T+25m
        GenerationJob job = trackerAt(Duration.ZERO).open(1L, 7L, 6, List.of("photoshoot")).block();
        trackerAt(Duration.ofMinutes(25)).heartbeat(job.getId()).block();

        // When - sweep runs at T+31m
        StepVerifier.create(schedulerAt(Duration.ofMinutes(31)).sweepOrphans())
                .expectNext(0L)
                .verifyComplete();

        // Then - the request still finalizes the job itself
        StepVerifier.create(trackerAt(Duration.ofMinutes(32)).close(job.getId(), 6, 6))
                .expectNext(GenerationStatus.COMPLETED)
                .verifyComplete();
        GenerationJob stored = generationJobRepository.findById(job.getId()).block();
        assertEquals(GenerationStatus.COMPLETED, stored.getStatus());
        assertEquals(6, stored.getCompletedTasks());
    }

    @Test
    void sweepOrphans_shouldFailJob_whenNoBatchSettledWithinTimeout() {
        // Given
        GenerationJob job = trackerAt(Duration.ZERO).open(1L, 7L, 6, List.of("photoshoot")).block();

        // When
        StepVerifier.create(schedulerAt(Duration.ofMinutes(31)).sweepOrphans())
                .expectNext(1L)
                .verifyComplete();

        // Then
        GenerationJob stored = generationJobRepository.findById(job.getId()).block();
        assertEquals(GenerationStatus.FAILED, stored.getStatus());
        assertEquals(0, stored.getCompletedTasks());
        StepVerifier.create(trackerAt(Duration.ofMinutes(32)).heartbeat(job.getId()))
                .verifyComplete();
        assertEquals(GenerationStatus.FAILED, generationJobRepository.findById(job.getId()).block().getStatus());
    }

    private GenerationTracker trackerAt(Duration offset) {
        return new GenerationTracker(generationJobRepository, clockAt(offset));
    }

    private MaintenanceScheduler schedulerAt(Duration offset) {
        return new MaintenanceScheduler(trackerAt(offset), generatedResultRepository, new GenerationProperties(),
                clockAt(offset));
    }

    private Clock clockAt(Duration offset) {
        return Clock.fixed(STARTED_AT.plus(offset), ZoneOffset.UTC);
    }
}
