package ru.oparin.dreamboat.service.generation;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import ru.oparin.dreamboat.config.properties.GenerationProperties;
import ru.oparin.dreamboat.exception.ExhaustedRetriesException;
import ru.oparin.dreamboat.exception.TaskException;
import ru.oparin.dreamboat.model.entity.GeneratedResult;
import ru.oparin.dreamboat.model.entity.SourcePhoto;
import ru.oparin.dreamboat.repository.GeneratedResultRepository;
import ru.oparin.dreamboat.service.provider.ImageSynthesisProvider;
import ru.oparin.dreamboat.service.provider.SynthesisResult;
import ru.oparin.dreamboat.service.resilience.RetryExecutor;

import java.time.Clock;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class GenerationWorkerTest {

    @Mock
    private ImageSynthesisProvider imageSynthesisProvider;

    @Mock
    private GeneratedResultRepository generatedResultRepository;

    private GenerationWorker generationWorker;

    private final SourcePhoto photo = SourcePhoto.builder()
            .id(3L)
            .userId(1L)
            .storageLocator("uploads/1/source.jpg")
            .build();

    @BeforeEach
    void setUp() {
        generationWorker = new GenerationWorker(
                imageSynthesisProvider,
                new RetryExecutor(delay -> Mono.empty()),
                new ScenarioPromptResolver(),
                generatedResultRepository,
                new GenerationProperties(),
                Clock.systemUTC());
    }

    @Test
    void execute_shouldSaveResultWithCustomPrompt() {
        // Given
        when(imageSynthesisProvider.generate(1L, "uploads/1/source.jpg", "On a yacht at sunset"))
                .thenReturn(Mono.just(new SynthesisResult("generated/1/a.png", "req-1")));
        when(generatedResultRepository.save(any(GeneratedResult.class)))
                .thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));

        // When
        Mono<GeneratedResult> result = generationWorker.execute(1L, 50L, new GenerationTask(1, photo, "beach"),
                Map.of("beach", "On a yacht at sunset"));

        // Then
        StepVerifier.create(result)
                .assertNext(saved -> {
                    assertEquals(50L, saved.getGenerationJobId());
                    assertEquals(3L, saved.getSourcePhotoId());
                    assertEquals("beach", saved.getScenario());
                    assertEquals("On a yacht at sunset", saved.getPrompt());
                    assertEquals("generated/1/a.png", saved.getStorageLocator());
                    assertEquals("req-1", saved.getProviderRequestId());
                    assertFalse(saved.getIsSample());
                    assertNull(saved.getProfileOrder());
                })
                .verifyComplete();
    }

    @Test
    void execute_shouldWrapExhaustedRetriesInTaskException() {
        // Given
        when(imageSynthesisProvider.generate(eq(1L), anyString(), anyString()))
                .thenReturn(Mono.error(new IllegalStateException("provider down")));

        // When
        Mono<GeneratedResult> result = generationWorker.execute(1L, 50L, new GenerationTask(4, photo, "gym"), null);

        // Then
        StepVerifier.create(result)
                .expectErrorSatisfies(error -> {
                    TaskException taskException = assertInstanceOf(TaskException.class, error);
                    assertEquals(4, taskException.getPosition());
                    assertEquals(3L, taskException.getPhotoId());
                    assertEquals("gym", taskException.getScenario());
                    assertInstanceOf(ExhaustedRetriesException.class, taskException.getCause());
                })
                .verify();
        verify(imageSynthesisProvider, times(3)).generate(eq(1L), anyString(), anyString());
        verify(generatedResultRepository, never()).save(any());
    }

    @Test
    void executeSample_shouldSaveSampleWithoutJob() {
        when(imageSynthesisProvider.generate(eq(1L), eq("uploads/1/source.jpg"), anyString()))
                .thenReturn(Mono.just(new SynthesisResult("generated/1/s.png", "req-s")));
        when(generatedResultRepository.save(any(GeneratedResult.class)))
                .thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));

        StepVerifier.create(generationWorker.executeSample(1L, photo, "photoshoot"))
                .assertNext(saved -> {
                    assertTrue(saved.getIsSample());
                    assertNull(saved.getGenerationJobId());
                    assertTrue(saved.getPrompt().startsWith("Professional portrait photography"));
                })
                .verifyComplete();
    }
}
