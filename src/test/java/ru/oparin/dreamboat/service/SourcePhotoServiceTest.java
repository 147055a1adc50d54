package ru.oparin.dreamboat.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import ru.oparin.dreamboat.exception.PhotoNotEligibleException;
import ru.oparin.dreamboat.exception.PhotoNotFoundException;
import ru.oparin.dreamboat.model.dto.photo.RecordUploadsResponseDTO;
import ru.oparin.dreamboat.model.dto.photo.UploadedPhotoDTO;
import ru.oparin.dreamboat.model.entity.SourcePhoto;
import ru.oparin.dreamboat.model.enums.ValidationStatus;
import ru.oparin.dreamboat.repository.SourcePhotoRepository;
import ru.oparin.dreamboat.service.storage.ImageStorage;

import java.time.Clock;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SourcePhotoServiceTest {

    @Mock
    private SourcePhotoRepository sourcePhotoRepository;

    @Mock
    private ImageStorage imageStorage;

    private SourcePhotoService sourcePhotoService;

    @BeforeEach
    void setUp() {
        sourcePhotoService = new SourcePhotoService(sourcePhotoRepository, imageStorage, Clock.systemUTC());
    }

    @Test
    void getEligiblePhotos_shouldReturnPhotosInRequestOrder_withoutDuplicates() {
        // Given
        when(sourcePhotoRepository.findByIdAndUserId(2L, 1L)).thenReturn(Mono.just(photo(2L, ValidationStatus.VALIDATED)));
        when(sourcePhotoRepository.findByIdAndUserId(1L, 1L)).thenReturn(Mono.just(photo(1L, ValidationStatus.BYPASSED)));

        // When / Then
        StepVerifier.create(sourcePhotoService.getEligiblePhotos(1L, List.of(2L, 1L, 2L)))
                .assertNext(photos -> assertEquals(List.of(2L, 1L), photos.stream().map(SourcePhoto::getId).toList()))
                .verifyComplete();
    }

    @Test
    void getEligiblePhotos_shouldFail_whenPhotoPendingValidation() {
        when(sourcePhotoRepository.findByIdAndUserId(1L, 1L)).thenReturn(Mono.just(photo(1L, ValidationStatus.VALIDATED)));
        when(sourcePhotoRepository.findByIdAndUserId(2L, 1L)).thenReturn(Mono.just(photo(2L, ValidationStatus.PENDING)));

        StepVerifier.create(sourcePhotoService.getEligiblePhotos(1L, List.of(1L, 2L)))
                .expectErrorSatisfies(error -> {
                    PhotoNotEligibleException notEligible = assertInstanceOf(PhotoNotEligibleException.class, error);
                    assertTrue(notEligible.getMessage().contains("2"));
                })
                .verify();
    }

    @Test
    void getEligiblePhotos_shouldFail_whenPhotoBelongsToAnotherUser() {
        when(sourcePhotoRepository.findByIdAndUserId(3L, 1L)).thenReturn(Mono.empty());

        StepVerifier.create(sourcePhotoService.getEligiblePhotos(1L, List.of(3L)))
                .expectError(PhotoNotFoundException.class)
                .verify();
    }

    @Test
    void recordUploadedPhotos_shouldSkipMissingFiles_andCreatePendingRecords() {
        // Given
        UploadedPhotoDTO present = UploadedPhotoDTO.builder()
                .storageLocator("uploads/1/a.jpg")
                .originalFileName("a.jpg")
                .contentType("image/jpeg")
                .build();
        UploadedPhotoDTO missing = UploadedPhotoDTO.builder()
                .storageLocator("uploads/1/missing.jpg")
                .originalFileName("missing.jpg")
                .build();
        when(imageStorage.exists("uploads/1/a.jpg")).thenReturn(Mono.just(true));
        when(imageStorage.exists("uploads/1/missing.jpg")).thenReturn(Mono.just(false));
        when(sourcePhotoRepository.findByUserIdAndStorageLocator(1L, "uploads/1/a.jpg")).thenReturn(Mono.empty());
        when(sourcePhotoRepository.save(any(SourcePhoto.class))).thenAnswer(invocation -> {
            SourcePhoto photo = invocation.getArgument(0);
            photo.setId(10L);
            return Mono.just(photo);
        });

        // When / Then
        StepVerifier.create(sourcePhotoService.recordUploadedPhotos(1L, List.of(present, missing)))
                .assertNext(response -> {
                    assertEquals(1, response.getPhotos().size());
                    assertEquals(ValidationStatus.PENDING, response.getPhotos().get(0).getValidationStatus());
                    assertEquals(1, response.getSkipped().size());
                    assertEquals("uploads/1/missing.jpg", response.getSkipped().get(0).getStorageLocator());
                })
                .verifyComplete();
    }

    @Test
    void recordUploadedPhotos_shouldSkipLocatorsOutsideOwnUploads() {
        // Given - another user's generated image and a path escaping the own directory
        UploadedPhotoDTO foreignGenerated = UploadedPhotoDTO.builder()
                .storageLocator("generated/2/result.png")
                .originalFileName("result.png")
                .build();
        UploadedPhotoDTO escaping = UploadedPhotoDTO.builder()
                .storageLocator("uploads/1/../2/b.jpg")
                .originalFileName("b.jpg")
                .build();

        // When / Then
        StepVerifier.create(sourcePhotoService.recordUploadedPhotos(1L, List.of(foreignGenerated, escaping)))
                .assertNext(response -> {
                    assertTrue(response.getPhotos().isEmpty());
                    assertEquals(List.of("generated/2/result.png", "uploads/1/../2/b.jpg"),
                            response.getSkipped().stream()
                                    .map(RecordUploadsResponseDTO.SkippedUploadDTO::getStorageLocator)
                                    .toList());
                })
                .verifyComplete();
        verifyNoInteractions(imageStorage, sourcePhotoRepository);
    }

    @Test
    void isOwnUpload_shouldAcceptOnlyFilesInsideOwnUploadDirectory() {
        assertTrue(SourcePhotoService.isOwnUpload(1L, "uploads/1/a.jpg"));
        assertTrue(SourcePhotoService.isOwnUpload(1L, "uploads/1/2026/a.jpg"));
        assertFalse(SourcePhotoService.isOwnUpload(1L, "uploads/12/a.jpg"));
        assertFalse(SourcePhotoService.isOwnUpload(1L, "uploads/1"));
        assertFalse(SourcePhotoService.isOwnUpload(1L, "/uploads/1/a.jpg"));
        assertFalse(SourcePhotoService.isOwnUpload(1L, "generated/1/a.png"));
        assertFalse(SourcePhotoService.isOwnUpload(1L, " "));
    }

    private SourcePhoto photo(Long id, ValidationStatus status) {
        return SourcePhoto.builder()
                .id(id)
                .userId(1L)
                .storageLocator("uploads/1/" + id + ".jpg")
                .validationStatus(status)
                .build();
    }
}
