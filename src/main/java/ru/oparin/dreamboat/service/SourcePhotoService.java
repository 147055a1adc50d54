package ru.oparin.dreamboat.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import ru.oparin.dreamboat.exception.PhotoNotEligibleException;
import ru.oparin.dreamboat.exception.PhotoNotFoundException;
import ru.oparin.dreamboat.model.dto.photo.RecordUploadsResponseDTO;
import ru.oparin.dreamboat.model.dto.photo.SourcePhotoDTO;
import ru.oparin.dreamboat.model.dto.photo.UploadedPhotoDTO;
import ru.oparin.dreamboat.model.entity.SourcePhoto;
import ru.oparin.dreamboat.model.enums.ValidationStatus;
import ru.oparin.dreamboat.repository.SourcePhotoRepository;
import ru.oparin.dreamboat.service.storage.ImageStorage;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Сервис для работы с исходными фотографиями пользователей.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SourcePhotoService {

    private final SourcePhotoRepository sourcePhotoRepository;
    private final ImageStorage imageStorage;
    private final Clock clock;

    /**
     * Зарегистрировать загруженные фотографии.
     * Принимаются только пути из директории загрузок пользователя. Фотографии вне ее
     * и фотографии, которых нет в хранилище, пропускаются. Повторная регистрация того же пути
     * возвращает существующую запись.
     */
    public Mono<RecordUploadsResponseDTO> recordUploadedPhotos(Long userId, List<UploadedPhotoDTO> uploads) {
        List<SourcePhotoDTO> recorded = new ArrayList<>();
        List<RecordUploadsResponseDTO.SkippedUploadDTO> skipped = new ArrayList<>();

        return Flux.fromIterable(uploads)
                .concatMap(upload -> {
                    if (!isOwnUpload(userId, upload.getStorageLocator())) {
                        log.warn("Фотография {} не находится в директории загрузок пользователя {}",
                                upload.getStorageLocator(), userId);
                        skipped.add(skippedUpload(upload, "Файл не принадлежит пользователю"));
                        return Mono.empty();
                    }
                    return imageStorage.exists(upload.getStorageLocator())
                            .flatMap(exists -> {
                                if (!exists) {
                                    log.warn("Фотография {} пользователя {} не найдена в хранилище", upload.getStorageLocator(), userId);
                                    skipped.add(skippedUpload(upload, "Файл не найден в хранилище"));
                                    return Mono.empty();
                                }
                                return findOrCreate(userId, upload);
                            });
                })
                .doOnNext(photo -> recorded.add(SourcePhotoDTO.fromEntity(photo)))
                .then(Mono.fromSupplier(() -> {
                    log.info("Пользователь {} загрузил {} фотографий, пропущено {}", userId, recorded.size(), skipped.size());
                    return RecordUploadsResponseDTO.builder()
                            .photos(recorded)
                            .skipped(skipped)
                            .build();
                }));
    }

    public Flux<SourcePhoto> getPhotos(Long userId) {
        return sourcePhotoRepository.findByUserIdOrderByCreatedAtDesc(userId);
    }

    /**
     * Получить фотографии пользователя, пригодные для генерации, в порядке запроса.
     *
     * @throws PhotoNotFoundException     если фотография не найдена или принадлежит другому пользователю
     * @throws PhotoNotEligibleException если фотография не прошла проверку
     */
    public Mono<List<SourcePhoto>> getEligiblePhotos(Long userId, List<Long> photoIds) {
        List<Long> distinctIds = new ArrayList<>(new LinkedHashSet<>(photoIds));
        return Flux.fromIterable(distinctIds)
                .concatMap(photoId -> sourcePhotoRepository.findByIdAndUserId(photoId, userId)
                        .switchIfEmpty(Mono.error(() -> new PhotoNotFoundException(photoId))))
                .collectMap(SourcePhoto::getId, Function.identity())
                .flatMap(photosById -> checkEligible(distinctIds, photosById));
    }

    private Mono<List<SourcePhoto>> checkEligible(List<Long> photoIds, Map<Long, SourcePhoto> photosById) {
        List<SourcePhoto> photos = photoIds.stream()
                .map(photosById::get)
                .collect(Collectors.toList());
        for (SourcePhoto photo : photos) {
            if (!photo.isEligibleForGeneration()) {
                return Mono.error(new PhotoNotEligibleException(photo.getId(), photo.getValidationStatus()));
            }
        }
        return Mono.just(photos);
    }

    /**
     * Путь относится к директории uploads/{userId}/ и не выходит из нее.
     */
    static boolean isOwnUpload(Long userId, String locator) {
        if (locator == null || locator.isBlank()) {
            return false;
        }
        try {
            Path path = Paths.get(locator).normalize();
            return !path.isAbsolute()
                    && path.getNameCount() > 2
                    && path.startsWith(Paths.get(ImageStorage.UPLOADS_SUBDIRECTORY, String.valueOf(userId)));
        } catch (InvalidPathException e) {
            return false;
        }
    }

    private RecordUploadsResponseDTO.SkippedUploadDTO skippedUpload(UploadedPhotoDTO upload, String error) {
        return RecordUploadsResponseDTO.SkippedUploadDTO.builder()
                .storageLocator(upload.getStorageLocator())
                .originalFileName(upload.getOriginalFileName())
                .error(error)
                .build();
    }

    private Mono<SourcePhoto> findOrCreate(Long userId, UploadedPhotoDTO upload) {
        return sourcePhotoRepository.findByUserIdAndStorageLocator(userId, upload.getStorageLocator())
                .switchIfEmpty(Mono.defer(() -> {
                    LocalDateTime now = LocalDateTime.now(clock);
                    return sourcePhotoRepository.save(SourcePhoto.builder()
                            .userId(userId)
                            .originalFileName(upload.getOriginalFileName())
                            .storageLocator(upload.getStorageLocator())
                            .contentType(upload.getContentType())
                            .validationStatus(ValidationStatus.PENDING)
                            .warningsJson("[]")
                            .createdAt(now)
                            .updatedAt(now)
                            .build());
                }));
    }
}
