package ru.oparin.dreamboat.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import ru.oparin.dreamboat.model.dto.photo.*;
import ru.oparin.dreamboat.service.SourcePhotoService;
import ru.oparin.dreamboat.service.validation.PhotoValidator;

import java.util.List;

@RestController
@RequestMapping("/photos")
@RequiredArgsConstructor
@Tag(name = "Фотографии", description = "API для регистрации и проверки исходных фотографий")
public class PhotoController {

    private final SourcePhotoService sourcePhotoService;
    private final PhotoValidator photoValidator;

    @Operation(summary = "Зарегистрировать загруженные фотографии",
            description = "Создает записи для фотографий, найденных в хранилище, и возвращает пропущенные")
    @PostMapping
    public Mono<ResponseEntity<RecordUploadsResponseDTO>> recordUploads(
            @Parameter(description = "Идентификатор пользователя") @RequestHeader(ApiHeaders.USER_ID) Long userId,
            @Valid @RequestBody RecordUploadsRequestDTO request) {
        return sourcePhotoService.recordUploadedPhotos(userId, request.getPhotos())
                .map(ResponseEntity::ok);
    }

    @Operation(summary = "Получить фотографии пользователя")
    @GetMapping
    public Mono<ResponseEntity<List<SourcePhotoDTO>>> getPhotos(
            @Parameter(description = "Идентификатор пользователя") @RequestHeader(ApiHeaders.USER_ID) Long userId) {
        return sourcePhotoService.getPhotos(userId)
                .map(SourcePhotoDTO::fromEntity)
                .collectList()
                .map(ResponseEntity::ok);
    }

    @Operation(summary = "Проверить фотографию",
            description = "Проверяет пригодность фотографии для профиля. Уже проверенные фотографии повторно не анализируются")
    @PostMapping("/{photoId}/validate")
    public Mono<ResponseEntity<ValidationResultDTO>> validate(
            @Parameter(description = "Идентификатор пользователя") @RequestHeader(ApiHeaders.USER_ID) Long userId,
            @PathVariable Long photoId) {
        return photoValidator.validate(userId, photoId)
                .map(ResponseEntity::ok);
    }

    @Operation(summary = "Проверить несколько фотографий", description = "Фотографии проверяются последовательно")
    @PostMapping("/validate")
    public Mono<ResponseEntity<List<ValidationResultDTO>>> validateBatch(
            @Parameter(description = "Идентификатор пользователя") @RequestHeader(ApiHeaders.USER_ID) Long userId,
            @Valid @RequestBody ValidateBatchRequestDTO request) {
        return photoValidator.validateBatch(userId, request.getPhotoIds())
                .map(ResponseEntity::ok);
    }

    @Operation(summary = "Пропустить проверку фотографии",
            description = "Разрешает использовать фотографию для генерации без проверки")
    @PostMapping("/{photoId}/bypass")
    public Mono<ResponseEntity<SourcePhotoDTO>> bypass(
            @Parameter(description = "Идентификатор пользователя") @RequestHeader(ApiHeaders.USER_ID) Long userId,
            @PathVariable Long photoId) {
        return photoValidator.bypass(userId, photoId)
                .map(ResponseEntity::ok);
    }
}
