package ru.oparin.dreamboat.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import ru.oparin.dreamboat.model.dto.profile.GeneratedResultDTO;
import ru.oparin.dreamboat.model.dto.profile.ReplaceSelectionRequestDTO;
import ru.oparin.dreamboat.model.dto.profile.ToggleSelectionRequestDTO;
import ru.oparin.dreamboat.service.ProfileSelectionService;

import java.util.List;

@RestController
@RequestMapping("/profile")
@RequiredArgsConstructor
@Tag(name = "Профиль", description = "API для выбора изображений профиля")
public class ProfileController {

    private final ProfileSelectionService profileSelectionService;

    @Operation(summary = "Получить все сгенерированные изображения")
    @GetMapping("/results")
    public Mono<ResponseEntity<List<GeneratedResultDTO>>> getResults(
            @Parameter(description = "Идентификатор пользователя") @RequestHeader(ApiHeaders.USER_ID) Long userId) {
        return profileSelectionService.getResults(userId)
                .map(GeneratedResultDTO::fromEntity)
                .collectList()
                .map(ResponseEntity::ok);
    }

    @Operation(summary = "Получить изображения профиля", description = "Возвращает выбранные изображения в порядке позиций")
    @GetMapping("/selection")
    public Mono<ResponseEntity<List<GeneratedResultDTO>>> getSelection(
            @Parameter(description = "Идентификатор пользователя") @RequestHeader(ApiHeaders.USER_ID) Long userId) {
        return profileSelectionService.getSelection(userId)
                .map(GeneratedResultDTO::fromEntity)
                .collectList()
                .map(ResponseEntity::ok);
    }

    @Operation(summary = "Заменить выбор изображений профиля",
            description = "Снимает все текущие позиции и назначает переданные (не больше 6)")
    @PutMapping("/selection")
    public Mono<ResponseEntity<List<GeneratedResultDTO>>> replaceSelection(
            @Parameter(description = "Идентификатор пользователя") @RequestHeader(ApiHeaders.USER_ID) Long userId,
            @Valid @RequestBody ReplaceSelectionRequestDTO request) {
        return profileSelectionService.replaceSelection(userId, request.getSelections())
                .map(results -> results.stream().map(GeneratedResultDTO::fromEntity).toList())
                .map(ResponseEntity::ok);
    }

    @Operation(summary = "Установить или снять позицию изображения",
            description = "Если позиция занята, она освобождается. Без позиции изображение убирается из профиля")
    @PatchMapping("/selection/{resultId}")
    public Mono<ResponseEntity<GeneratedResultDTO>> toggle(
            @Parameter(description = "Идентификатор пользователя") @RequestHeader(ApiHeaders.USER_ID) Long userId,
            @PathVariable Long resultId,
            @Valid @RequestBody ToggleSelectionRequestDTO request) {
        return profileSelectionService.toggle(userId, resultId, request.getOrder())
                .map(GeneratedResultDTO::fromEntity)
                .map(ResponseEntity::ok);
    }
}
