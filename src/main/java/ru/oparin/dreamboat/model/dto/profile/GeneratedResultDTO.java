package ru.oparin.dreamboat.model.dto.profile;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import ru.oparin.dreamboat.model.entity.GeneratedResult;

import java.time.LocalDateTime;

/**
 * DTO сгенерированного изображения.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GeneratedResultDTO {

    private Long id;

    private Long generationJobId;

    private Long sourcePhotoId;

    private String scenario;

    private String storageLocator;

    /**
     * Позиция в профиле (1..6) или null.
     */
    private Integer profileOrder;

    private Boolean isSample;

    private LocalDateTime createdAt;

    public static GeneratedResultDTO fromEntity(GeneratedResult result) {
        return GeneratedResultDTO.builder()
                .id(result.getId())
                .generationJobId(result.getGenerationJobId())
                .sourcePhotoId(result.getSourcePhotoId())
                .scenario(result.getScenario())
                .storageLocator(result.getStorageLocator())
                .profileOrder(result.getProfileOrder())
                .isSample(result.getIsSample())
                .createdAt(result.getCreatedAt())
                .build();
    }
}
