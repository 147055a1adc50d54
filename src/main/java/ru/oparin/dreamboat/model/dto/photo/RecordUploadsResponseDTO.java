package ru.oparin.dreamboat.model.dto.photo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Результат регистрации загруженных фотографий.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecordUploadsResponseDTO {

    /**
     * Зарегистрированные фотографии.
     */
    private List<SourcePhotoDTO> photos;

    /**
     * Фотографии, не найденные в хранилище.
     */
    private List<SkippedUploadDTO> skipped;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SkippedUploadDTO {
        private String storageLocator;
        private String originalFileName;
        private String error;
    }
}
