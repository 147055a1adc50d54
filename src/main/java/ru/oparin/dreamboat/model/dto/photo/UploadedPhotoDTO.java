package ru.oparin.dreamboat.model.dto.photo;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Загруженная пользователем фотография.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UploadedPhotoDTO {

    /**
     * Путь к фотографии в хранилище.
     */
    @NotBlank
    private String storageLocator;

    private String originalFileName;

    private String contentType;
}
