package ru.oparin.dreamboat.model.dto.photo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import ru.oparin.dreamboat.model.entity.SourcePhoto;
import ru.oparin.dreamboat.model.enums.ValidationStatus;
import ru.oparin.dreamboat.model.enums.ValidationWarning;

import java.time.LocalDateTime;
import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourcePhotoDTO {

    private Long id;

    private String originalFileName;

    private String storageLocator;

    private ValidationStatus validationStatus;

    private Set<ValidationWarning> warnings;

    private LocalDateTime createdAt;

    public static SourcePhotoDTO fromEntity(SourcePhoto photo) {
        return SourcePhotoDTO.builder()
                .id(photo.getId())
                .originalFileName(photo.getOriginalFileName())
                .storageLocator(photo.getStorageLocator())
                .validationStatus(photo.getValidationStatus())
                .warnings(photo.getWarnings())
                .createdAt(photo.getCreatedAt())
                .build();
    }
}
