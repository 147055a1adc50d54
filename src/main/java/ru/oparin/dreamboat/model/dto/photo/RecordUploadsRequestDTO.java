package ru.oparin.dreamboat.model.dto.photo;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecordUploadsRequestDTO {

    @NotEmpty
    @Valid
    private List<UploadedPhotoDTO> photos;
}
