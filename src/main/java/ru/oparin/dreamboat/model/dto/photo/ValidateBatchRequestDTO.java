package ru.oparin.dreamboat.model.dto.photo;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValidateBatchRequestDTO {

    @NotEmpty
    private List<@NotNull Long> photoIds;
}
