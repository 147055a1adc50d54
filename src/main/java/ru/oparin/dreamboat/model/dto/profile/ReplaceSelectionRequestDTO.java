package ru.oparin.dreamboat.model.dto.profile;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReplaceSelectionRequestDTO {

    @NotNull
    @Size(max = 6)
    @Valid
    private List<ProfileSlotDTO> selections;
}
