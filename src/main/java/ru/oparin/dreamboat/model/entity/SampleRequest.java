package ru.oparin.dreamboat.model.entity;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Запрос пробной генерации. Не больше одной записи на пользователя.
 */
@Table(value = "sample_request", schema = "dreamboat")
@Getter
@Setter
@EqualsAndHashCode
@ToString
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SampleRequest {

    @Id
    private Long userId;

    private Long sourcePhotoId;

    private LocalDateTime requestedAt;
}
