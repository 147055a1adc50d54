package ru.oparin.dreamboat.model.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Замечания к исходной фотографии по правилам контента.
 * Каждому замечанию соответствует одно булево поле в ответе сервиса анализа.
 */
@Getter
@RequiredArgsConstructor
public enum ValidationWarning {

    MULTIPLE_PEOPLE("multiple_people"),
    FACE_COVERED_OR_BLURRED("face_covered_or_blurred"),
    POOR_LIGHTING("poor_lighting"),
    IS_SCREENSHOT("is_screenshot"),
    FACE_PARTIALLY_COVERED("face_partially_covered");

    /**
     * Имя поля в JSON ответе сервиса анализа.
     */
    private final String fieldName;

    /**
     * Найти замечание по имени поля.
     *
     * @param fieldName имя поля из ответа
     * @return замечание или null, если имя не распознано
     */
    public static ValidationWarning fromFieldName(String fieldName) {
        for (ValidationWarning warning : values()) {
            if (warning.fieldName.equals(fieldName)) {
                return warning;
            }
        }
        return null;
    }
}
