package ru.oparin.dreamboat.service.validation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import ru.oparin.dreamboat.exception.AnalysisResponseException;
import ru.oparin.dreamboat.model.enums.ValidationWarning;

import java.util.EnumSet;
import java.util.Iterator;
import java.util.Set;

/**
 * Разбор ответа сервиса анализа фотографий.
 * Ответ должен содержать JSON объект ровно с пятью булевыми полями критериев.
 */
@Component
@RequiredArgsConstructor
public class AnalysisResponseParser {

    private final ObjectMapper objectMapper;

    /**
     * Получить замечания из ответа.
     *
     * @param responseText текст ответа (JSON может быть окружен посторонним текстом)
     * @return замечания, для которых сервис вернул true
     * @throws AnalysisResponseException если JSON не найден, поле отсутствует, не булево или неизвестно
     */
    public Set<ValidationWarning> parse(String responseText) {
        if (responseText == null) {
            throw new AnalysisResponseException("Пустой ответ сервиса анализа");
        }
        int start = responseText.indexOf('{');
        int end = responseText.lastIndexOf('}');
        if (start < 0 || end < start) {
            throw new AnalysisResponseException("В ответе сервиса анализа нет JSON объекта: " + responseText);
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(responseText.substring(start, end + 1));
        } catch (JsonProcessingException e) {
            throw new AnalysisResponseException("Некорректный JSON в ответе сервиса анализа: " + responseText, e);
        }
        if (root == null || !root.isObject()) {
            throw new AnalysisResponseException("Ответ сервиса анализа не является JSON объектом: " + responseText);
        }

        Iterator<String> fieldNames = root.fieldNames();
        while (fieldNames.hasNext()) {
            String fieldName = fieldNames.next();
            if (ValidationWarning.fromFieldName(fieldName) == null) {
                throw new AnalysisResponseException("Неизвестное поле в ответе сервиса анализа: " + fieldName);
            }
        }

        Set<ValidationWarning> warnings = EnumSet.noneOf(ValidationWarning.class);
        for (ValidationWarning warning : ValidationWarning.values()) {
            JsonNode value = root.get(warning.getFieldName());
            if (value == null) {
                throw new AnalysisResponseException("В ответе сервиса анализа нет поля " + warning.getFieldName());
            }
            if (!value.isBoolean()) {
                throw new AnalysisResponseException("Поле " + warning.getFieldName() + " должно быть булевым, получено: " + value);
            }
            if (value.booleanValue()) {
                warnings.add(warning);
            }
        }
        return warnings;
    }
}
