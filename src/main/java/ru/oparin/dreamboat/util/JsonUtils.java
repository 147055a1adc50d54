package ru.oparin.dreamboat.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Утилитный класс для хранения списков строк в текстовых колонках в формате JSON массива.
 */
@UtilityClass
@Slf4j
public class JsonUtils {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    /**
     * Преобразовать список строк в JSON строку.
     *
     * @param list список строк для сериализации
     * @return JSON строка в формате ["item1", "item2", ...]; для null возвращается пустой массив
     */
    public static String convertListToJson(List<String> list) {
        if (list == null || list.isEmpty()) {
            return "[]";
        }
        try {
            return OBJECT_MAPPER.writeValueAsString(list);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Не удалось сериализовать список в JSON: " + e.getMessage(), e);
        }
    }

    /**
     * Преобразовать JSON строку в список строк.
     *
     * @param json JSON строка в формате ["item1", "item2", ...]
     * @return список строк или пустой список, если JSON пустой или некорректный
     */
    public static List<String> parseJsonToList(String json) {
        if (json == null || json.isBlank() || "null".equals(json)) {
            return List.of();
        }
        try {
            return List.copyOf(OBJECT_MAPPER.readValue(json, STRING_LIST));
        } catch (JsonProcessingException e) {
            log.warn("Некорректный JSON массив в БД: {}", json);
            return List.of();
        }
    }
}
