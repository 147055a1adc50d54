package ru.oparin.dreamboat.util;

import lombok.experimental.UtilityClass;

import java.util.Locale;

/**
 * Определение MIME типа и расширения изображений.
 */
@UtilityClass
public class ImageFormatUtils {

    public static final String DEFAULT_MIME_TYPE = "image/jpeg";

    /**
     * Получить MIME тип по расширению файла в пути.
     *
     * @param locator путь к изображению
     * @return MIME тип, image/jpeg если расширение неизвестно
     */
    public static String mimeTypeOf(String locator) {
        if (locator == null) {
            return DEFAULT_MIME_TYPE;
        }
        int dot = locator.lastIndexOf('.');
        String extension = dot >= 0 ? locator.substring(dot + 1).toLowerCase(Locale.ROOT) : "";
        return switch (extension) {
            case "png" -> "image/png";
            case "webp" -> "image/webp";
            case "heic" -> "image/heic";
            case "heif" -> "image/heif";
            default -> DEFAULT_MIME_TYPE;
        };
    }

    /**
     * Получить расширение файла по MIME типу.
     */
    public static String extensionOf(String mimeType) {
        if (mimeType == null) {
            return "png";
        }
        return switch (mimeType.toLowerCase(Locale.ROOT)) {
            case "image/jpeg", "image/jpg" -> "jpg";
            case "image/webp" -> "webp";
            default -> "png";
        };
    }
}
