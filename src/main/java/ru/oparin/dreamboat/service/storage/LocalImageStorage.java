package ru.oparin.dreamboat.service.storage;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.UUID;

/**
 * Хранилище изображений на локальном диске.
 * Путь изображения задается относительно корневой директории загрузок.
 */
@Slf4j
@Service
public class LocalImageStorage implements ImageStorage {

    private static final long MAX_FILE_SIZE = 10 * 1024 * 1024; // 10MB

    private final Path rootDir;

    public LocalImageStorage(@Value("${file.upload-dir}") String uploadDir) {
        this.rootDir = Paths.get(uploadDir).toAbsolutePath().normalize();
    }

    @Override
    public Mono<byte[]> read(String locator) {
        return Mono.fromCallable(() -> {
                    Path filePath = resolve(locator);
                    if (!Files.isRegularFile(filePath)) {
                        throw new IllegalArgumentException("Изображение не найдено: " + locator);
                    }
                    return Files.readAllBytes(filePath);
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<String> store(byte[] imageBytes, Long ownerId, String subdirectory, String extension) {
        return Mono.fromCallable(() -> {
                    if (imageBytes == null || imageBytes.length == 0) {
                        throw new IllegalArgumentException("Изображение не может быть пустым");
                    }
                    if (imageBytes.length > MAX_FILE_SIZE) {
                        throw new IllegalArgumentException("Изображение слишком большое (максимум 10MB)");
                    }

                    String relativeDir = subdirectory != null && !subdirectory.isEmpty()
                            ? subdirectory + "/" + ownerId
                            : String.valueOf(ownerId);
                    String locator = relativeDir + "/" + UUID.randomUUID() + "." + normalizeExtension(extension);

                    Path filePath = resolve(locator);
                    try {
                        Files.createDirectories(filePath.getParent());
                        Files.write(filePath, imageBytes, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
                    } catch (IOException e) {
                        log.error("Ошибка при сохранении изображения пользователя {}", ownerId, e);
                        throw new UncheckedIOException("Ошибка при сохранении изображения: " + e.getMessage(), e);
                    }

                    log.info("Изображение пользователя {} сохранено: {} (размер: {} байт)", ownerId, locator, imageBytes.length);
                    return locator;
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<Boolean> exists(String locator) {
        return Mono.fromCallable(() -> Files.isRegularFile(resolve(locator)))
                .onErrorReturn(IllegalArgumentException.class, false)
                .subscribeOn(Schedulers.boundedElastic());
    }

    private Path resolve(String locator) {
        if (locator == null || locator.isBlank()) {
            throw new IllegalArgumentException("Путь к изображению не может быть пустым");
        }
        Path filePath = rootDir.resolve(locator).normalize();
        if (!filePath.startsWith(rootDir)) {
            throw new IllegalArgumentException("Недопустимый путь к изображению: " + locator);
        }
        return filePath;
    }

    private String normalizeExtension(String extension) {
        if (extension == null || extension.isBlank()) {
            return "png";
        }
        String format = extension.toLowerCase();
        return format.equals("jpeg") ? "jpg" : format;
    }
}
