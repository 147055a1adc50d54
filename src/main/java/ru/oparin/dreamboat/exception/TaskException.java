package ru.oparin.dreamboat.exception;

import lombok.Getter;

/**
 * Ошибка выполнения одной задачи генерации.
 * Остается внутри результата пакета и не прерывает остальные задачи.
 */
@Getter
public class TaskException extends RuntimeException {

    private final int position;
    private final Long photoId;
    private final String scenario;

    public TaskException(int position, Long photoId, String scenario, Throwable cause) {
        super("Задача #" + position + " (фото " + photoId + ", сценарий " + scenario + ") завершилась ошибкой: "
                + cause.getMessage(), cause);
        this.position = position;
        this.photoId = photoId;
        this.scenario = scenario;
    }
}
