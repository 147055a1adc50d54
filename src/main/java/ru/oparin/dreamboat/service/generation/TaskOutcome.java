package ru.oparin.dreamboat.service.generation;

/**
 * Результат выполнения одной задачи пакета: значение или ошибка.
 *
 * @param task  задача
 * @param value результат (null при ошибке)
 * @param error ошибка (null при успехе)
 */
public record TaskOutcome<T, R>(T task, R value, Throwable error) {

    public static <T, R> TaskOutcome<T, R> success(T task, R value) {
        return new TaskOutcome<>(task, value, null);
    }

    public static <T, R> TaskOutcome<T, R> failure(T task, Throwable error) {
        return new TaskOutcome<>(task, null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
