package ru.oparin.dreamboat.service.generation;

import org.springframework.stereotype.Component;
import ru.oparin.dreamboat.model.entity.SourcePhoto;

import java.util.ArrayList;
import java.util.List;

/**
 * Разворачивание запроса в список задач: каждая фотография с каждым сценарием.
 */
@Component
public class TaskFanout {

    /**
     * Построить задачи в порядке: фотографии во внешнем цикле, сценарии во внутреннем.
     *
     * @param photos    исходные фотографии
     * @param scenarios сценарии
     * @return photos.size() * scenarios.size() задач с позициями 1..N
     * @throws IllegalArgumentException если фотографии или сценарии не указаны
     */
    public List<GenerationTask> expand(List<SourcePhoto> photos, List<String> scenarios) {
        if (photos == null || photos.isEmpty()) {
            throw new IllegalArgumentException("Не выбрано ни одной фотографии");
        }
        if (scenarios == null || scenarios.isEmpty()) {
            throw new IllegalArgumentException("Не выбрано ни одного сценария");
        }

        List<GenerationTask> tasks = new ArrayList<>(photos.size() * scenarios.size());
        int position = 1;
        for (SourcePhoto photo : photos) {
            for (String scenario : scenarios) {
                tasks.add(new GenerationTask(position++, photo, scenario));
            }
        }
        return tasks;
    }
}
