package ru.oparin.dreamboat.service.generation;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

/**
 * Промпты сценариев генерации.
 */
@Component
public class ScenarioPromptResolver {

    public static final String DEFAULT_SCENARIO = "casual";

    private static final String QUALITY_SUFFIX =
            "Create a photorealistic, high-quality image with professional composition.";

    private static final Map<String, String> BASE_PROMPTS = Map.of(
            "photoshoot", "Professional portrait photography session with studio lighting and modern backdrop",
            "nature", "Outdoor nature setting with natural lighting and scenic landscape background",
            "gym", "Athletic fitness setting with gym equipment and dynamic lighting",
            "beach", "Beach setting with golden hour lighting and ocean backdrop",
            "rooftop", "Urban rooftop setting with city skyline and sunset lighting",
            DEFAULT_SCENARIO, "Casual everyday setting with natural lighting and comfortable environment"
    );

    /**
     * Получить промпт для задачи.
     * Пользовательский промпт используется как есть, иначе строится промпт сценария.
     *
     * @param scenario     имя сценария
     * @param customPrompt пользовательский промпт или null
     */
    public String resolve(String scenario, String customPrompt) {
        if (customPrompt != null && !customPrompt.isBlank()) {
            return customPrompt.trim();
        }
        return buildScenarioPrompt(scenario, null);
    }

    /**
     * Построить промпт сценария. Для неизвестного сценария используется casual.
     *
     * @param scenario        имя сценария
     * @param userDescription дополнительное описание от пользователя или null
     */
    public String buildScenarioPrompt(String scenario, String userDescription) {
        String key = scenario != null ? scenario.toLowerCase(Locale.ROOT) : DEFAULT_SCENARIO;
        String basePrompt = BASE_PROMPTS.getOrDefault(key, BASE_PROMPTS.get(DEFAULT_SCENARIO));

        if (userDescription != null && !userDescription.isBlank()) {
            return basePrompt + ". Additional details: " + userDescription.trim() + ". " + QUALITY_SUFFIX;
        }
        return basePrompt + ". " + QUALITY_SUFFIX;
    }
}
