package ru.oparin.dreamboat.service.generation;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ScenarioPromptResolverTest {

    private final ScenarioPromptResolver resolver = new ScenarioPromptResolver();

    @Test
    void resolve_shouldUseCustomPrompt_whenProvided() {
        assertEquals("Me on a yacht", resolver.resolve("beach", "  Me on a yacht "));
    }

    @Test
    void resolve_shouldUseScenarioPrompt_whenCustomPromptBlank() {
        assertEquals("Beach setting with golden hour lighting and ocean backdrop. "
                        + "Create a photorealistic, high-quality image with professional composition.",
                resolver.resolve("beach", " "));
    }

    @Test
    void buildScenarioPrompt_shouldFallBackToCasual_whenScenarioUnknown() {
        String prompt = resolver.buildScenarioPrompt("underwater", null);

        assertTrue(prompt.startsWith("Casual everyday setting"));
    }

    @Test
    void buildScenarioPrompt_shouldAppendUserDescription() {
        String prompt = resolver.buildScenarioPrompt("gym", "wearing a red shirt");

        assertEquals("Athletic fitness setting with gym equipment and dynamic lighting. "
                + "Additional details: wearing a red shirt. "
                + "Create a photorealistic, high-quality image with professional composition.", prompt);
    }
}
