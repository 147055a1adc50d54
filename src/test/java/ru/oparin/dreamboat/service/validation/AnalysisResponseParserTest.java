package ru.oparin.dreamboat.service.validation;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import ru.oparin.dreamboat.exception.AnalysisResponseException;
import ru.oparin.dreamboat.model.enums.ValidationWarning;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AnalysisResponseParserTest {

    private final AnalysisResponseParser parser = new AnalysisResponseParser(new ObjectMapper());

    @Test
    void parse_shouldReturnWarningsForTrueFields() {
        Set<ValidationWarning> warnings = parser.parse("{\"multiple_people\": false, \"face_covered_or_blurred\": true, "
                + "\"poor_lighting\": false, \"is_screenshot\": true, \"face_partially_covered\": false}");

        assertEquals(Set.of(ValidationWarning.FACE_COVERED_OR_BLURRED, ValidationWarning.IS_SCREENSHOT), warnings);
    }

    @Test
    void parse_shouldIgnoreTextAroundJson() {
        Set<ValidationWarning> warnings = parser.parse("Here is the result:\n```json\n"
                + "{\"multiple_people\": false, \"face_covered_or_blurred\": false, \"poor_lighting\": false, "
                + "\"is_screenshot\": false, \"face_partially_covered\": false}\n```");

        assertTrue(warnings.isEmpty());
    }

    @Test
    void parse_shouldFail_whenFieldMissing() {
        assertThrows(AnalysisResponseException.class, () -> parser.parse(
                "{\"multiple_people\": false, \"poor_lighting\": false, \"is_screenshot\": false, "
                        + "\"face_partially_covered\": false}"));
    }

    @Test
    void parse_shouldFail_whenFieldNotBoolean() {
        assertThrows(AnalysisResponseException.class, () -> parser.parse(
                "{\"multiple_people\": \"no\", \"face_covered_or_blurred\": false, \"poor_lighting\": false, "
                        + "\"is_screenshot\": false, \"face_partially_covered\": false}"));
    }

    @Test
    void parse_shouldFail_whenUnknownFieldPresent() {
        assertThrows(AnalysisResponseException.class, () -> parser.parse(
                "{\"multiple_people\": false, \"face_covered_or_blurred\": false, \"poor_lighting\": false, "
                        + "\"is_screenshot\": false, \"face_partially_covered\": false, \"is_blurry\": true}"));
    }

    @Test
    void parse_shouldFail_whenNoJsonObject() {
        assertThrows(AnalysisResponseException.class, () -> parser.parse("Sorry, I can't help with that."));
        assertThrows(AnalysisResponseException.class, () -> parser.parse(null));
    }
}
