package im.arun.regingest.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import im.arun.regingest.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Readers for the written questions endpoints: the paged listing, whose items wrap each
 * question in {@code value}, and the single-question lookup.
 */
public final class QuestionsResponse {
    private static final Logger logger = LoggerFactory.getLogger(QuestionsResponse.class);
    public static final String COUNT_FIELD = "totalResults";

    private QuestionsResponse() {}

    /**
     * @throws ValidationException if the page has no {@code results} array
     */
    public static List<ParliamentaryQuestion> parse(JsonNode body, ObjectMapper mapper) {
        JsonNode results = body == null ? null : body.get("results");
        if (results == null || !results.isArray()) {
            throw new ValidationException("Questions page without results array");
        }
        List<ParliamentaryQuestion> valid = new ArrayList<>();
        for (JsonNode item : results) {
            try {
                valid.add(parseValue(item, mapper));
            } catch (ValidationException e) {
                logger.warn("Dropping question: {}", e.getMessage());
            }
        }
        return valid;
    }

    /**
     * Reads the {@code value} object of a listing item or a single-question response.
     */
    public static ParliamentaryQuestion parseValue(JsonNode wrapper, ObjectMapper mapper) {
        JsonNode value = wrapper == null ? null : wrapper.get("value");
        if (value == null || !value.isObject()) {
            throw new ValidationException("Question item without value object");
        }
        ParliamentaryQuestion question;
        try {
            question = mapper.treeToValue(value, ParliamentaryQuestion.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ValidationException("Unreadable question: " + e.getMessage(), e);
        }
        question.validate();
        return question;
    }
}
