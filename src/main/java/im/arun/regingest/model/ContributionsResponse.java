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
 * Reader for a page of {@code /search/contributions/{type}.json}.
 */
public final class ContributionsResponse {
    private static final Logger logger = LoggerFactory.getLogger(ContributionsResponse.class);
    public static final String COUNT_FIELD = "TotalResultCount";

    private ContributionsResponse() {}

    /**
     * Valid contributions with text, in response order. Entries that do not bind or fail
     * validation are dropped.
     *
     * @throws ValidationException if the page has no {@code Results} array
     */
    public static List<Contribution> parse(JsonNode body, ObjectMapper mapper) {
        JsonNode results = body == null ? null : body.get("Results");
        if (results == null || !results.isArray()) {
            throw new ValidationException("Contributions page without Results array");
        }
        List<Contribution> valid = new ArrayList<>();
        for (JsonNode entry : results) {
            try {
                Contribution contribution = mapper.treeToValue(entry, Contribution.class);
                if (!contribution.hasText()) {
                    continue;
                }
                contribution.validate();
                valid.add(contribution);
            } catch (ValidationException e) {
                logger.warn("Dropping contribution: {}", e.getMessage());
            } catch (JsonProcessingException | IllegalArgumentException e) {
                logger.warn("Dropping unreadable contribution: {}", e.getMessage());
            }
        }
        return valid;
    }
}
