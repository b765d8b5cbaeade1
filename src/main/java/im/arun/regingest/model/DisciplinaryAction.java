package im.arun.regingest.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One entry of a firm's or individual's {@code /DisciplinaryHistory}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DisciplinaryAction {

    @JsonProperty("action_type")
    private String actionType;

    @JsonProperty("enforcement_type")
    private String enforcementType;

    @JsonProperty("description")
    private String description;

    @JsonProperty("effective_date")
    private String effectiveDate;
}
