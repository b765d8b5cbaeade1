package im.arun.regingest.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A controlled function held by an individual, current or previous.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ControlledFunction {

    @JsonProperty("role")
    private String role;

    @JsonProperty("firm_name")
    private String firmName;

    @JsonProperty("status")
    private String status;

    @JsonProperty("effective_date")
    private String effectiveDate;

    @JsonProperty("end_date")
    private String endDate;
}
