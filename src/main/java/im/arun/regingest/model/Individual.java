package im.arun.regingest.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import im.arun.regingest.exception.ValidationException;
import im.arun.regingest.index.DocumentKeys;
import im.arun.regingest.index.IndexableRecord;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Approved person on the FCA register with controlled functions and disciplinary history.
 */
@Data
@NoArgsConstructor
public class Individual implements IndexableRecord {

    @JsonProperty("individual_reference_number")
    private String individualReferenceNumber;

    @JsonProperty("full_name")
    private String fullName;

    @JsonProperty("commonly_used_name")
    private String commonlyUsedName;

    @JsonProperty("individual_status")
    private String individualStatus;

    @JsonProperty("current_roles")
    private List<ControlledFunction> currentRoles = new ArrayList<>();

    @JsonProperty("previous_roles")
    private List<ControlledFunction> previousRoles = new ArrayList<>();

    @JsonProperty("disciplinary_history")
    private List<DisciplinaryAction> disciplinaryHistory = new ArrayList<>();

    @JsonProperty("firm_reference_numbers")
    private List<String> firmReferenceNumbers = new ArrayList<>();

    @Override
    public String documentKey() {
        return DocumentKeys.of("individual", individualReferenceNumber);
    }

    @JsonProperty("register_url")
    public String getRegisterUrl() {
        return "https://register.fca.org.uk/ShPo_IndividualDetailsPage?id=" + individualReferenceNumber;
    }

    public void validate() {
        if (individualReferenceNumber == null || individualReferenceNumber.isBlank()) {
            throw new ValidationException("Individual without reference number");
        }
    }
}
