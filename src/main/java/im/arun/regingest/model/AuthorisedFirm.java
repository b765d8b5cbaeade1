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
 * Firm on the FCA Financial Services Register, merged from the firm record and its
 * Names, Address, Permissions, Individuals, Requirements and DisciplinaryHistory resources.
 */
@Data
@NoArgsConstructor
public class AuthorisedFirm implements IndexableRecord {

    @JsonProperty("firm_reference_number")
    private String firmReferenceNumber;

    @JsonProperty("firm_name")
    private String firmName;

    @JsonProperty("trading_names")
    private List<String> tradingNames = new ArrayList<>();

    @JsonProperty("firm_status")
    private String firmStatus;

    @JsonProperty("sub_status")
    private String subStatus;

    @JsonProperty("business_type")
    private String businessType;

    @JsonProperty("status_effective_date")
    private String statusEffectiveDate;

    @JsonProperty("companies_house_number")
    private String companiesHouseNumber;

    @JsonProperty("address_line_1")
    private String addressLine1;

    @JsonProperty("address_line_2")
    private String addressLine2;

    @JsonProperty("address_line_3")
    private String addressLine3;

    @JsonProperty("address_line_4")
    private String addressLine4;

    @JsonProperty("city")
    private String city;

    @JsonProperty("county")
    private String county;

    @JsonProperty("postcode")
    private String postcode;

    @JsonProperty("country")
    private String country;

    @JsonProperty("telephone")
    private String telephone;

    @JsonProperty("website")
    private String website;

    @JsonProperty("permissions")
    private List<String> permissions = new ArrayList<>();

    @JsonProperty("regulatory_requirements")
    private List<String> regulatoryRequirements = new ArrayList<>();

    @JsonProperty("client_money_permission")
    private String clientMoneyPermission;

    @JsonProperty("psd_status")
    private String psdStatus;

    @JsonProperty("mlrs_status")
    private String mlrsStatus;

    @JsonProperty("key_individuals")
    private List<String> keyIndividuals = new ArrayList<>();

    @JsonProperty("disciplinary_history")
    private List<String> disciplinaryHistory = new ArrayList<>();

    @JsonProperty("exceptional_info")
    private List<String> exceptionalInfo = new ArrayList<>();

    @JsonProperty("search_term")
    private String searchTerm;

    @Override
    public String documentKey() {
        return DocumentKeys.of("firm", firmReferenceNumber);
    }

    @JsonProperty("register_url")
    public String getRegisterUrl() {
        return "https://register.fca.org.uk/ShPo_FirmDetailsPage?id=" + firmReferenceNumber;
    }

    public void validate() {
        if (firmReferenceNumber == null || firmReferenceNumber.isBlank()) {
            throw new ValidationException("Firm without reference number");
        }
    }
}
