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
 * Collective investment scheme on the FCA register.
 */
@Data
@NoArgsConstructor
public class Product implements IndexableRecord {

    @JsonProperty("product_reference_number")
    private String productReferenceNumber;

    @JsonProperty("product_name")
    private String productName;

    @JsonProperty("other_names")
    private List<ProductName> otherNames = new ArrayList<>();

    @JsonProperty("product_type")
    private String productType;

    @JsonProperty("scheme_type")
    private String schemeType;

    @JsonProperty("status")
    private String status;

    @JsonProperty("effective_date")
    private String effectiveDate;

    @JsonProperty("operator_name")
    private String operatorName;

    @JsonProperty("cis_depositary_name")
    private String cisDepositaryName;

    @JsonProperty("subfunds")
    private List<Subfund> subfunds = new ArrayList<>();

    @JsonProperty("search_term")
    private String searchTerm;

    @Override
    public String documentKey() {
        return DocumentKeys.of("product", productReferenceNumber);
    }

    @JsonProperty("register_url")
    public String getRegisterUrl() {
        return "https://register.fca.org.uk/ShPo_ProductDetailsPage?id=" + productReferenceNumber;
    }

    public void validate() {
        if (productReferenceNumber == null || productReferenceNumber.isBlank()) {
            throw new ValidationException("Product without reference number");
        }
    }
}
