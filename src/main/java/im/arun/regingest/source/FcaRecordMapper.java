package im.arun.regingest.source;

import com.fasterxml.jackson.databind.JsonNode;
import im.arun.regingest.model.AuthorisedFirm;
import im.arun.regingest.model.ControlledFunction;
import im.arun.regingest.model.DisciplinaryAction;
import im.arun.regingest.model.Individual;
import im.arun.regingest.model.Product;
import im.arun.regingest.model.ProductName;
import im.arun.regingest.model.Subfund;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps FCA register payloads (keys with spaces, as the register sends them) onto the
 * document records.
 */
final class FcaRecordMapper {
    private static final String PRINCIPAL_ADDRESS = "Principal Place of Business";
    private static final Set<String> IGNORED_LIMITATIONS = Set.of("Valid limitation not present", "Limitation Not Found");
    private static final Set<String> IGNORED_REQUIREMENT_KEYS = Set.of("Effective Date", "Requirement Reference",
            "Financial Promotions Requirement", "Financial Promotions Investment Types");

    private FcaRecordMapper() {}

    static AuthorisedFirm firm(String frn, JsonNode base) {
        AuthorisedFirm firm = new AuthorisedFirm();
        firm.setFirmReferenceNumber(frn);
        firm.setFirmName(text(base, "Organisation Name"));
        firm.setFirmStatus(text(base, "Status"));
        firm.setSubStatus(text(base, "Sub-Status"));
        firm.setStatusEffectiveDate(text(base, "Status Effective Date"));
        firm.setBusinessType(text(base, "Business Type"));
        firm.setCompaniesHouseNumber(text(base, "Companies House Number"));
        firm.setClientMoneyPermission(text(base, "Client Money Permission"));
        firm.setPsdStatus(text(base, "PSD / EMD Status"));
        firm.setMlrsStatus(text(base, "MLRs Status"));
        List<String> exceptional = new ArrayList<>();
        for (JsonNode info : base.path("Exceptional Info Details")) {
            exceptional.add(info.path("Exceptional Info Body").asText(""));
        }
        firm.setExceptionalInfo(exceptional);
        return firm;
    }

    /**
     * Current names as-is, previous names suffixed with "(Historical)".
     */
    static List<String> tradingNames(Optional<FcaResponse> response) {
        List<String> names = new ArrayList<>();
        for (JsonNode group : records(response)) {
            for (JsonNode name : group.path("Current Names")) {
                if (!name.path("Name").asText("").isEmpty()) {
                    names.add(name.path("Name").asText());
                }
            }
            for (JsonNode name : group.path("Previous Names")) {
                if (!name.path("Name").asText("").isEmpty()) {
                    names.add(name.path("Name").asText() + " (Historical)");
                }
            }
        }
        return names;
    }

    /**
     * Copies the principal place of business, or else the first address listed.
     */
    static void applyAddress(AuthorisedFirm firm, Optional<FcaResponse> response) {
        JsonNode selected = null;
        for (JsonNode address : records(response)) {
            if (PRINCIPAL_ADDRESS.equals(address.path("Address Type").asText())) {
                selected = address;
                break;
            }
            if (selected == null) {
                selected = address;
            }
        }
        if (selected == null) {
            return;
        }
        firm.setAddressLine1(text(selected, "Address Line 1"));
        firm.setAddressLine2(text(selected, "Address Line 2"));
        firm.setAddressLine3(text(selected, "Address Line 3"));
        firm.setAddressLine4(text(selected, "Address Line 4"));
        firm.setCity(text(selected, "Town"));
        firm.setCounty(text(selected, "County"));
        firm.setPostcode(text(selected, "Postcode"));
        firm.setCountry(text(selected, "Country"));
        firm.setTelephone(text(selected, "Phone Number"));
        firm.setWebsite(text(selected, "Website Address"));
    }

    /**
     * Permitted activities followed by their limitations, as "LIMITATION: ..." entries.
     */
    static List<String> permissions(Optional<FcaResponse> response) {
        List<String> permissions = new ArrayList<>();
        if (response.isEmpty() || !response.get().hasData() || !response.get().getData().isObject()) {
            return permissions;
        }
        Iterator<Map.Entry<String, JsonNode>> activities = response.get().getData().fields();
        while (activities.hasNext()) {
            Map.Entry<String, JsonNode> activity = activities.next();
            permissions.add(activity.getKey());
            for (JsonNode group : activity.getValue()) {
                if (!group.isObject()) {
                    continue;
                }
                Iterator<Map.Entry<String, JsonNode>> details = group.fields();
                while (details.hasNext()) {
                    Map.Entry<String, JsonNode> detail = details.next();
                    if (!detail.getKey().contains("Limitation") || !detail.getValue().isArray()) {
                        continue;
                    }
                    for (JsonNode limitation : detail.getValue()) {
                        if (!IGNORED_LIMITATIONS.contains(limitation.asText())) {
                            permissions.add("LIMITATION: " + limitation.asText());
                        }
                    }
                }
            }
        }
        return permissions;
    }

    static List<String> individualNames(Optional<FcaResponse> response) {
        List<String> names = new ArrayList<>();
        for (JsonNode person : records(response)) {
            names.add(person.path("Name").asText(""));
        }
        return names;
    }

    static List<String> individualReferences(Optional<FcaResponse> response) {
        List<String> irns = new ArrayList<>();
        for (JsonNode person : records(response)) {
            String irn = person.path("IRN").asText("");
            if (!irn.isEmpty()) {
                irns.add(irn);
            }
        }
        return irns;
    }

    static List<String> requirements(Optional<FcaResponse> response) {
        List<String> requirements = new ArrayList<>();
        for (JsonNode requirement : records(response)) {
            Iterator<Map.Entry<String, JsonNode>> fields = requirement.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (IGNORED_REQUIREMENT_KEYS.contains(field.getKey()) || !field.getValue().isTextual()) {
                    continue;
                }
                if (!field.getValue().asText().isEmpty()) {
                    requirements.add(field.getKey() + ": " + field.getValue().asText());
                }
            }
        }
        return requirements;
    }

    static List<DisciplinaryAction> disciplinaryHistory(Optional<FcaResponse> response) {
        List<DisciplinaryAction> actions = new ArrayList<>();
        for (JsonNode action : records(response)) {
            actions.add(new DisciplinaryAction(
                    action.path("TypeofAction").asText(""),
                    action.path("EnforcementType").asText(""),
                    action.path("TypeofDescription").asText(""),
                    action.path("ActionEffectiveFrom").asText("")));
        }
        return actions;
    }

    static Individual individual(String irn, JsonNode detail) {
        JsonNode details = detail.path("Details");
        Individual individual = new Individual();
        individual.setIndividualReferenceNumber(irn);
        individual.setFullName(text(details, "Full Name"));
        individual.setCommonlyUsedName(text(details, "Commonly Used Name"));
        individual.setIndividualStatus(text(details, "Status"));
        return individual;
    }

    /**
     * Splits {@code /CF} into current and previous controlled functions.
     */
    static void applyControlledFunctions(Individual individual, Optional<FcaResponse> response) {
        for (JsonNode group : records(response)) {
            Iterator<Map.Entry<String, JsonNode>> current = group.path("Current").fields();
            while (current.hasNext()) {
                Map.Entry<String, JsonNode> role = current.next();
                individual.getCurrentRoles().add(new ControlledFunction(role.getKey(),
                        text(role.getValue(), "Firm Name"), "Current",
                        text(role.getValue(), "Effective Date"), null));
            }
            Iterator<Map.Entry<String, JsonNode>> previous = group.path("Previous").fields();
            while (previous.hasNext()) {
                Map.Entry<String, JsonNode> role = previous.next();
                individual.getPreviousRoles().add(new ControlledFunction(role.getKey(),
                        text(role.getValue(), "Firm Name"), "Previous",
                        text(role.getValue(), "Effective Date"), text(role.getValue(), "End Date")));
            }
        }
    }

    static Product product(String prn, String name, JsonNode detail) {
        Product product = new Product();
        product.setProductReferenceNumber(prn);
        product.setProductName(name);
        product.setOperatorName(text(detail, "Operator Name"));
        product.setProductType(text(detail, "Product Type"));
        product.setSchemeType(text(detail, "Scheme Type"));
        product.setStatus(text(detail, "Status"));
        product.setEffectiveDate(text(detail, "Effective Date"));
        product.setCisDepositaryName(text(detail, "CIS Depositary Name"));
        return product;
    }

    static List<Subfund> subfunds(Optional<FcaResponse> response) {
        List<Subfund> subfunds = new ArrayList<>();
        for (JsonNode subfund : records(response)) {
            subfunds.add(new Subfund(subfund.path("Name").asText(""), subfund.path("Sub-Fund Type").asText("")));
        }
        return subfunds;
    }

    static List<ProductName> otherNames(Optional<FcaResponse> response) {
        List<ProductName> names = new ArrayList<>();
        for (JsonNode name : records(response)) {
            names.add(new ProductName(
                    name.path("Product Other Name").asText(""),
                    name.path("Effective From").asText(""),
                    name.path("Effective To").asText("")));
        }
        return names;
    }

    private static List<JsonNode> records(Optional<FcaResponse> response) {
        return response.map(FcaResponse::records).orElse(List.of());
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
