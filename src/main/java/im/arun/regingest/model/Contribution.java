package im.arun.regingest.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import im.arun.regingest.exception.ValidationException;
import im.arun.regingest.hierarchy.Chamber;
import im.arun.regingest.hierarchy.HierarchyNode;
import im.arun.regingest.index.DocumentKeys;
import im.arun.regingest.index.IndexableRecord;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * A Hansard contribution (speech, written statement, correction or petition) as returned by
 * {@code /search/contributions/{type}.json}, plus its debate ancestor chain.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Contribution implements IndexableRecord {

    @JsonProperty("MemberName")
    private String memberName;

    @JsonProperty("MemberId")
    private Integer memberId;

    @JsonProperty("AttributedTo")
    private String attributedTo;

    @JsonProperty("ItemId")
    private Long itemId;

    @JsonProperty("ContributionExtId")
    private String contributionExtId;

    @JsonProperty("ContributionText")
    private String contributionText;

    @JsonProperty("ContributionTextFull")
    private String contributionTextFull;

    @JsonProperty("HRSTag")
    private String hrsTag;

    @JsonProperty("HansardSection")
    private String hansardSection;

    @JsonProperty("DebateSection")
    private String debateSection;

    @JsonProperty("DebateSectionId")
    private Long debateSectionId;

    @JsonProperty("DebateSectionExtId")
    private String debateSectionExtId;

    @JsonProperty("SittingDate")
    private String sittingDate;

    @JsonProperty("Section")
    private String section;

    @JsonProperty("House")
    private String house;

    @JsonProperty("OrderInDebateSection")
    private Integer orderInDebateSection;

    @JsonProperty("DebateSectionOrder")
    private Integer debateSectionOrder;

    @JsonProperty("Rank")
    private Integer rank;

    @JsonProperty("Timecode")
    private String timecode;

    @JsonProperty("debate_parents")
    private List<HierarchyNode> debateParents;

    /**
     * Key on the contribution's external id, or on a hash of its section, text and position
     * when the upstream record has none.
     */
    @Override
    public String documentKey() {
        if (contributionExtId == null) {
            String hash = DocumentKeys.sha256(debateSectionExtId, contributionText, orderInDebateSection);
            return "debate_" + debateSectionExtId + "_contrib_" + hash;
        }
        return "debate_" + debateSectionExtId + "_contrib_" + contributionExtId;
    }

    @JsonProperty("debate_url")
    public String getDebateUrl() {
        LocalDate day = sittingDay();
        return "https://hansard.parliament.uk/" + house + "/" + (day == null ? "" : day) + "/debates/"
                + debateSectionExtId + "/link";
    }

    @JsonProperty("contribution_url")
    public String getContributionUrl() {
        return contributionExtId == null ? null : getDebateUrl() + "#contribution-" + contributionExtId;
    }

    @JsonIgnore
    public boolean hasText() {
        return contributionTextFull != null && !contributionTextFull.isEmpty();
    }

    /**
     * Calendar day of the sitting, or null when the upstream value is missing or unreadable.
     */
    @JsonIgnore
    public LocalDate sittingDay() {
        if (sittingDate == null || sittingDate.length() < 10) {
            return null;
        }
        try {
            return LocalDate.parse(sittingDate.substring(0, 10));
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    @JsonIgnore
    public Chamber chamber() {
        return Chamber.fromApiName(house);
    }

    /**
     * @throws ValidationException when fields needed for keying or enrichment are missing
     */
    public void validate() {
        if (debateSectionExtId == null || debateSectionExtId.isBlank()) {
            throw new ValidationException("Contribution without DebateSectionExtId");
        }
        if (sittingDay() == null) {
            throw new ValidationException("Contribution " + documentKey() + " has no readable SittingDate");
        }
        try {
            chamber();
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Contribution " + documentKey() + " has unknown House " + house, e);
        }
    }
}
