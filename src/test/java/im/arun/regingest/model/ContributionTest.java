package im.arun.regingest.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import im.arun.regingest.exception.ValidationException;
import im.arun.regingest.hierarchy.Chamber;
import im.arun.regingest.hierarchy.HierarchyNode;
import im.arun.regingest.index.DocumentKeys;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ContributionTest {
    private final ObjectMapper mapper = new ObjectMapper();

    static String entry(String extId, String text) {
        return "{\"MemberName\":\"Jane Doe\",\"MemberId\":4000,\"ItemId\":1,"
                + (extId == null ? "" : "\"ContributionExtId\":\"" + extId + "\",")
                + "\"ContributionText\":\"" + text + "\",\"ContributionTextFull\":\"" + text + "\","
                + "\"DebateSection\":\"Financial Services\",\"DebateSectionExtId\":\"SEC-1\","
                + "\"SittingDate\":\"2024-03-05T00:00:00\",\"House\":\"Commons\","
                + "\"OrderInDebateSection\":3,\"Rank\":1}";
    }

    @Test
    void keyUsesExternalIdWhenPresent() throws Exception {
        Contribution contribution = mapper.readValue(entry("C-9", "Hello"), Contribution.class);

        assertThat(contribution.documentKey()).isEqualTo("debate_SEC-1_contrib_C-9");
        assertThat(contribution.getContributionUrl())
                .isEqualTo("https://hansard.parliament.uk/Commons/2024-03-05/debates/SEC-1/link#contribution-C-9");
    }

    @Test
    void keyFallsBackToStableContentHash() throws Exception {
        Contribution first = mapper.readValue(entry(null, "Hello"), Contribution.class);
        Contribution again = mapper.readValue(entry(null, "Hello"), Contribution.class);
        Contribution other = mapper.readValue(entry(null, "Goodbye"), Contribution.class);

        assertThat(first.documentKey())
                .isEqualTo("debate_SEC-1_contrib_" + DocumentKeys.sha256("SEC-1", "Hello", 3))
                .isEqualTo(again.documentKey())
                .isNotEqualTo(other.documentKey());
        assertThat(first.getContributionUrl()).isNull();
    }

    @Test
    void sittingDayAndChamberAreDerived() throws Exception {
        Contribution contribution = mapper.readValue(entry("C-1", "x"), Contribution.class);

        assertThat(contribution.sittingDay()).isEqualTo(LocalDate.of(2024, 3, 5));
        assertThat(contribution.chamber()).isEqualTo(Chamber.COMMONS);
    }

    @Test
    void validationRejectsUnknownHouse() {
        Contribution contribution = new Contribution();
        contribution.setDebateSectionExtId("SEC-1");
        contribution.setSittingDate("2024-03-05");
        contribution.setHouse("Senate");

        assertThatThrownBy(contribution::validate).isInstanceOf(ValidationException.class);
    }

    @Test
    void pageParserDropsEmptyAndInvalidEntries() throws Exception {
        JsonNode page = mapper.readTree("{\"TotalResultCount\":4,\"Results\":["
                + entry("C-1", "Kept") + ","
                + entry("C-2", "") + ","
                + "{\"ContributionTextFull\":\"no section\",\"House\":\"Commons\",\"SittingDate\":\"2024-03-05\"},"
                + entry("C-4", "Also kept") + "]}");

        List<Contribution> contributions = ContributionsResponse.parse(page, mapper);

        assertThat(contributions).extracting(Contribution::getContributionExtId).containsExactly("C-1", "C-4");
    }

    @Test
    void pageWithoutResultsIsInvalid() throws Exception {
        assertThatThrownBy(() -> ContributionsResponse.parse(mapper.readTree("{\"TotalResultCount\":1}"), mapper))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void serializesDebateParentsAndUrls() throws Exception {
        Contribution contribution = mapper.readValue(entry("C-9", "Hello"), Contribution.class);
        contribution.setDebateParents(List.of(new HierarchyNode("1", "SEC-1", "Debate", null)));

        JsonNode json = mapper.valueToTree(contribution);

        assertThat(json.path("document_uri").asText()).isEqualTo("debate_SEC-1_contrib_C-9");
        assertThat(json.path("debate_parents").get(0).path("external_id").asText()).isEqualTo("SEC-1");
        assertThat(json.path("debate_url").asText()).endsWith("/debates/SEC-1/link");
        assertThat(json.has("ContributionTextFull")).isTrue();
    }
}
