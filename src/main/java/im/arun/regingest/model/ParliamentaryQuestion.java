package im.arun.regingest.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import im.arun.regingest.exception.ValidationException;
import im.arun.regingest.index.DocumentKeys;
import im.arun.regingest.index.IndexableRecord;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Written parliamentary question with its answer, from the questions and statements API.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ParliamentaryQuestion implements IndexableRecord {
    private static final String TRUNCATION_MARKER = "...";

    private Long id;
    private Integer askingMemberId;
    private Member askingMember;
    private String house;
    private Boolean memberHasInterest;
    private String dateTabled;
    private String dateForAnswer;
    private String uin;
    private String questionText;
    private Integer answeringBodyId;
    private String answeringBodyName;
    @JsonProperty("isWithdrawn")
    private Boolean isWithdrawn;
    @JsonProperty("isNamedDay")
    private Boolean isNamedDay;
    private List<String> groupedQuestions = new ArrayList<>();
    private Boolean answerIsHolding;
    private Boolean answerIsCorrection;
    private Integer answeringMemberId;
    private Member answeringMember;
    private Integer correctingMemberId;
    private Member correctingMember;
    private String dateAnswered;
    private String answerText;
    private String originalAnswerText;
    private String comparableAnswerText;
    private String dateAnswerCorrected;
    private String dateHoldingAnswer;
    private Integer attachmentCount;
    private String heading;
    private List<Attachment> attachments = new ArrayList<>();
    private List<GroupedQuestionDate> groupedQuestionsDates = new ArrayList<>();

    @Override
    public String documentKey() {
        return DocumentKeys.of("pq", id);
    }

    /**
     * Listing endpoints cut long question and answer texts, ending them with "...".
     */
    @JsonIgnore
    public boolean isTruncated() {
        return (questionText != null && questionText.endsWith(TRUNCATION_MARKER))
                || (answerText != null && answerText.endsWith(TRUNCATION_MARKER));
    }

    /**
     * Replaces the texts with those of the full version of the same question.
     */
    public void applyFullText(ParliamentaryQuestion full) {
        this.questionText = full.getQuestionText();
        this.answerText = full.getAnswerText();
    }

    /**
     * @throws ValidationException when a field the API always sends is missing
     */
    public void validate() {
        requireField(id, "id");
        requireField(askingMemberId, "askingMemberId");
        requireField(house, "house");
        requireField(memberHasInterest, "memberHasInterest");
        requireField(dateTabled, "dateTabled");
        requireField(answeringBodyId, "answeringBodyId");
        requireField(isWithdrawn, "isWithdrawn");
        requireField(isNamedDay, "isNamedDay");
        requireField(attachmentCount, "attachmentCount");
    }

    private void requireField(Object value, String name) {
        if (value == null) {
            throw new ValidationException("Question " + id + " is missing required field " + name);
        }
    }
}
