package im.arun.regingest.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Member of either House as embedded in written questions with {@code expandMember=true}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Member {
    private Integer id;
    private String listAs;
    private String name;
    private String party;
    private String partyColour;
    private String partyAbbreviation;
    private String memberFrom;
    private String thumbnailUrl;
}
