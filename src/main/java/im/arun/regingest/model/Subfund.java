package im.arun.regingest.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Subfund {

    @JsonProperty("name")
    private String name;

    @JsonProperty("type")
    private String type;
}
