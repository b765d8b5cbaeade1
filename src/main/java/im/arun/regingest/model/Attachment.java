package im.arun.regingest.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Attachment {
    private String url;
    private String title;
    private String fileType;
    private Long fileSizeBytes;
}
