package im.arun.rptsearch.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Named column range of a line. Columns are 1-based and inclusive.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FieldDef {

    @JsonProperty("lineId")
    private int lineId;

    @JsonProperty("fieldId")
    private int fieldId;

    @JsonProperty("name")
    private String name;

    @JsonProperty("startColumn")
    private int startColumn;

    @JsonProperty("endColumn")
    private int endColumn;

    @JsonProperty("indexed")
    private boolean indexed;

    @JsonProperty("significant")
    private boolean significant;

    public int width() {
        return endColumn - startColumn + 1;
    }
}
