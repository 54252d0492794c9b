package im.arun.rptsearch.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Structural pattern of one kind of report line.
 * Template characters: {@code A} alpha, {@code 9} digit, space, anything else literal.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LineTemplate {

    @JsonProperty("lineId")
    private int lineId;

    @JsonProperty("name")
    private String name;

    @JsonProperty("template")
    private String template;
}
