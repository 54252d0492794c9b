package im.arun.rptsearch.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;

/**
 * One classified report line with its extracted field values.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"report", "instance", "page", "line", "line_id", "line_name", "fields"})
public class MatchedRecord {

    @JsonProperty("report")
    private String report;

    @JsonProperty("instance")
    private String instance;

    @JsonProperty("page")
    private int page;

    @JsonProperty("line")
    private int line;

    @JsonProperty("line_id")
    private int lineId;

    @JsonProperty("line_name")
    private String lineName;

    @JsonProperty("fields")
    private LinkedHashMap<String, String> fields;
}
