package im.arun.rptsearch.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Catalog field joined with what the index file knows about it.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IndexedFieldInfo {

    @JsonProperty("name")
    private String name;

    @JsonProperty("line_id")
    private int lineId;

    @JsonProperty("field_id")
    private int fieldId;

    @JsonProperty("start_column")
    private int startColumn;

    @JsonProperty("end_column")
    private int endColumn;

    /** Values of a significant field mark section boundaries. */
    @JsonProperty("significant")
    private boolean significant;

    @JsonProperty("segment")
    private Integer segment;

    @JsonProperty("entry_count")
    private Integer entryCount;

    @JsonProperty("encoding")
    private String encoding;
}
