package im.arun.rptsearch.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One dated revision of a report: its index file, its page store and the
 * segment count the catalog recorded for the index file.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ReportInstance {

    @JsonProperty("asOf")
    private String asOf;

    @JsonProperty("indexFile")
    private String indexFile;

    @JsonProperty("pageStore")
    private String pageStore;

    @JsonProperty("segmentCount")
    private Integer segmentCount;
}
