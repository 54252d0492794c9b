package im.arun.rptsearch.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Audit findings for one archive pair (index file plus page store).
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AuditFileResult {

    public enum Status { OK, WARNINGS, ERROR }

    @JsonProperty("report")
    private String report;

    @JsonProperty("as_of")
    private String asOf;

    @JsonProperty("index_file")
    private String indexFile;

    @JsonProperty("page_store")
    private String pageStore;

    @JsonProperty("status")
    private Status status = Status.OK;

    @JsonProperty("declared_segments")
    private Integer declaredSegments;

    @JsonProperty("marker_segments")
    private Integer markerSegments;

    @JsonProperty("catalog_segments")
    private Integer catalogSegments;

    @JsonProperty("segment_count_matches")
    private Boolean segmentCountMatches;

    @JsonProperty("pages")
    private Integer pages;

    @JsonProperty("sections")
    private Integer sections;

    @JsonProperty("probe_records")
    private Integer probeRecords;

    @JsonProperty("probe_status")
    private QueryStatus probeStatus;

    @JsonProperty("warnings")
    private List<String> warnings = new ArrayList<>();

    @JsonProperty("error")
    private String error;
}
