package im.arun.rptsearch.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Totals of a batch audit plus the per-file results they were computed from.
 */
@Data
@NoArgsConstructor
public class AuditSummary {

    @JsonProperty("files_audited")
    private int filesAudited;

    @JsonProperty("files_with_errors")
    private int filesWithErrors;

    @JsonProperty("files_with_warnings")
    private int filesWithWarnings;

    @JsonProperty("segment_count_mismatches")
    private int segmentCountMismatches;

    @JsonProperty("catalog_segment_count_missing")
    private int catalogSegmentCountMissing;

    @JsonProperty("cancelled")
    private boolean cancelled;

    @JsonProperty("warning_counts")
    private Map<String, Integer> warningCounts = new TreeMap<>();

    @JsonProperty("results")
    private List<AuditFileResult> results = new ArrayList<>();

    void add(AuditFileResult result) {
        results.add(result);
        filesAudited++;
        if (result.getStatus() == AuditFileResult.Status.ERROR) {
            filesWithErrors++;
        } else if (result.getStatus() == AuditFileResult.Status.WARNINGS) {
            filesWithWarnings++;
        }
        if (result.getSegmentCountMatches() == null) {
            if (result.getMarkerSegments() != null) {
                catalogSegmentCountMissing++;
            }
        } else if (!result.getSegmentCountMatches()) {
            segmentCountMismatches++;
        }
    }

    void countWarning(String kind) {
        warningCounts.merge(kind, 1, Integer::sum);
    }
}
