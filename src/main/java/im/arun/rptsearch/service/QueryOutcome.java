package im.arun.rptsearch.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import im.arun.rptsearch.model.IntegrityWarning;
import im.arun.rptsearch.model.MatchedRecord;
import im.arun.rptsearch.model.PageFailure;
import im.arun.rptsearch.store.PageText;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of a query: its terminal status, the emitted records in page then line
 * order, and everything that went wrong along the way without stopping it.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QueryOutcome {

    @JsonProperty("status")
    private QueryStatus status;

    @JsonProperty("message")
    private String message;

    @JsonProperty("report")
    private String report;

    @JsonProperty("instance")
    private String instance;

    @JsonProperty("index_entries")
    private int indexEntries;

    @JsonProperty("candidate_pages")
    private int candidatePages;

    @JsonProperty("authorized_pages")
    private int authorizedPages;

    @JsonProperty("records")
    private List<MatchedRecord> records = new ArrayList<>();

    @JsonProperty("raw_pages")
    private List<PageText> rawPages;

    @JsonProperty("failures")
    private List<PageFailure> failures = new ArrayList<>();

    @JsonProperty("warnings")
    private List<IntegrityWarning> warnings = new ArrayList<>();

    static QueryOutcome terminal(String report, QueryStatus status, String message) {
        QueryOutcome outcome = new QueryOutcome();
        outcome.setReport(report);
        outcome.setStatus(status);
        outcome.setMessage(message);
        return outcome;
    }

    public boolean isCompleted() {
        return status == QueryStatus.COMPLETED;
    }
}
