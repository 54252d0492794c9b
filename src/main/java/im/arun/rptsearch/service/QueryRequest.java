package im.arun.rptsearch.service;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * One field lookup against one report instance.
 *
 * <p>{@code sections} holds the caller's authorized section names or ids.
 * {@code allSections} authorizes every section of the report. With both
 * {@code lineId} and {@code fieldId} set the index segment is chosen by those
 * ids and {@code field} is not needed. {@code prefix} matches values starting
 * with {@code value}.</p>
 */
@Data
@NoArgsConstructor
public class QueryRequest {
    private String report;
    private String field;
    private String value;
    private boolean prefix;
    private Integer lineId;
    private Integer fieldId;
    private LocalDate date;
    private List<String> sections = new ArrayList<>();
    private boolean allSections;
    private boolean detailOnly;
    private Set<Integer> lineFilter = new LinkedHashSet<>();

    public QueryRequest(String report, String field, String value) {
        this.report = report;
        this.field = field;
        this.value = value;
    }

    public boolean hasFieldIds() {
        return lineId != null && fieldId != null;
    }
}
