package im.arun.rptsearch.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Non-fatal inconsistency found while reading an archive. Processing always
 * continues with best-effort data after one of these is recorded.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class IntegrityWarning {

    public enum Kind {
        SEGMENT_COUNT_MISMATCH,
        NON_MONOTONIC_SEGMENT,
        TRUNCATED_ENTRY,
        EMPTY_SEGMENT,
        SEGMENT_MISMATCH,
        PAGE_GAP,
        SECTION_OVERLAP,
        SECTION_GAP,
        INVALID_SECTION,
        UNRESOLVED_OCCURRENCE,
        UNKNOWN_SECTION,
        CATALOG_SEGMENT_MISMATCH
    }

    @JsonProperty("kind")
    private Kind kind;

    @JsonProperty("message")
    private String message;

    public static IntegrityWarning of(Kind kind, String format, Object... args) {
        return new IntegrityWarning(kind, String.format(format, args));
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
