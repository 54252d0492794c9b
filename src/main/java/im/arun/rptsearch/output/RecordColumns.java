package im.arun.rptsearch.output;

import im.arun.rptsearch.model.MatchedRecord;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Flat column layout shared by the tabular writers: fixed record columns, then
 * every field name in the order it first appears.
 */
final class RecordColumns {
    static final List<String> FIXED = List.of("report", "instance", "page", "line", "line_id", "line_name");

    private final List<String> fieldNames;

    private RecordColumns(List<String> fieldNames) {
        this.fieldNames = fieldNames;
    }

    static RecordColumns of(List<MatchedRecord> records) {
        Set<String> names = new LinkedHashSet<>();
        for (MatchedRecord record : records) {
            if (record.getFields() != null) {
                names.addAll(record.getFields().keySet());
            }
        }
        return new RecordColumns(new ArrayList<>(names));
    }

    List<String> headers() {
        List<String> headers = new ArrayList<>(FIXED);
        headers.addAll(fieldNames);
        return headers;
    }

    List<String> row(MatchedRecord record) {
        List<String> row = new ArrayList<>(FIXED.size() + fieldNames.size());
        row.add(record.getReport());
        row.add(record.getInstance());
        row.add(String.valueOf(record.getPage()));
        row.add(String.valueOf(record.getLine()));
        row.add(String.valueOf(record.getLineId()));
        row.add(record.getLineName());
        for (String name : fieldNames) {
            String value = record.getFields() == null ? null : record.getFields().get(name);
            row.add(value == null ? "" : value);
        }
        return row;
    }
}
