package im.arun.rptsearch.output;

import im.arun.rptsearch.model.MatchedRecord;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;

/**
 * Console table with padded columns. Long values are cut and the row count is capped.
 */
public class TableRecordWriter implements RecordWriter {
    public static final int DEFAULT_MAX_ROWS = 50;
    public static final int DEFAULT_MAX_WIDTH = 40;

    private final int maxRows;
    private final int maxWidth;

    public TableRecordWriter() {
        this(DEFAULT_MAX_ROWS, DEFAULT_MAX_WIDTH);
    }

    public TableRecordWriter(int maxRows, int maxWidth) {
        this.maxRows = maxRows;
        this.maxWidth = maxWidth;
    }

    @Override
    public void write(List<MatchedRecord> records, Writer out) throws IOException {
        if (records.isEmpty()) {
            out.write("No matching records." + System.lineSeparator());
            out.flush();
            return;
        }

        RecordColumns columns = RecordColumns.of(records);
        List<String> headers = columns.headers();
        List<List<String>> rows = new ArrayList<>();
        for (MatchedRecord record : records.subList(0, Math.min(maxRows, records.size()))) {
            List<String> row = new ArrayList<>();
            for (String cell : columns.row(record)) {
                row.add(cap(cell));
            }
            rows.add(row);
        }

        int[] widths = new int[headers.size()];
        for (int i = 0; i < headers.size(); i++) {
            widths[i] = cap(headers.get(i)).length();
        }
        for (List<String> row : rows) {
            for (int i = 0; i < row.size(); i++) {
                widths[i] = Math.max(widths[i], row.get(i).length());
            }
        }

        List<String> capped = new ArrayList<>();
        for (String header : headers) {
            capped.add(cap(header));
        }
        writeRow(out, capped, widths);
        StringBuilder rule = new StringBuilder();
        for (int i = 0; i < widths.length; i++) {
            if (i > 0) {
                rule.append("-+-");
            }
            rule.append("-".repeat(widths[i]));
        }
        out.write(rule.toString() + System.lineSeparator());
        for (List<String> row : rows) {
            writeRow(out, row, widths);
        }

        if (records.size() > maxRows) {
            out.write(String.format("... %d more records (%d total)%n", records.size() - maxRows, records.size()));
        }
        out.flush();
    }

    private void writeRow(Writer out, List<String> cells, int[] widths) throws IOException {
        StringBuilder line = new StringBuilder();
        for (int i = 0; i < cells.size(); i++) {
            if (i > 0) {
                line.append(" | ");
            }
            String cell = cells.get(i);
            line.append(cell).append(" ".repeat(widths[i] - cell.length()));
        }
        out.write(line.toString().stripTrailing() + System.lineSeparator());
    }

    private String cap(String value) {
        if (value == null) {
            return "";
        }
        return value.length() > maxWidth ? value.substring(0, maxWidth - 3) + "..." : value;
    }
}
