package im.arun.rptsearch.output;

import com.univocity.parsers.csv.CsvWriter;
import com.univocity.parsers.csv.CsvWriterSettings;
import im.arun.rptsearch.model.MatchedRecord;

import java.io.Writer;
import java.util.List;

public class CsvRecordWriter implements RecordWriter {

    @Override
    public void write(List<MatchedRecord> records, Writer out) {
        RecordColumns columns = RecordColumns.of(records);

        CsvWriterSettings settings = new CsvWriterSettings();
        settings.getFormat().setLineSeparator("\n");
        settings.setQuoteEscapingEnabled(true);
        CsvWriter writer = new CsvWriter(out, settings);

        writer.writeHeaders(columns.headers());
        for (MatchedRecord record : records) {
            writer.writeRow(columns.row(record));
        }
        writer.flush();
    }
}
