package im.arun.rptsearch.output;

import im.arun.rptsearch.model.MatchedRecord;

import java.io.IOException;
import java.io.Writer;
import java.util.List;

/**
 * Serializes matched records. Implementations flush but never close {@code out}.
 */
public interface RecordWriter {

    void write(List<MatchedRecord> records, Writer out) throws IOException;
}
