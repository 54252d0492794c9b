package im.arun.rptsearch.output;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import im.arun.rptsearch.model.MatchedRecord;

import java.io.IOException;
import java.io.Writer;
import java.util.List;

public class JsonRecordWriter implements RecordWriter {
    private final ObjectMapper objectMapper;

    public JsonRecordWriter() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false);
    }

    @Override
    public void write(List<MatchedRecord> records, Writer out) throws IOException {
        objectMapper.writeValue(out, records);
        out.write(System.lineSeparator());
        out.flush();
    }
}
