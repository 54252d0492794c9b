package im.arun.rptsearch.output;

public enum OutputFormat {
    TABLE,
    CSV,
    JSON;

    public RecordWriter newWriter() {
        switch (this) {
            case CSV:
                return new CsvRecordWriter();
            case JSON:
                return new JsonRecordWriter();
            default:
                return new TableRecordWriter();
        }
    }
}
