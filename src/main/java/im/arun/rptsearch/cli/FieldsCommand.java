package im.arun.rptsearch.cli;

import im.arun.rptsearch.config.RptSearchConfig;
import im.arun.rptsearch.model.IndexedFieldInfo;
import im.arun.rptsearch.service.QueryOrchestrator;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(
    name = "fields",
    description = "List the indexed fields of a report, or the values of one field",
    mixinStandardHelpOptions = true
)
public class FieldsCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Mixin
    CommonOptions common;

    @Option(names = {"--report"}, description = "Report identifier", required = true)
    String report;

    @Option(names = {"--date"}, description = "Instance date (yyyy-MM-dd)")
    LocalDate date;

    @Option(names = {"--values"}, paramLabel = "FIELD", description = "List the distinct indexed values of this field")
    String valuesField;

    @Option(names = {"--max-values"}, description = "Read at most this many index entries for --values (0 = all)",
        defaultValue = "0")
    int maxValues;

    @Override
    public Integer call() throws Exception {
        RptSearchConfig config = common.loadConfig();
        QueryOrchestrator orchestrator = CommonOptions.orchestrator(config, CommonOptions.catalog(config),
            CommonOptions.cache(config));
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        if (valuesField != null) {
            Optional<Map<String, Integer>> values = orchestrator.distinctValues(report, valuesField, date, maxValues);
            if (values.isEmpty()) {
                err.println("No index segment for field " + valuesField + " of " + report);
                err.flush();
                return 0;
            }
            values.get().forEach((value, count) -> out.printf("%-40s %d%n", value, count));
            out.flush();
            return 0;
        }

        Optional<List<IndexedFieldInfo>> fields = orchestrator.listFields(report, date);
        if (fields.isEmpty()) {
            err.println("No catalog entry or instance for report " + report);
            err.flush();
            return 0;
        }
        out.printf("%-24s %5s %5s %9s %11s %7s %8s  %s%n",
            "FIELD", "LINE", "ID", "COLUMNS", "SIGNIFICANT", "SEGMENT", "ENTRIES", "ENCODING");
        for (IndexedFieldInfo info : fields.get()) {
            out.printf("%-24s %5d %5d %9s %11s %7s %8s  %s%n",
                info.getName(), info.getLineId(), info.getFieldId(),
                info.getStartColumn() + "-" + info.getEndColumn(),
                info.isSignificant() ? "yes" : "-",
                info.getSegment() == null ? "-" : info.getSegment().toString(),
                info.getEntryCount() == null ? "-" : info.getEntryCount().toString(),
                info.getEncoding() == null ? "-" : info.getEncoding());
        }
        out.flush();
        return 0;
    }
}
