package im.arun.rptsearch.cli;

import im.arun.rptsearch.config.RptSearchConfig;
import im.arun.rptsearch.model.IntegrityWarning;
import im.arun.rptsearch.model.PageFailure;
import im.arun.rptsearch.output.OutputFormat;
import im.arun.rptsearch.service.QueryOrchestrator;
import im.arun.rptsearch.service.QueryOutcome;
import im.arun.rptsearch.service.QueryRequest;
import im.arun.rptsearch.store.PageText;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "search",
    description = "Find the report lines holding a field value",
    mixinStandardHelpOptions = true
)
public class SearchCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Mixin
    CommonOptions common;

    @Option(names = {"--report"}, description = "Report identifier, e.g. DDU017P", required = true)
    String report;

    @Option(names = {"--field"}, description = "Field name (case-insensitive)")
    String field;

    @Option(names = {"--line-id"}, description = "Line id of the indexed field; use with --field-id instead of --field")
    Integer lineId;

    @Option(names = {"--field-id"}, description = "Field id within the line; use with --line-id instead of --field")
    Integer fieldId;

    @Option(names = {"--value"}, description = "Value to search for", required = true)
    String value;

    @Option(names = {"--prefix"}, description = "Match every indexed value starting with --value")
    boolean prefix;

    @Option(names = {"--date"}, description = "Instance date (yyyy-MM-dd); latest on or before it is used")
    LocalDate date;

    @Option(names = {"--section"}, description = "Authorized section name or id; repeatable")
    List<String> sections = new ArrayList<>();

    @Option(names = {"--all-sections"}, description = "Authorize every section of the report")
    boolean allSections;

    @Option(names = {"--detail-only"}, description = "Only emit lines of the searched field's line type")
    boolean detailOnly;

    @Option(names = {"--line-filter"}, description = "Only emit lines with this line id; repeatable")
    List<Integer> lineFilter = new ArrayList<>();

    @Option(names = {"--raw-pages"}, description = "Print the authorized pages instead of classified records")
    boolean rawPages;

    @Option(names = {"--format"}, description = "Output format: ${COMPLETION-CANDIDATES}", defaultValue = "TABLE")
    OutputFormat format;

    @Option(names = {"--output"}, description = "Write records to this file instead of stdout")
    Path outputPath;

    @Override
    public Integer call() throws Exception {
        if ((lineId == null) != (fieldId == null)) {
            throw new ParameterException(spec.commandLine(), "--line-id and --field-id go together");
        }
        if (field == null && lineId == null) {
            throw new ParameterException(spec.commandLine(), "Missing --field, or --line-id with --field-id");
        }
        RptSearchConfig config = common.loadConfig();
        QueryOrchestrator orchestrator = CommonOptions.orchestrator(config, CommonOptions.catalog(config),
            CommonOptions.cache(config));

        QueryRequest request = new QueryRequest(report, field, value);
        request.setLineId(lineId);
        request.setFieldId(fieldId);
        request.setPrefix(prefix);
        request.setDate(date);
        request.setSections(sections);
        request.setAllSections(allSections);
        request.setDetailOnly(detailOnly);
        request.setLineFilter(new LinkedHashSet<>(lineFilter));

        PrintWriter err = spec.commandLine().getErr();
        QueryOutcome outcome = rawPages ? orchestrator.rawPages(request) : orchestrator.execute(request);

        for (IntegrityWarning warning : outcome.getWarnings()) {
            err.println("Warning: " + warning);
        }
        for (PageFailure failure : outcome.getFailures()) {
            err.println("Page failure: " + failure.getReason());
        }
        if (!outcome.isCompleted()) {
            err.println(outcome.getStatus() + ": " + outcome.getMessage());
            err.flush();
            return 0;
        }
        err.printf("%d index entries, %d candidate pages, %d authorized pages%n",
            outcome.getIndexEntries(), outcome.getCandidatePages(), outcome.getAuthorizedPages());
        err.flush();

        if (outputPath != null) {
            try (Writer out = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8)) {
                emit(outcome, out);
            }
            err.println("Output written to: " + outputPath);
            err.flush();
        } else {
            emit(outcome, spec.commandLine().getOut());
        }
        return 0;
    }

    private void emit(QueryOutcome outcome, Writer out) throws IOException {
        if (!rawPages) {
            format.newWriter().write(outcome.getRecords(), out);
            return;
        }
        if (outcome.getRawPages() == null) {
            out.flush();
            return;
        }
        for (PageText page : outcome.getRawPages()) {
            out.write(String.format("=== Page %d ===%n", page.getPageNumber()));
            for (String line : page.getLines()) {
                out.write(line + System.lineSeparator());
            }
        }
        out.flush();
    }
}
