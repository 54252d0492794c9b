package im.arun.rptsearch.cli;

import im.arun.rptsearch.catalog.ReportCatalog;
import im.arun.rptsearch.config.RptSearchConfig;
import im.arun.rptsearch.service.ArchiveCache;
import im.arun.rptsearch.service.AuditSummary;
import im.arun.rptsearch.service.BatchAuditor;
import im.arun.rptsearch.util.AuditJournal;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "audit",
    description = "Parse every catalogued archive pair and journal the integrity findings",
    mixinStandardHelpOptions = true
)
public class AuditCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Mixin
    CommonOptions common;

    @Option(names = {"--report"}, description = "Report to audit; repeatable (default: every catalogued report)")
    List<String> reports = new ArrayList<>();

    @Option(names = {"--journal"}, description = "Journal file (default: ./logs/audit_<timestamp>.json)")
    Path journalPath;

    @Option(names = {"--probe-field"}, description = "Field of a probe query run against each instance")
    String probeField;

    @Option(names = {"--probe-value"}, description = "Value of the probe query")
    String probeValue;

    @Override
    public Integer call() throws Exception {
        RptSearchConfig config = common.loadConfig();
        ReportCatalog catalog = CommonOptions.catalog(config);
        ArchiveCache cache = CommonOptions.cache(config);
        AuditJournal journal = journalPath != null ? new AuditJournal(journalPath) : new AuditJournal();
        BatchAuditor auditor = new BatchAuditor(config, catalog, cache,
            CommonOptions.orchestrator(config, catalog, cache), journal);

        AuditSummary summary = auditor.audit(reports, probeField, probeValue);

        PrintWriter out = spec.commandLine().getOut();
        out.printf("Files audited:            %d%n", summary.getFilesAudited());
        out.printf("Files with errors:        %d%n", summary.getFilesWithErrors());
        out.printf("Files with warnings:      %d%n", summary.getFilesWithWarnings());
        out.printf("Segment count mismatches: %d%n", summary.getSegmentCountMismatches());
        out.printf("No catalog segment count: %d%n", summary.getCatalogSegmentCountMissing());
        summary.getWarningCounts().forEach((kind, count) -> out.printf("  %-24s %d%n", kind, count));
        out.println("Journal: " + journal.getJournalPath());
        out.flush();
        return 0;
    }
}
