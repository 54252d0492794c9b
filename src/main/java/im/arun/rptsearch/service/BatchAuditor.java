package im.arun.rptsearch.service;

import im.arun.rptsearch.catalog.ArchiveLocator;
import im.arun.rptsearch.catalog.ReportCatalog;
import im.arun.rptsearch.config.RptSearchConfig;
import im.arun.rptsearch.index.IndexFile;
import im.arun.rptsearch.model.IntegrityWarning;
import im.arun.rptsearch.model.IntegrityWarning.Kind;
import im.arun.rptsearch.model.PageFailure;
import im.arun.rptsearch.model.ReportInstance;
import im.arun.rptsearch.model.ReportMetadata;
import im.arun.rptsearch.model.Section;
import im.arun.rptsearch.security.SectionLayout;
import im.arun.rptsearch.store.PageStore;
import im.arun.rptsearch.util.AuditJournal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Walks every catalogued instance of a set of reports, parses each archive pair
 * and records what it finds. Nothing found in a file stops the run; each file's
 * result is journaled before the next file starts, and {@link #cancel()} takes
 * effect between files.
 */
public class BatchAuditor {
    private static final Logger logger = LoggerFactory.getLogger(BatchAuditor.class);

    private final ReportCatalog catalog;
    private final ArchiveCache cache;
    private final ArchiveLocator locator;
    private final QueryOrchestrator orchestrator;
    private final AuditJournal journal;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public BatchAuditor(RptSearchConfig config, ReportCatalog catalog, ArchiveCache cache,
                        QueryOrchestrator orchestrator, AuditJournal journal) {
        this.catalog = catalog;
        this.cache = cache;
        this.locator = new ArchiveLocator(config);
        this.orchestrator = orchestrator;
        this.journal = journal;
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Audits the given reports, or every report in the catalog when the list is empty.
     * A non-null {@code probeField} and {@code probeValue} run that query against each instance.
     */
    public AuditSummary audit(List<String> reports, String probeField, String probeValue) throws IOException {
        List<String> names = reports == null || reports.isEmpty() ? catalog.reportNames() : reports;
        AuditSummary summary = new AuditSummary();

        for (String report : names) {
            Optional<ReportMetadata> metadata = catalog.find(report);
            if (metadata.isEmpty()) {
                logger.warn("No catalog entry for report {}; skipped", report);
                continue;
            }
            List<ReportInstance> instances = new ArrayList<>(metadata.get().getInstances());
            instances.sort(Comparator.comparing(ReportInstance::getAsOf, Comparator.nullsFirst(Comparator.naturalOrder())));

            for (ReportInstance instance : instances) {
                if (cancelled.get()) {
                    logger.info("Audit cancelled after {} files", summary.getFilesAudited());
                    summary.setCancelled(true);
                    return summary;
                }
                AuditFileResult result = auditInstance(metadata.get(), instance, probeField, probeValue, summary);
                summary.add(result);
                if (journal != null) {
                    journal.append(result);
                }
                logger.info("Audited {} {} ({} / {}): {}", report, instance.getAsOf(),
                    result.getIndexFile(), result.getPageStore(), result.getStatus());
            }
        }

        logger.info("Audit finished: {} files, {} with errors, {} with warnings, {} segment count mismatches",
            summary.getFilesAudited(), summary.getFilesWithErrors(), summary.getFilesWithWarnings(),
            summary.getSegmentCountMismatches());
        return summary;
    }

    private AuditFileResult auditInstance(ReportMetadata metadata, ReportInstance instance,
                                          String probeField, String probeValue, AuditSummary summary) {
        AuditFileResult result = new AuditFileResult();
        result.setReport(metadata.getReport());
        result.setAsOf(instance.getAsOf());
        result.setIndexFile(instance.getIndexFile());
        result.setPageStore(instance.getPageStore());
        result.setCatalogSegments(instance.getSegmentCount());

        List<IntegrityWarning> warnings = new ArrayList<>();
        Path indexPath = null;
        Path storePath = null;
        try {
            indexPath = locator.indexPath(instance);
            IndexFile index = cache.indexFile(indexPath);
            result.setDeclaredSegments(index.getHeader().getDeclaredSegmentCount());
            result.setMarkerSegments(index.segmentCount());
            warnings.addAll(index.getWarnings());

            if (instance.getSegmentCount() != null) {
                boolean matches = instance.getSegmentCount() == index.segmentCount();
                result.setSegmentCountMatches(matches);
                if (!matches) {
                    warnings.add(IntegrityWarning.of(Kind.CATALOG_SEGMENT_MISMATCH,
                        "%s: catalog records %d segments, file has %d",
                        index.getSource(), instance.getSegmentCount(), index.segmentCount()));
                }
            }

            storePath = locator.storePath(instance);
            PageStore store = cache.pageStore(storePath);
            List<Section> sections = QueryOrchestrator.effectiveSections(store.sections(), metadata.getSections());
            result.setPages(store.pageCount());
            result.setSections(sections.size());
            warnings.addAll(store.getWarnings());
            warnings.addAll(SectionLayout.validate(sections, store.pageCount()));

            if (probeField != null && probeValue != null) {
                QueryRequest probe = new QueryRequest(metadata.getReport(), probeField, probeValue);
                probe.setAllSections(true);
                QueryOutcome outcome = orchestrator.execute(probe, instance);
                result.setProbeStatus(outcome.getStatus());
                result.setProbeRecords(outcome.getRecords().size());
                for (PageFailure failure : outcome.getFailures()) {
                    result.getWarnings().add("PAGE_READ: " + failure.getReason());
                }
            }
        } catch (IOException e) {
            logger.warn("Audit of {} {} failed: {}", metadata.getReport(), instance.getAsOf(), e.toString());
            result.setStatus(AuditFileResult.Status.ERROR);
            result.setError(e.toString());
        } finally {
            if (indexPath != null) {
                cache.evict(indexPath);
            }
            if (storePath != null) {
                cache.evict(storePath);
            }
        }

        for (IntegrityWarning warning : warnings) {
            result.getWarnings().add(warning.toString());
            summary.countWarning(warning.getKind().name());
        }
        if (result.getStatus() != AuditFileResult.Status.ERROR && !result.getWarnings().isEmpty()) {
            result.setStatus(AuditFileResult.Status.WARNINGS);
        }
        return result;
    }
}
