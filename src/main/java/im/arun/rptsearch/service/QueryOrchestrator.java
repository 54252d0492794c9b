package im.arun.rptsearch.service;

import im.arun.rptsearch.catalog.ArchiveLocator;
import im.arun.rptsearch.catalog.ReportCatalog;
import im.arun.rptsearch.classify.FieldExtractor;
import im.arun.rptsearch.classify.LineClassifier;
import im.arun.rptsearch.classify.TemplateMatch;
import im.arun.rptsearch.config.RptSearchConfig;
import im.arun.rptsearch.index.DirectPageLocator;
import im.arun.rptsearch.index.IndexEntry;
import im.arun.rptsearch.index.IndexFile;
import im.arun.rptsearch.index.OccurrenceLocator;
import im.arun.rptsearch.model.FieldDef;
import im.arun.rptsearch.model.IndexedFieldInfo;
import im.arun.rptsearch.model.IntegrityWarning;
import im.arun.rptsearch.model.IntegrityWarning.Kind;
import im.arun.rptsearch.model.LineTemplate;
import im.arun.rptsearch.model.MatchedRecord;
import im.arun.rptsearch.model.PageFailure;
import im.arun.rptsearch.model.ReportInstance;
import im.arun.rptsearch.model.ReportMetadata;
import im.arun.rptsearch.model.Section;
import im.arun.rptsearch.security.SectionAccessFilter;
import im.arun.rptsearch.security.SectionLayout;
import im.arun.rptsearch.store.PageReadException;
import im.arun.rptsearch.store.PageStore;
import im.arun.rptsearch.store.PageText;
import im.arun.rptsearch.util.ExecutorProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Runs field queries end to end: resolve the field, find its index segment,
 * search the value, narrow the pages to the caller's sections, then inflate,
 * classify and extract each surviving page.
 *
 * <p>Pages are independent of each other; with {@code parallelPages} they run
 * as separate tasks on the shared executor. A page that cannot be read is
 * recorded as a failure and the query goes on with the rest.</p>
 */
public class QueryOrchestrator {
    private static final Logger logger = LoggerFactory.getLogger(QueryOrchestrator.class);

    private final RptSearchConfig config;
    private final ReportCatalog catalog;
    private final ArchiveCache cache;
    private final ArchiveLocator locator;
    private final LineClassifier classifier;
    private final FieldExtractor extractor;
    private final SectionAccessFilter sectionFilter;

    public QueryOrchestrator(RptSearchConfig config, ReportCatalog catalog, ArchiveCache cache) {
        this.config = config;
        this.catalog = catalog;
        this.cache = cache;
        this.locator = new ArchiveLocator(config);
        this.classifier = new LineClassifier(config.getMinMatchScore());
        this.extractor = new FieldExtractor();
        this.sectionFilter = new SectionAccessFilter();
    }

    /**
     * Matched records of every authorized page holding the requested value.
     *
     * @throws java.nio.file.NoSuchFileException when an archive file is missing
     * @throws im.arun.rptsearch.binary.ArchiveFormatException when an archive file is unreadable
     */
    public QueryOutcome execute(QueryRequest request) throws IOException {
        return run(new QueryContext(request, null));
    }

    /**
     * Runs the query against {@code instance} instead of choosing one by the request date.
     */
    public QueryOutcome execute(QueryRequest request, ReportInstance instance) throws IOException {
        return run(new QueryContext(request, instance));
    }

    private QueryOutcome run(QueryContext context) throws IOException {
        QueryRequest request = context.request;
        if (!prepare(context)) {
            return context.outcome;
        }

        List<PageResult<List<MatchedRecord>>> results = processPages(context.pages,
            page -> classifyPage(context, page));

        for (PageResult<List<MatchedRecord>> result : results) {
            if (result.failure != null) {
                context.outcome.getFailures().add(result.failure);
            } else {
                context.outcome.getRecords().addAll(result.value);
            }
        }

        logger.info("{} {}={}: {} records from {} pages, {} page failures",
            context.outcome.getReport(), context.field.getName(), request.getValue(),
            context.outcome.getRecords().size(), context.pages.size(), context.outcome.getFailures().size());
        return context.outcome;
    }

    /**
     * Same pipeline as {@link #execute} but returns the text of the authorized pages unclassified.
     */
    public QueryOutcome rawPages(QueryRequest request) throws IOException {
        QueryContext context = new QueryContext(request, null);
        if (!prepare(context)) {
            return context.outcome;
        }

        List<PageResult<PageText>> results = processPages(context.pages,
            page -> context.store.getPageText(page, context.charset));

        List<PageText> texts = new ArrayList<>();
        for (PageResult<PageText> result : results) {
            if (result.failure != null) {
                context.outcome.getFailures().add(result.failure);
            } else {
                texts.add(result.value);
            }
        }
        context.outcome.setRawPages(texts);
        return context.outcome;
    }

    /**
     * Catalog fields joined with their index segments; empty when the report or
     * a matching instance is unknown. Significant fields are listed even when not
     * indexed since their values mark section boundaries.
     */
    public Optional<List<IndexedFieldInfo>> listFields(String report, LocalDate date) throws IOException {
        Optional<ReportMetadata> metadata = catalog.find(report);
        if (metadata.isEmpty()) {
            return Optional.empty();
        }
        Optional<ReportInstance> instance = ReportCatalog.selectInstance(metadata.get(), date);
        if (instance.isEmpty()) {
            return Optional.empty();
        }

        IndexFile index = cache.indexFile(locator.indexPath(instance.get()));
        List<IndexedFieldInfo> fields = new ArrayList<>();
        for (FieldDef field : metadata.get().getFields()) {
            OptionalInt segmentNumber = index.lookupSegment(field.getLineId(), field.getFieldId());
            if (segmentNumber.isEmpty() && !field.isIndexed() && !field.isSignificant()) {
                continue;
            }
            IndexedFieldInfo info = new IndexedFieldInfo();
            info.setName(field.getName().trim());
            info.setLineId(field.getLineId());
            info.setFieldId(field.getFieldId());
            info.setStartColumn(field.getStartColumn());
            info.setEndColumn(field.getEndColumn());
            info.setSignificant(field.isSignificant());
            if (segmentNumber.isPresent()) {
                info.setSegment(segmentNumber.getAsInt());
                index.segment(segmentNumber.getAsInt()).ifPresent(segment -> {
                    info.setEntryCount(segment.getEntryCount());
                    info.setEncoding(segment.getEncoding().name());
                });
            }
            fields.add(info);
        }
        return Optional.of(fields);
    }

    /**
     * Distinct indexed values of a field with their entry counts, in index order.
     */
    public Optional<Map<String, Integer>> distinctValues(String report, String fieldName, LocalDate date)
            throws IOException {
        return distinctValues(report, fieldName, date, 0);
    }

    /**
     * Distinct values of the first {@code maxEntries} index entries; 0 reads the whole segment.
     */
    public Optional<Map<String, Integer>> distinctValues(String report, String fieldName, LocalDate date,
                                                         int maxEntries) throws IOException {
        Optional<ReportMetadata> metadata = catalog.find(report);
        if (metadata.isEmpty()) {
            return Optional.empty();
        }
        Optional<ReportInstance> instance = ReportCatalog.selectInstance(metadata.get(), date);
        Optional<FieldDef> field = ReportCatalog.resolveField(metadata.get(), fieldName);
        if (instance.isEmpty() || field.isEmpty()) {
            return Optional.empty();
        }

        IndexFile index = cache.indexFile(locator.indexPath(instance.get()));
        OptionalInt segmentNumber = index.lookupSegment(field.get().getLineId(), field.get().getFieldId());
        if (segmentNumber.isEmpty()) {
            return Optional.empty();
        }
        return index.segment(segmentNumber.getAsInt()).map(segment -> segment.distinctValues(maxEntries));
    }

    /**
     * Runs every stage up to and including the section filter. Returns false
     * when the query ended in a terminal state or found nothing to read.
     */
    private boolean prepare(QueryContext context) throws IOException {
        QueryRequest request = context.request;
        String report = request.getReport() == null ? "" : request.getReport().trim();

        Optional<ReportMetadata> metadata = catalog.find(report);
        if (metadata.isEmpty()) {
            context.outcome = QueryOutcome.terminal(report, QueryStatus.UNKNOWN_REPORT,
                "no catalog entry for report " + report);
            logger.info("{}", context.outcome.getMessage());
            return false;
        }
        context.metadata = metadata.get();

        Optional<ReportInstance> instance = context.instance != null
            ? Optional.of(context.instance)
            : ReportCatalog.selectInstance(context.metadata, request.getDate());
        if (instance.isEmpty()) {
            context.outcome = QueryOutcome.terminal(report, QueryStatus.NO_INSTANCE,
                "no instance of " + report + (request.getDate() == null ? "" : " on or before " + request.getDate()));
            logger.info("{}", context.outcome.getMessage());
            return false;
        }
        context.instance = instance.get();

        Optional<FieldDef> field = resolveField(context.metadata, request);
        if (field.isEmpty()) {
            context.outcome = QueryOutcome.terminal(report, QueryStatus.UNKNOWN_FIELD,
                "field " + request.getField() + " is not defined for " + report);
            logger.info("{}", context.outcome.getMessage());
            return false;
        }
        context.field = field.get();

        QueryOutcome outcome = QueryOutcome.terminal(report, QueryStatus.COMPLETED, null);
        outcome.setInstance(context.instance.getAsOf());
        context.outcome = outcome;

        IndexFile index = cache.indexFile(locator.indexPath(context.instance));
        outcome.getWarnings().addAll(index.getWarnings());

        OptionalInt segmentNumber = index.lookupSegment(context.field.getLineId(), context.field.getFieldId());
        if (segmentNumber.isEmpty()) {
            outcome.setStatus(QueryStatus.FIELD_NOT_INDEXED);
            outcome.setMessage(String.format("field %s (line %d, field %d) is not indexed in %s",
                context.field.getName().trim(), context.field.getLineId(), context.field.getFieldId(),
                index.getSource()));
            logger.info("{}", outcome.getMessage());
            return false;
        }
        logger.info("{}: field {} resolved to line {}, field {}, segment {}", report,
            context.field.getName().trim(), context.field.getLineId(), context.field.getFieldId(),
            segmentNumber.getAsInt());

        List<IndexEntry> entries = request.isPrefix()
            ? index.prefixSearch(segmentNumber.getAsInt(), request.getValue())
            : index.binarySearch(segmentNumber.getAsInt(), request.getValue());
        outcome.setIndexEntries(entries.size());
        logger.info("{}: {} index entries for {}'{}'", report, entries.size(),
            request.isPrefix() ? "prefix " : "", request.getValue());
        if (entries.isEmpty()) {
            return false;
        }

        SortedSet<Integer> candidates = candidatePages(index, entries, outcome.getWarnings());
        outcome.setCandidatePages(candidates.size());

        context.store = cache.pageStore(locator.storePath(context.instance));
        outcome.getWarnings().addAll(context.store.getWarnings());

        List<Section> sections = effectiveSections(context.store.sections(), context.metadata.getSections());
        outcome.getWarnings().addAll(SectionLayout.validate(sections, context.store.pageCount()));

        List<Section> authorized = request.isAllSections()
            ? sections
            : sectionFilter.resolveAuthorized(request.getSections(), sections, outcome.getWarnings());
        context.pages = new ArrayList<>(sectionFilter.filterPages(candidates, authorized, sections));
        outcome.setAuthorizedPages(context.pages.size());
        logger.info("{}: {} candidate pages, {} authorized", report, candidates.size(), context.pages.size());

        context.charset = charsetFor(context.metadata);
        for (FieldDef def : context.metadata.getFields()) {
            context.fieldsByLine.computeIfAbsent(def.getLineId(), k -> new ArrayList<>()).add(def);
        }
        return !context.pages.isEmpty();
    }

    /**
     * The catalog field named by the request, or the one at its line and field ids.
     * Ids that the catalog does not name still select a segment.
     */
    private static Optional<FieldDef> resolveField(ReportMetadata metadata, QueryRequest request) {
        if (!request.hasFieldIds()) {
            return ReportCatalog.resolveField(metadata, request.getField());
        }
        int lineId = request.getLineId();
        int fieldId = request.getFieldId();
        for (FieldDef def : metadata.getFields()) {
            if (def.getLineId() == lineId && def.getFieldId() == fieldId) {
                return Optional.of(def);
            }
        }
        return Optional.of(new FieldDef(lineId, fieldId, "line " + lineId + " field " + fieldId, 0, 0, true, false));
    }

    private SortedSet<Integer> candidatePages(IndexFile index, List<IndexEntry> entries,
                                              List<IntegrityWarning> warnings) {
        SortedSet<Integer> pages = new TreeSet<>();
        int unresolved = 0;
        long firstUnresolved = -1;
        for (IndexEntry entry : entries) {
            if (entry.getLocator() instanceof OccurrenceLocator) {
                long occurrence = ((OccurrenceLocator) entry.getLocator()).getOccurrence();
                OptionalInt page = index.resolveOccurrence(occurrence);
                if (page.isPresent()) {
                    pages.add(page.getAsInt());
                } else {
                    if (unresolved++ == 0) {
                        firstUnresolved = occurrence;
                    }
                }
            } else {
                int page = ((DirectPageLocator) entry.getLocator()).getPageNumber();
                if (page > 0) {
                    pages.add(page);
                } else {
                    if (unresolved++ == 0) {
                        firstUnresolved = page;
                    }
                }
            }
        }
        if (unresolved > 0) {
            IntegrityWarning warning = IntegrityWarning.of(Kind.UNRESOLVED_OCCURRENCE,
                "%s: %d index entries do not resolve to a page, first is %d",
                index.getSource(), unresolved, firstUnresolved);
            logger.warn("{}", warning);
            warnings.add(warning);
        }
        return pages;
    }

    /**
     * The page store's section table is authoritative for page ranges; the catalog
     * supplies names. A store without a section table falls back to the catalog's sections.
     */
    static List<Section> effectiveSections(List<Section> storeSections, List<Section> catalogSections) {
        if (storeSections.isEmpty()) {
            return List.copyOf(catalogSections);
        }
        Map<Long, String> names = new HashMap<>();
        for (Section section : catalogSections) {
            if (section.getName() != null) {
                names.put(section.getSectionId(), section.getName().trim());
            }
        }
        List<Section> merged = new ArrayList<>(storeSections.size());
        for (Section section : storeSections) {
            merged.add(new Section(section.getSectionId(),
                names.getOrDefault(section.getSectionId(), section.getName()),
                section.getStartPage(), section.getPageCount()));
        }
        return merged;
    }

    private Charset charsetFor(ReportMetadata metadata) {
        String name = metadata.getEncoding() != null && !metadata.getEncoding().isBlank()
            ? metadata.getEncoding().trim()
            : config.getDefaultEncoding();
        try {
            return Charset.forName(name);
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            logger.warn("Unsupported encoding '{}' for {}, using {}", name, metadata.getReport(),
                config.getDefaultEncoding());
            return Charset.forName(config.getDefaultEncoding());
        }
    }

    private List<MatchedRecord> classifyPage(QueryContext context, int pageNumber) throws PageReadException {
        PageText page = context.store.getPageText(pageNumber, context.charset);
        List<LineTemplate> templates = context.metadata.getLines();
        QueryRequest request = context.request;
        List<MatchedRecord> records = new ArrayList<>();

        for (int i = 0; i < page.getLines().size(); i++) {
            String line = page.getLines().get(i);
            Optional<TemplateMatch> match = classifier.classify(line, templates);
            if (match.isEmpty()) {
                continue;
            }
            LineTemplate template = match.get().getTemplate();
            if (request.isDetailOnly() && template.getLineId() != context.field.getLineId()) {
                continue;
            }
            if (!request.getLineFilter().isEmpty() && !request.getLineFilter().contains(template.getLineId())) {
                continue;
            }
            LinkedHashMap<String, String> values = extractor.extract(line,
                context.fieldsByLine.getOrDefault(template.getLineId(), List.of()));
            records.add(new MatchedRecord(context.outcome.getReport(), context.outcome.getInstance(),
                pageNumber, i + 1, template.getLineId(), template.getName(), values));
        }
        return records;
    }

    private <T> List<PageResult<T>> processPages(List<Integer> pages, PageTask<T> task) {
        Function<Integer, PageResult<T>> run = page -> {
            try {
                return PageResult.of(task.apply(page));
            } catch (PageReadException e) {
                logger.warn("Skipping {}", e.getMessage());
                return PageResult.failed(new PageFailure(page, e.getMessage()));
            }
        };

        List<PageResult<T>> results = new ArrayList<>(pages.size());
        if (!config.isParallelPages() || pages.size() < 2) {
            for (Integer page : pages) {
                results.add(run.apply(page));
            }
            return results;
        }

        List<CompletableFuture<PageResult<T>>> futures = pages.stream()
            .map(page -> CompletableFuture.supplyAsync(() -> run.apply(page), ExecutorProvider.getExecutor()))
            .toList();
        for (CompletableFuture<PageResult<T>> future : futures) {
            results.add(future.join());
        }
        return results;
    }

    @FunctionalInterface
    private interface PageTask<T> {
        T apply(int pageNumber) throws PageReadException;
    }

    private static final class PageResult<T> {
        private final T value;
        private final PageFailure failure;

        private PageResult(T value, PageFailure failure) {
            this.value = value;
            this.failure = failure;
        }

        static <T> PageResult<T> of(T value) {
            return new PageResult<>(value, null);
        }

        static <T> PageResult<T> failed(PageFailure failure) {
            return new PageResult<>(null, failure);
        }
    }

    private static final class QueryContext {
        private final QueryRequest request;
        private final Map<Integer, List<FieldDef>> fieldsByLine = new HashMap<>();
        private QueryOutcome outcome;
        private ReportMetadata metadata;
        private ReportInstance instance;
        private FieldDef field;
        private PageStore store;
        private Charset charset;
        private List<Integer> pages = List.of();

        QueryContext(QueryRequest request, ReportInstance instance) {
            this.request = request;
            this.instance = instance;
        }
    }
}
