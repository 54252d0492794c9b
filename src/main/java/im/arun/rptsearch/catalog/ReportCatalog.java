package im.arun.rptsearch.catalog;

import com.fasterxml.jackson.databind.ObjectMapper;
import im.arun.rptsearch.model.FieldDef;
import im.arun.rptsearch.model.ReportInstance;
import im.arun.rptsearch.model.ReportMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Structural metadata of reports, read from {@code <REPORT>.json} files in the
 * catalog directory. Each report is read once per catalog instance; a batch run
 * shares one catalog.
 */
public class ReportCatalog {
    private static final Logger logger = LoggerFactory.getLogger(ReportCatalog.class);
    private static final String SUFFIX = ".json";

    private final Path catalogDir;
    private final ObjectMapper objectMapper;
    private final Map<String, Optional<ReportMetadata>> loaded = new HashMap<>();

    public ReportCatalog(Path catalogDir) {
        this.catalogDir = catalogDir;
        this.objectMapper = new ObjectMapper();
    }

    public Path getCatalogDir() {
        return catalogDir;
    }

    /**
     * Catalog entry of a report; empty when no catalog file exists for it.
     */
    public synchronized Optional<ReportMetadata> find(String report) throws IOException {
        String key = report.trim().toUpperCase();
        Optional<ReportMetadata> cached = loaded.get(key);
        if (cached != null) {
            return cached;
        }

        Optional<ReportMetadata> metadata = Optional.empty();
        Optional<Path> file = catalogFile(report.trim());
        if (file.isPresent()) {
            ReportMetadata parsed = objectMapper.readValue(file.get().toFile(), ReportMetadata.class);
            if (parsed.getReport() == null) {
                parsed.setReport(report.trim());
            }
            logger.debug("Loaded catalog {}: {} lines, {} fields, {} sections, {} instances",
                file.get(), parsed.getLines().size(), parsed.getFields().size(),
                parsed.getSections().size(), parsed.getInstances().size());
            metadata = Optional.of(parsed);
        }
        loaded.put(key, metadata);
        return metadata;
    }

    /**
     * Names of every report with a catalog file, sorted.
     */
    public List<String> reportNames() throws IOException {
        List<String> names = new ArrayList<>();
        if (!Files.isDirectory(catalogDir)) {
            return names;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(catalogDir, "*" + SUFFIX)) {
            for (Path file : stream) {
                String name = file.getFileName().toString();
                names.add(name.substring(0, name.length() - SUFFIX.length()));
            }
        }
        Collections.sort(names);
        return names;
    }

    private Optional<Path> catalogFile(String report) throws IOException {
        Path exact = catalogDir.resolve(report + SUFFIX);
        if (Files.isRegularFile(exact)) {
            return Optional.of(exact);
        }
        for (String name : reportNames()) {
            if (name.equalsIgnoreCase(report)) {
                return Optional.of(catalogDir.resolve(name + SUFFIX));
            }
        }
        return Optional.empty();
    }

    /**
     * The instance dated {@code asOf}, else the latest one before it; without a
     * date the latest instance overall. Instances with unparseable dates are skipped.
     */
    public static Optional<ReportInstance> selectInstance(ReportMetadata metadata, LocalDate asOf) {
        ReportInstance best = null;
        LocalDate bestDate = null;
        for (ReportInstance instance : metadata.getInstances()) {
            LocalDate date = parseDate(instance.getAsOf());
            if (date == null || (asOf != null && date.isAfter(asOf))) {
                continue;
            }
            if (bestDate == null || date.isAfter(bestDate)) {
                best = instance;
                bestDate = date;
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Field by name, ignoring case and surrounding blanks.
     */
    public static Optional<FieldDef> resolveField(ReportMetadata metadata, String fieldName) {
        if (fieldName == null) {
            return Optional.empty();
        }
        String wanted = fieldName.trim();
        return metadata.getFields().stream()
            .filter(field -> field.getName() != null && field.getName().trim().equalsIgnoreCase(wanted))
            .findFirst();
    }

    static LocalDate parseDate(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(text.trim());
        } catch (DateTimeParseException e) {
            logger.warn("Ignoring instance with unparseable date '{}'", text);
            return null;
        }
    }
}
