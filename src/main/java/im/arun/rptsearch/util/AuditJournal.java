package im.arun.rptsearch.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON journal of a batch audit. Every appended entry rewrites the whole file
 * through a temporary sibling and a rename, so a run stopped between entries
 * leaves a complete JSON array behind.
 */
public class AuditJournal {
    private static final Logger logger = LoggerFactory.getLogger(AuditJournal.class);

    private final Path journalPath;
    private final List<Object> entries = new ArrayList<>();
    private final ObjectMapper objectMapper;

    /**
     * Journal named {@code audit_<timestamp>.json} under {@code ./logs}.
     */
    public AuditJournal() throws IOException {
        this(defaultPath());
    }

    public AuditJournal(Path journalPath) throws IOException {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.journalPath = journalPath.toAbsolutePath();
        Path parent = this.journalPath.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    private static Path defaultPath() {
        String timestamp = LocalDateTime.now().format(DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss"));
        return Paths.get("./logs", String.format("audit_%s.json", timestamp));
    }

    public synchronized void append(Object entry) throws IOException {
        entries.add(entry);
        writeToFile();
    }

    public synchronized int size() {
        return entries.size();
    }

    private void writeToFile() throws IOException {
        Path temp = journalPath.resolveSibling(journalPath.getFileName() + ".tmp");
        objectMapper.writeValue(temp.toFile(), entries);
        try {
            Files.move(temp, journalPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            logger.debug("Atomic move unsupported for {}, replacing in place", journalPath);
            Files.move(temp, journalPath, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    public Path getJournalPath() {
        return journalPath;
    }
}
