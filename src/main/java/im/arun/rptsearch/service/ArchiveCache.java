package im.arun.rptsearch.service;

import im.arun.rptsearch.index.IndexFile;
import im.arun.rptsearch.index.IndexFileParser;
import im.arun.rptsearch.store.PageStore;
import im.arun.rptsearch.store.PageStoreReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Parsed archive files keyed by real path. Each file is parsed at most once,
 * even under concurrent first access; the parsed structures are immutable and
 * shared read-only between queries.
 */
public class ArchiveCache {
    private static final Logger logger = LoggerFactory.getLogger(ArchiveCache.class);

    private final IndexFileParser indexParser;
    private final PageStoreReader storeReader;
    private final ConcurrentMap<Path, IndexFile> indexFiles = new ConcurrentHashMap<>();
    private final ConcurrentMap<Path, PageStore> pageStores = new ConcurrentHashMap<>();

    public ArchiveCache(IndexFileParser indexParser, PageStoreReader storeReader) {
        this.indexParser = indexParser;
        this.storeReader = storeReader;
    }

    public IndexFile indexFile(Path path) throws IOException {
        Path key = path.toRealPath();
        try {
            return indexFiles.computeIfAbsent(key, p -> {
                try {
                    logger.debug("Parsing index file {}", p);
                    return indexParser.open(p);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    public PageStore pageStore(Path path) throws IOException {
        Path key = path.toRealPath();
        try {
            return pageStores.computeIfAbsent(key, p -> {
                try {
                    logger.debug("Parsing page store {}", p);
                    return storeReader.open(p);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    /**
     * Drops the parsed form of a file; the next access parses it again.
     */
    public void evict(Path path) {
        Path key = path.toAbsolutePath().normalize();
        try {
            key = path.toRealPath();
        } catch (IOException e) {
            logger.debug("Evicting {} by absolute path: {}", path, e.getMessage());
        }
        indexFiles.remove(key);
        pageStores.remove(key);
    }

    public int size() {
        return indexFiles.size() + pageStores.size();
    }
}
