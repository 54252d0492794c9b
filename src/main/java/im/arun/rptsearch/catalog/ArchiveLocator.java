package im.arun.rptsearch.catalog;

import im.arun.rptsearch.config.RptSearchConfig;
import im.arun.rptsearch.model.ReportInstance;

import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Maps catalog file names to paths under the configured index and store directories.
 */
public class ArchiveLocator {
    private final Path indexDir;
    private final List<Path> storeDirs;

    public ArchiveLocator(RptSearchConfig config) {
        this.indexDir = Paths.get(config.getIndexDir());
        this.storeDirs = new ArrayList<>();
        for (String dir : config.getStoreDirs()) {
            storeDirs.add(Paths.get(dir));
        }
    }

    public Path indexPath(ReportInstance instance) throws NoSuchFileException {
        Path path = indexDir.resolve(baseName(instance.getIndexFile()));
        if (!Files.isRegularFile(path)) {
            throw new NoSuchFileException(path.toString(), null, "index file not found");
        }
        return path;
    }

    /**
     * First store directory holding the page store's base name.
     */
    public Path storePath(ReportInstance instance) throws NoSuchFileException {
        String name = baseName(instance.getPageStore());
        for (Path dir : storeDirs) {
            Path candidate = dir.resolve(name);
            if (Files.isRegularFile(candidate)) {
                return candidate;
            }
        }
        throw new NoSuchFileException(name, null, "page store not found in " + storeDirs);
    }

    /**
     * Catalog file names may carry a Windows directory prefix such as {@code MIDASRPT\5\}.
     */
    static String baseName(String fileName) {
        if (fileName == null) {
            return "";
        }
        String trimmed = fileName.trim();
        int cut = Math.max(trimmed.lastIndexOf('\\'), trimmed.lastIndexOf('/'));
        return cut >= 0 ? trimmed.substring(cut + 1) : trimmed;
    }
}
