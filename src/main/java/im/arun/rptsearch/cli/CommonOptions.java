package im.arun.rptsearch.cli;

import im.arun.rptsearch.catalog.ReportCatalog;
import im.arun.rptsearch.config.ConfigLoader;
import im.arun.rptsearch.config.RptSearchConfig;
import im.arun.rptsearch.index.IndexFileParser;
import im.arun.rptsearch.service.ArchiveCache;
import im.arun.rptsearch.service.QueryOrchestrator;
import im.arun.rptsearch.store.PageStoreReader;
import im.arun.rptsearch.util.ExecutorProvider;
import picocli.CommandLine.Option;

import java.nio.file.Paths;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Options shared by every sub-command: where the configuration, catalog and archives live.
 */
public class CommonOptions {

    @Option(names = {"--config"}, description = "YAML configuration file (defaults to the bundled config.yaml)")
    String configPath;

    @Option(names = {"--catalog-dir"}, description = "Directory of <REPORT>.json catalog files")
    String catalogDir;

    @Option(names = {"--index-dir"}, description = "Directory of index (.MAP) files")
    String indexDir;

    @Option(names = {"--store-dir"}, description = "Directory searched for page store (.RPT) files; repeatable")
    List<String> storeDirs;

    RptSearchConfig loadConfig() {
        Map<String, Object> overrides = new HashMap<>();
        overrides.put("catalogDir", catalogDir);
        overrides.put("indexDir", indexDir);
        if (storeDirs != null && !storeDirs.isEmpty()) {
            overrides.put("storeDirs", storeDirs);
        }
        RptSearchConfig config = new ConfigLoader(configPath).load(overrides);
        ExecutorProvider.configure(config.getWorkerThreads());
        return config;
    }

    static QueryOrchestrator orchestrator(RptSearchConfig config, ReportCatalog catalog, ArchiveCache cache) {
        return new QueryOrchestrator(config, catalog, cache);
    }

    static ReportCatalog catalog(RptSearchConfig config) {
        return new ReportCatalog(Paths.get(config.getCatalogDir()));
    }

    static ArchiveCache cache(RptSearchConfig config) {
        return new ArchiveCache(new IndexFileParser(config), new PageStoreReader());
    }
}
