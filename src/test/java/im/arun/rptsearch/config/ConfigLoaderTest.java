package im.arun.rptsearch.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ConfigLoaderTest {

    @Test
    void bundledDefaults() {
        RptSearchConfig config = new ConfigLoader().load();

        assertThat(config.getCatalogDir()).isEqualTo("catalog");
        assertThat(config.getIndexDir()).isEqualTo("maps");
        assertThat(config.getStoreDirs()).containsExactly("rpt");
        assertThat(config.getMinMatchScore()).isEqualTo(0.55);
        assertThat(config.getDefaultEncoding()).isEqualTo("ISO-8859-1");
        assertThat(config.getFormatProbeSample()).isEqualTo(100);
        assertThat(config.getMaxFieldWidth()).isEqualTo(100);
        assertThat(config.isParallelPages()).isTrue();
        assertThat(config.getWorkerThreads()).isZero();
    }

    @Test
    void explicitFileReplacesBundledConfig(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("rptsearch.yaml");
        Files.writeString(file, "catalogDir: /data/catalog\nstoreDirs: [/data/rpt1, /data/rpt2]\nminMatchScore: 0.7\n",
            StandardCharsets.UTF_8);

        RptSearchConfig config = new ConfigLoader(file.toString()).load();

        assertThat(config.getCatalogDir()).isEqualTo("/data/catalog");
        assertThat(config.getStoreDirs()).containsExactly("/data/rpt1", "/data/rpt2");
        assertThat(config.getMinMatchScore()).isEqualTo(0.7);
        assertThat(config.getIndexDir()).isEqualTo("maps");
    }

    @Test
    void missingFileFallsBackToBundledConfig(@TempDir Path dir) {
        RptSearchConfig config = new ConfigLoader(dir.resolve("absent.yaml").toString()).load();

        assertThat(config.getCatalogDir()).isEqualTo("catalog");
    }

    @Test
    void unparseableFileFallsBackToDefaults(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("broken.yaml");
        Files.writeString(file, "minMatchScore: [not, a, number\n", StandardCharsets.UTF_8);

        RptSearchConfig config = new ConfigLoader(file.toString()).load();

        assertThat(config.getMinMatchScore()).isEqualTo(0.55);
    }

    @Test
    void overridesAcceptSnakeAndCamelKeys() {
        Map<String, Object> overrides = new HashMap<>();
        overrides.put("index_dir", "/maps");
        overrides.put("catalogDir", "/catalog");
        overrides.put("store_dirs", "/rpt");
        overrides.put("min_match_score", 0.6);
        overrides.put("parallelPages", "no");
        overrides.put("worker_threads", 3);
        overrides.put("unknown_key", "ignored");
        overrides.put("defaultEncoding", null);

        RptSearchConfig config = new ConfigLoader().load(overrides);

        assertThat(config.getIndexDir()).isEqualTo("/maps");
        assertThat(config.getCatalogDir()).isEqualTo("/catalog");
        assertThat(config.getStoreDirs()).containsExactly("/rpt");
        assertThat(config.getMinMatchScore()).isEqualTo(0.6);
        assertThat(config.isParallelPages()).isFalse();
        assertThat(config.getWorkerThreads()).isEqualTo(3);
        assertThat(config.getDefaultEncoding()).isEqualTo("ISO-8859-1");
    }

    @Test
    void overridesDoNotLeakIntoLaterLoads() {
        ConfigLoader loader = new ConfigLoader();
        loader.load(Map.of("storeDirs", List.of("/a", "/b")));

        assertThat(loader.load().getStoreDirs()).containsExactly("rpt");
    }
}
