package im.arun.rptsearch.config;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class RptSearchConfig {
    private String catalogDir = "catalog";
    private String indexDir = "maps";
    private List<String> storeDirs = new ArrayList<>(List.of("rpt"));
    private double minMatchScore = 0.55;
    private String defaultEncoding = "ISO-8859-1";
    private int formatProbeSample = 100;
    private int maxFieldWidth = 100;
    private boolean parallelPages = true;
    private int workerThreads = 0;
}
