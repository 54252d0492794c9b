package im.arun.rptsearch.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Catalog entry of one report: structure definition (line templates, fields),
 * sections and the dated instances on disk.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ReportMetadata {

    @JsonProperty("report")
    private String report;

    @JsonProperty("structureDefId")
    private Integer structureDefId;

    @JsonProperty("encoding")
    private String encoding;

    @JsonProperty("lines")
    private List<LineTemplate> lines = new ArrayList<>();

    @JsonProperty("fields")
    private List<FieldDef> fields = new ArrayList<>();

    @JsonProperty("sections")
    private List<Section> sections = new ArrayList<>();

    @JsonProperty("instances")
    private List<ReportInstance> instances = new ArrayList<>();
}
