package im.arun.rptsearch.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A named, access-controlled contiguous page range of a report instance.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Section {

    @JsonProperty("sectionId")
    private long sectionId;

    @JsonProperty("name")
    private String name;

    @JsonProperty("startPage")
    private int startPage;

    @JsonProperty("pageCount")
    private int pageCount;

    public int lastPage() {
        return startPage + pageCount - 1;
    }

    public boolean contains(int page) {
        return page >= startPage && page <= lastPage();
    }
}
