package im.arun.rptsearch.store;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Decompressed text of one page, split into lines. Line {@code n} is {@code lines.get(n - 1)}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PageText {

    @JsonProperty("page")
    private int pageNumber;

    @JsonProperty("lines")
    private List<String> lines;
}
