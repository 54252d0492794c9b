package im.arun.rptsearch.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PageFailure {

    @JsonProperty("page")
    private int page;

    @JsonProperty("reason")
    private String reason;
}
