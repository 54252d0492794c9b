package im.arun.rptsearch.classify;

import im.arun.rptsearch.model.LineTemplate;
import lombok.Data;

@Data
public final class TemplateMatch {
    private final LineTemplate template;
    private final double score;
}
