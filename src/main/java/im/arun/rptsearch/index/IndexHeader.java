package im.arun.rptsearch.index;

import lombok.Data;

@Data
public final class IndexHeader {
    private final int version;
    private final int declaredSegmentCount;
    private final String createdDate;
    private final String modifiedDate;
}
