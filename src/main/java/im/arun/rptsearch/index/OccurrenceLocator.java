package im.arun.rptsearch.index;

import lombok.Data;

@Data
public final class OccurrenceLocator implements Locator {
    private final long occurrence;
    private final byte[] trailer;

    @Override
    public LocatorEncoding getEncoding() {
        return LocatorEncoding.OCCURRENCE_INDEX;
    }
}
