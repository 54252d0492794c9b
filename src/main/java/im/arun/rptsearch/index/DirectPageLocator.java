package im.arun.rptsearch.index;

import lombok.Data;

@Data
public final class DirectPageLocator implements Locator {
    private final int pageNumber;
    private final byte[] trailer;

    @Override
    public LocatorEncoding getEncoding() {
        return LocatorEncoding.DIRECT_PAGE;
    }
}
