package im.arun.rptsearch.store;

import java.io.IOException;

/**
 * A single page could not be produced. Only that page's contribution is lost.
 */
public class PageReadException extends IOException {
    private final int pageNumber;

    public PageReadException(int pageNumber, String message) {
        super("page " + pageNumber + ": " + message);
        this.pageNumber = pageNumber;
    }

    public PageReadException(int pageNumber, String message, Throwable cause) {
        super("page " + pageNumber + ": " + message, cause);
        this.pageNumber = pageNumber;
    }

    public int getPageNumber() {
        return pageNumber;
    }
}
