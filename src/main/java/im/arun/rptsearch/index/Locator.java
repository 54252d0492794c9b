package im.arun.rptsearch.index;

/**
 * Reference from an index entry to the page holding the indexed line.
 */
public interface Locator {

    LocatorEncoding getEncoding();

    /**
     * Trailer bytes whose meaning is not decoded; passed through untouched.
     */
    byte[] getTrailer();
}
