package de.htwsaar.ministatic.server.domain;

/**
 * Inklusives Byte-Fenster {@code [start, end]} einer Datei.
 *
 * @param start erstes Byte (ab 0)
 * @param end   letztes Byte (inklusive)
 */
public record ByteRange(long start, long end) {

    public ByteRange {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("invalid byte range " + start + "-" + end);
        }
    }

    /** Anzahl der Bytes im Fenster. */
    public long length() {
        return end - start + 1;
    }

    /** Wert für den {@code Content-Range}-Header, z. B. {@code bytes 0-99/1000}. */
    public String contentRange(long totalSize) {
        return "bytes " + start + "-" + end + "/" + totalSize;
    }
}
