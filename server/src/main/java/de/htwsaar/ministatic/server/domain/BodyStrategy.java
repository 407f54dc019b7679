package de.htwsaar.ministatic.server.domain;

/**
 * Art, wie der Body einer Antwort geschrieben wird.
 */
public enum BodyStrategy {
    /** Kein Body (304). */
    NONE,
    /** Komplette Datei, unkomprimiert. */
    FULL,
    /** Komplette Datei durch gzip. */
    FULL_GZIP,
    /** Genau ein Byte-Fenster. */
    SINGLE_RANGE,
    /** Mehrere Fenster als {@code multipart/byteranges}. */
    MULTIPART,
    /** JSON-Fehlerbody. */
    ERROR_JSON
}
