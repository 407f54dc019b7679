package de.htwsaar.ministatic.server.domain;

/**
 * Port für die Syntaxprüfung des {@code Range}-Headers.
 */
public interface RangeParser {

    /**
     * @param totalSize   Größe der Ressource in Bytes
     * @param headerValue roher Header-Wert, z. B. {@code bytes=0-99,200-}
     * @return erfüllbare Bereiche oder eine der beiden Fehlerklassen
     */
    RangeParseResult parse(long totalSize, String headerValue);
}
