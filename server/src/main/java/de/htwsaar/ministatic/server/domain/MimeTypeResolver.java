package de.htwsaar.ministatic.server.domain;

import java.nio.file.Path;

/**
 * Port für die Zuordnung Dateiendung → Content-Type.
 */
public interface MimeTypeResolver {

    /** Fallback für unbekannte Endungen. */
    String DEFAULT_TYPE = "application/octet-stream";

    /**
     * @param file Datei, deren Name ausgewertet wird
     * @return vollständiger Content-Type-Wert, nie {@code null}
     */
    String contentType(Path file);
}
