package de.htwsaar.ministatic.server.domain;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;

/**
 * Aufgelöste Datei einer einzelnen Anfrage. Unveränderlich, lebt nur so lange wie die Anfrage.
 *
 * @param path         absoluter, kanonischer Pfad der Datei
 * @param name         angefragter Pfad vor der Symlink-Auflösung (bestimmt den Content-Type)
 * @param size         Größe in Bytes
 * @param lastModified Änderungszeitpunkt (Millisekunden-Genauigkeit)
 */
public record Resource(Path path, Path name, long size, Instant lastModified) {

    public Resource {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(lastModified, "lastModified must not be null");
        if (size < 0) {
            throw new IllegalArgumentException("size must not be negative: " + size);
        }
    }

    /** Ressource ohne Symlink: angefragter und kanonischer Pfad sind gleich. */
    public Resource(Path path, long size, Instant lastModified) {
        this(path, path, size, lastModified);
    }
}
