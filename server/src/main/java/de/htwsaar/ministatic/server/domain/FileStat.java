package de.htwsaar.ministatic.server.domain;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Dateisystem-Metadaten eines Eintrags, wie sie der {@link FileStore} liefert.
 *
 * @param realPath     kanonischer Pfad nach Auflösung aller Symlinks
 * @param size         Größe in Bytes
 * @param lastModified Änderungszeitpunkt
 * @param directory    {@code true} für Verzeichnisse
 * @param readable     {@code true}, wenn der Prozess lesen darf
 */
public record FileStat(Path realPath, long size, Instant lastModified, boolean directory, boolean readable) {}
