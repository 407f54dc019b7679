package de.htwsaar.ministatic.server.domain;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Port zum Dateisystem. Die Pipeline kennt nur diese zwei Operationen.
 */
public interface FileStore {

    /**
     * Liest die Metadaten eines Eintrags.
     *
     * @param path absoluter Pfad
     * @return Metadaten inkl. kanonischem Pfad
     * @throws NoSuchFileException wenn der Eintrag nicht existiert
     * @throws IOException bei allen anderen Fehlern
     */
    FileStat stat(Path path) throws IOException;

    /**
     * Öffnet einen Lese-Stream, positioniert auf {@code offset}.
     * Der Aufrufer liest selbst nur so viele Bytes, wie er braucht.
     *
     * @param path   absoluter Pfad
     * @param offset Startposition in Bytes (0 = Dateianfang)
     * @return offener Stream, vom Aufrufer zu schließen
     * @throws IOException wenn die Datei nicht geöffnet werden kann
     */
    InputStream open(Path path, long offset) throws IOException;
}
