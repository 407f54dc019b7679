package de.htwsaar.ministatic.server.config;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Startkonfiguration des Servers, wird einmal gelesen und danach nicht mehr geändert.
 *
 * @param rootDir         kanonisches Wurzelverzeichnis (absolut, Symlinks aufgelöst)
 * @param defaultIndex    Dateiname, der für Verzeichnisse ausgeliefert wird
 * @param cacheMaxAgeSecs TTL für {@code Cache-Control: public, max-age=N}
 */
public record StaticServerConfig(Path rootDir, String defaultIndex, long cacheMaxAgeSecs) {

    public StaticServerConfig {
        Objects.requireNonNull(rootDir, "rootDir must not be null");
        Objects.requireNonNull(defaultIndex, "defaultIndex must not be null");
        if (!rootDir.isAbsolute()) {
            throw new IllegalArgumentException("rootDir must be absolute: " + rootDir);
        }
        if (defaultIndex.isBlank() || defaultIndex.contains("/") || defaultIndex.contains("\\")) {
            throw new IllegalArgumentException("defaultIndex must be a plain file name: " + defaultIndex);
        }
        cacheMaxAgeSecs = Math.max(0, cacheMaxAgeSecs);
    }

    /** Wert des {@code Cache-Control}-Headers erfolgreicher Antworten. */
    public String cacheControl() {
        return "public, max-age=" + cacheMaxAgeSecs;
    }
}
