package de.htwsaar.ministatic.server.service;

import de.htwsaar.ministatic.server.config.StaticServerConfig;
import de.htwsaar.ministatic.server.domain.FileStat;
import de.htwsaar.ministatic.server.domain.FileStore;
import de.htwsaar.ministatic.server.domain.Resource;
import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.util.Objects;
import org.springframework.stereotype.Component;

/**
 * Bildet einen geprüften Anfragepfad auf eine Datei unterhalb des Wurzelverzeichnisses ab.
 *
 * <p>Verzeichnisse werden auf die Index-Datei umgelenkt. Jeder Eintrag, dessen kanonischer
 * Pfad (nach Symlink-Auflösung) das Wurzelverzeichnis verlässt, gilt als nicht vorhanden.</p>
 */
@Component
public class ResourceResolver {

    private final FileStore fileStore;
    private final StaticServerConfig config;

    /**
     * Constructor Injection.
     *
     * @param fileStore Dateisystem-Port (darf nicht {@code null} sein)
     * @param config    Startkonfiguration (darf nicht {@code null} sein)
     */
    public ResourceResolver(FileStore fileStore, StaticServerConfig config) {
        this.fileStore = Objects.requireNonNull(fileStore, "fileStore must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /**
     * @param path geprüfter Pfad, beginnt mit {@code /}
     * @return aufgelöste Ressource
     * @throws StaticFileException NOT_FOUND, PERMISSION_DENIED oder INTERNAL
     */
    public Resource resolve(String path) {
        Path root = config.rootDir();
        Path candidate = root.resolve(path.substring(1)).normalize();
        if (!candidate.startsWith(root)) {
            throw StaticFileException.notFound(path);
        }

        Path requested = candidate;
        FileStat stat = statInsideRoot(candidate, path);
        if (stat.directory()) {
            requested = candidate.resolve(config.defaultIndex());
            stat = statInsideRoot(stat.realPath().resolve(config.defaultIndex()), path);
            if (stat.directory()) {
                throw StaticFileException.notFound(path);
            }
        }

        if (!stat.readable()) {
            throw StaticFileException.permissionDenied(path);
        }
        return new Resource(stat.realPath(), requested, stat.size(), stat.lastModified());
    }

    private FileStat statInsideRoot(Path file, String requestedPath) {
        FileStat stat;
        try {
            stat = fileStore.stat(file);
        } catch (NoSuchFileException | NotDirectoryException e) {
            throw StaticFileException.notFound(requestedPath);
        } catch (AccessDeniedException e) {
            throw StaticFileException.permissionDenied(requestedPath);
        } catch (IOException e) {
            throw StaticFileException.internal(e.getMessage(), e);
        }

        if (!stat.realPath().startsWith(config.rootDir())) {
            throw StaticFileException.notFound(requestedPath);
        }
        return stat;
    }
}
