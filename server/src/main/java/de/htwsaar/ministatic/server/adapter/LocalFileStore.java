package de.htwsaar.ministatic.server.adapter;

import de.htwsaar.ministatic.server.domain.FileStat;
import de.htwsaar.ministatic.server.domain.FileStore;
import java.io.IOException;
import java.io.InputStream;
import java.nio.channels.Channels;
import java.nio.channels.SeekableByteChannel;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;

/**
 * {@link FileStore}-Adapter auf das lokale Dateisystem (java.nio).
 */
public final class LocalFileStore implements FileStore {

    @Override
    public FileStat stat(Path path) throws IOException {
        // deckt auch "datei.txt/x" ab, das sonst als allgemeiner FileSystemException endet
        if (!Files.exists(path)) {
            throw new NoSuchFileException(path.toString());
        }
        Path real = path.toRealPath();
        BasicFileAttributes attrs = Files.readAttributes(real, BasicFileAttributes.class);
        return new FileStat(
                real,
                attrs.size(),
                attrs.lastModifiedTime().toInstant(),
                attrs.isDirectory(),
                Files.isReadable(real));
    }

    @Override
    public InputStream open(Path path, long offset) throws IOException {
        SeekableByteChannel channel = Files.newByteChannel(path, StandardOpenOption.READ);
        try {
            channel.position(offset);
        } catch (IOException e) {
            channel.close();
            throw e;
        }
        return Channels.newInputStream(channel);
    }
}
