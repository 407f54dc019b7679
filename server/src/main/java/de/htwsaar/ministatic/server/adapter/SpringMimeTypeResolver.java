package de.htwsaar.ministatic.server.adapter;

import de.htwsaar.ministatic.server.domain.MimeTypeResolver;
import java.nio.file.Path;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;

/**
 * {@link MimeTypeResolver} auf Basis der {@code mime.types}-Tabelle von Spring.
 *
 * <p>Textformate werden immer als UTF-8 deklariert.</p>
 */
public final class SpringMimeTypeResolver implements MimeTypeResolver {

    @Override
    public String contentType(Path file) {
        Path name = file.getFileName();
        if (name == null) return DEFAULT_TYPE;

        MediaType type = MediaTypeFactory.getMediaType(name.toString()).orElse(null);
        if (type == null) return DEFAULT_TYPE;

        String value = type.toString();
        if ("text".equals(type.getType()) && type.getCharset() == null) {
            value += "; charset=utf-8";
        }
        return value;
    }
}
