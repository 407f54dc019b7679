package de.htwsaar.ministatic.server.service;

import de.htwsaar.ministatic.server.domain.BodyStrategy;
import de.htwsaar.ministatic.server.domain.ResponseIntent;
import java.util.List;
import java.util.Locale;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

/**
 * Wählt für vollständige 200-Antworten zwischen identity und gzip.
 *
 * <p>Audio, Bilder und Videos sind bereits komprimiert und werden nie gepackt.</p>
 */
@Component
public class ContentEncoder {

    static final String GZIP = "gzip";

    private static final List<String> PRECOMPRESSED_FAMILIES = List.of("audio/", "image/", "video/");

    /**
     * @param full           vorläufige 200-Entscheidung
     * @param requestHeaders Header der Anfrage
     * @return 200 mit Strategie FULL oder FULL_GZIP
     */
    public ResponseIntent negotiate(ResponseIntent full, HttpHeaders requestHeaders) {
        if (full.strategy() != BodyStrategy.FULL) {
            throw new IllegalArgumentException("content encoding applies to full responses only");
        }

        if (!acceptsGzip(requestHeaders.get(HttpHeaders.ACCEPT_ENCODING))
                || !isCompressible(full.headers().getFirst(HttpHeaders.CONTENT_TYPE))) {
            return full;
        }

        HttpHeaders headers = full.mutableHeaders();
        headers.set(HttpHeaders.CONTENT_ENCODING, GZIP);
        // Länge nach Kompression unbekannt
        headers.remove(HttpHeaders.CONTENT_LENGTH);
        return ResponseIntent.full(headers, true);
    }

    /**
     * {@code true}, wenn ein {@code gzip}-Token ohne {@code q=0} in der Liste steht.
     */
    static boolean acceptsGzip(List<String> acceptEncoding) {
        if (acceptEncoding == null) return false;

        for (String headerValue : acceptEncoding) {
            for (String entry : headerValue.split(",")) {
                String[] parts = entry.split(";");
                if (!GZIP.equalsIgnoreCase(parts[0].trim())) continue;
                return !hasZeroQuality(parts);
            }
        }
        return false;
    }

    private static boolean hasZeroQuality(String[] parts) {
        for (int i = 1; i < parts.length; i++) {
            String param = parts[i].trim().toLowerCase(Locale.ROOT);
            if (!param.startsWith("q=")) continue;
            try {
                return Double.parseDouble(param.substring(2).trim()) <= 0.0;
            } catch (NumberFormatException e) {
                return false;
            }
        }
        return false;
    }

    static boolean isCompressible(String contentType) {
        if (contentType == null) return true;
        String lower = contentType.trim().toLowerCase(Locale.ROOT);
        return PRECOMPRESSED_FAMILIES.stream().noneMatch(lower::startsWith);
    }
}
