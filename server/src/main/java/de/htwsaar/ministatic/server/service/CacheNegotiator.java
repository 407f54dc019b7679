package de.htwsaar.ministatic.server.service;

import de.htwsaar.ministatic.server.config.StaticServerConfig;
import de.htwsaar.ministatic.server.domain.Resource;
import de.htwsaar.ministatic.server.domain.ResponseIntent;
import java.time.Instant;
import java.util.Objects;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

/**
 * Berechnet die Validatoren einer Ressource und entscheidet zwischen 304 und Auslieferung.
 *
 * <p>Validatoren und {@code Cache-Control} werden unabhängig vom Ergebnis gesetzt.
 * Der Vergleich ist absichtlich einfach: starke Gleichheit bei {@code If-None-Match},
 * Sekundenvergleich bei {@code If-Modified-Since}; eine der beiden Bedingungen genügt.</p>
 */
@Component
public class CacheNegotiator {

    private final StaticServerConfig config;

    public CacheNegotiator(StaticServerConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /**
     * ETag als reine Funktion von Größe und Änderungszeit: {@code "<hex size>-<hex mtime ms>"}.
     *
     * @param resource Ressource
     * @return ETag inkl. Anführungszeichen
     */
    public static String etag(Resource resource) {
        return "\"" + Long.toHexString(resource.size()) + "-"
                + Long.toHexString(resource.lastModified().toEpochMilli()) + "\"";
    }

    /**
     * @param resource        aufgelöste Ressource
     * @param requestHeaders  Header der Anfrage
     * @param responseHeaders bisherige Antwort-Header (werden nicht verändert)
     * @return 304 ohne Body oder vorläufige 200-Entscheidung für die folgenden Stufen
     */
    public ResponseIntent negotiate(Resource resource, HttpHeaders requestHeaders, HttpHeaders responseHeaders) {
        String etag = etag(resource);

        HttpHeaders headers = new HttpHeaders();
        headers.addAll(responseHeaders);
        headers.setETag(etag);
        headers.setLastModified(resource.lastModified());
        headers.setCacheControl(config.cacheControl());

        if (!isNotModified(resource, etag, requestHeaders)) {
            return ResponseIntent.full(headers, false);
        }

        headers.remove(HttpHeaders.CONTENT_TYPE);
        headers.remove(HttpHeaders.CONTENT_LENGTH);
        headers.remove(HttpHeaders.CONTENT_ENCODING);
        headers.remove(HttpHeaders.CONTENT_RANGE);
        return ResponseIntent.withoutBody(304, headers);
    }

    private static boolean isNotModified(Resource resource, String etag, HttpHeaders requestHeaders) {
        String ifNoneMatch = requestHeaders.getFirst(HttpHeaders.IF_NONE_MATCH);
        if (ifNoneMatch != null && ifNoneMatch.trim().equals(etag)) {
            return true;
        }

        Instant modified = HttpDates.toHttpPrecision(resource.lastModified());
        return HttpDates.parse(requestHeaders.getFirst(HttpHeaders.IF_MODIFIED_SINCE))
                .map(since -> !since.isBefore(modified))
                .orElse(false);
    }
}
