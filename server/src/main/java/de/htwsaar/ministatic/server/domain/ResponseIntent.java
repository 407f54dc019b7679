package de.htwsaar.ministatic.server.domain;

import java.util.List;
import java.util.Objects;
import org.springframework.http.HttpHeaders;

/**
 * Entscheidung der Negotiation für eine Anfrage: Status, Header und Body-Strategie.
 *
 * <p>Die Header werden beim Erzeugen kopiert und schreibgeschützt abgelegt; ein Intent
 * wird nach dem Erzeugen nicht mehr verändert.</p>
 *
 * @param status   HTTP-Statuscode
 * @param headers  vollständiger Header-Satz der Antwort
 * @param strategy Body-Strategie
 * @param ranges    zu sendende Byte-Fenster (nur bei SINGLE_RANGE/MULTIPART)
 * @param multipart Rahmendaten der Teile (nur bei MULTIPART, sonst {@code null})
 */
public record ResponseIntent(
        int status, HttpHeaders headers, BodyStrategy strategy, List<ByteRange> ranges, Multipart multipart) {

    /**
     * @param boundary        Boundary-Token ohne führende Bindestriche
     * @param partContentType Content-Type der Ressource für die Kopfzeilen jedes Teils
     */
    public record Multipart(String boundary, String partContentType) {

        public Multipart {
            Objects.requireNonNull(boundary, "boundary must not be null");
            Objects.requireNonNull(partContentType, "partContentType must not be null");
        }
    }

    public ResponseIntent {
        Objects.requireNonNull(headers, "headers must not be null");
        Objects.requireNonNull(strategy, "strategy must not be null");
        headers = HttpHeaders.readOnlyHttpHeaders(copyOf(headers));
        ranges = ranges == null ? List.of() : List.copyOf(ranges);
        if (strategy == BodyStrategy.MULTIPART && (multipart == null || ranges.size() < 2)) {
            throw new IllegalArgumentException("multipart needs a boundary and at least two ranges");
        }
        if (strategy == BodyStrategy.SINGLE_RANGE && ranges.size() != 1) {
            throw new IllegalArgumentException("single range needs exactly one range");
        }
    }

    public static ResponseIntent withoutBody(int status, HttpHeaders headers) {
        return new ResponseIntent(status, headers, BodyStrategy.NONE, List.of(), null);
    }

    public static ResponseIntent full(HttpHeaders headers, boolean gzip) {
        return new ResponseIntent(200, headers, gzip ? BodyStrategy.FULL_GZIP : BodyStrategy.FULL, List.of(), null);
    }

    public static ResponseIntent singleRange(HttpHeaders headers, ByteRange range) {
        return new ResponseIntent(206, headers, BodyStrategy.SINGLE_RANGE, List.of(range), null);
    }

    public static ResponseIntent multipart(HttpHeaders headers, List<ByteRange> ranges, Multipart multipart) {
        return new ResponseIntent(206, headers, BodyStrategy.MULTIPART, ranges, multipart);
    }

    /** Veränderbare Kopie, z. B. als Ausgangspunkt der nächsten Stufe. */
    public HttpHeaders mutableHeaders() {
        return copyOf(headers);
    }

    private static HttpHeaders copyOf(HttpHeaders source) {
        HttpHeaders copy = new HttpHeaders();
        copy.addAll(source);
        return copy;
    }
}
