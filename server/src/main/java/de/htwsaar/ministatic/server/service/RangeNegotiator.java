package de.htwsaar.ministatic.server.service;

import de.htwsaar.ministatic.server.domain.BodyStrategy;
import de.htwsaar.ministatic.server.domain.ByteRange;
import de.htwsaar.ministatic.server.domain.RangeParseResult;
import de.htwsaar.ministatic.server.domain.RangeParser;
import de.htwsaar.ministatic.server.domain.Resource;
import de.htwsaar.ministatic.server.domain.ResponseIntent;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.util.MimeTypeUtils;

/**
 * Entscheidet bei vorhandenem {@code Range}-Header zwischen 206 (ein oder mehrere Bereiche),
 * 416 und (wenn {@code If-Range} eine Änderung anzeigt) der vollständigen Antwort.
 */
@Component
public class RangeNegotiator {

    private static final Logger log = LoggerFactory.getLogger(RangeNegotiator.class);

    static final String MULTIPART_BYTERANGES = "multipart/byteranges; boundary=";

    private final RangeParser rangeParser;
    private final ContentEncoder contentEncoder;

    /**
     * Constructor Injection.
     *
     * @param rangeParser    Port für die Header-Syntax (darf nicht {@code null} sein)
     * @param contentEncoder Fallback, wenn der Bereich verworfen wird (darf nicht {@code null} sein)
     */
    public RangeNegotiator(RangeParser rangeParser, ContentEncoder contentEncoder) {
        this.rangeParser = Objects.requireNonNull(rangeParser, "rangeParser must not be null");
        this.contentEncoder = Objects.requireNonNull(contentEncoder, "contentEncoder must not be null");
    }

    /**
     * @param full           vorläufige 200-Entscheidung inkl. Validatoren
     * @param resource       aufgelöste Ressource
     * @param requestHeaders Header der Anfrage, enthält {@code Range}
     * @return 206-Entscheidung oder vollständige Antwort bei veraltetem {@code If-Range}
     * @throws StaticFileException RANGE_NOT_SATISFIABLE bei unerfüllbarem oder fehlerhaftem Header
     */
    public ResponseIntent negotiate(ResponseIntent full, Resource resource, HttpHeaders requestHeaders) {
        if (full.strategy() != BodyStrategy.FULL) {
            throw new IllegalArgumentException("range selection starts from a full response");
        }

        String rangeHeader = requestHeaders.getFirst(HttpHeaders.RANGE);
        RangeParseResult parsed = rangeParser.parse(resource.size(), rangeHeader);
        if (!parsed.satisfiable()) {
            log.debug("Range '{}' is {} for size {}", rangeHeader, parsed.status(), resource.size());
            throw StaticFileException.rangeNotSatisfiable(rangeHeader, resource.size());
        }

        String etag = full.headers().getETag();
        if (changedSince(requestHeaders.getFirst(HttpHeaders.IF_RANGE), resource, etag)) {
            log.debug("If-Range does not match {}, sending full response", etag);
            return contentEncoder.negotiate(full, requestHeaders);
        }

        List<ByteRange> ranges = parsed.ranges();
        HttpHeaders headers = full.mutableHeaders();

        if (ranges.size() == 1) {
            ByteRange range = ranges.get(0);
            headers.set(HttpHeaders.CONTENT_RANGE, range.contentRange(resource.size()));
            headers.setContentLength(range.length());
            return ResponseIntent.singleRange(headers, range);
        }

        String partContentType = full.headers().getFirst(HttpHeaders.CONTENT_TYPE);
        String boundary = MimeTypeUtils.generateMultipartBoundaryString();
        headers.set(HttpHeaders.CONTENT_TYPE, MULTIPART_BYTERANGES + boundary);
        headers.remove(HttpHeaders.CONTENT_LENGTH);
        return ResponseIntent.multipart(
                headers,
                ranges,
                new ResponseIntent.Multipart(
                        boundary, partContentType != null ? partContentType : "application/octet-stream"));
    }

    /**
     * {@code If-Range} als Frische-Wächter: Datum älter als die Ressource oder
     * fremdes ETag bedeuten "geändert".
     *
     * @param ifRange  Header-Wert, darf {@code null} sein
     * @param resource Ressource
     * @param etag     aktuelles ETag
     * @return {@code true}, wenn der Bereich ignoriert werden muss
     */
    static boolean changedSince(String ifRange, Resource resource, String etag) {
        if (ifRange == null || ifRange.isBlank()) return false;

        Optional<Instant> date = HttpDates.parse(ifRange);
        if (date.isPresent()) {
            return date.get().isBefore(HttpDates.toHttpPrecision(resource.lastModified()));
        }
        return !ifRange.trim().equals(etag);
    }
}
